package site.kvmini.datastructure;

/**
 * 值的类型，名称与 TYPE 命令的返回一致。
 *
 * @author hnfy258
 * @since 1.0
 */
public enum DataType {
    STRING("string"),
    LIST("list"),
    HASH("hash");

    private final String typeName;

    DataType(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
