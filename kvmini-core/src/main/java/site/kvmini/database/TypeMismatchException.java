package site.kvmini.database;

/**
 * 对键执行了与其值类型不符的操作。
 *
 * @author hnfy258
 * @since 1.0
 */
public class TypeMismatchException extends RuntimeException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public TypeMismatchException() {
        super(MESSAGE);
    }
}
