package site.kvmini.datastructure;

import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;

import java.util.Collections;
import java.util.List;

/**
 * 字符串值，二进制安全。
 *
 * @author hnfy258
 * @since 1.0
 */
public class KvString implements KvData {

    private static final BulkString SET = BulkString.fromString("SET");

    private KvBytes value;

    public KvString(KvBytes value) {
        this.value = value;
    }

    public static KvString of(String value) {
        return new KvString(KvBytes.fromString(value));
    }

    public KvBytes getValue() {
        return value;
    }

    public void setValue(KvBytes value) {
        this.value = value;
    }

    /**
     * 追加内容。
     *
     * @return 追加后的长度
     */
    public int append(KvBytes suffix) {
        final byte[] current = value.getBytesUnsafe();
        final byte[] tail = suffix.getBytesUnsafe();
        final byte[] merged = new byte[current.length + tail.length];
        System.arraycopy(current, 0, merged, 0, current.length);
        System.arraycopy(tail, 0, merged, current.length, tail.length);
        value = KvBytes.wrapTrusted(merged);
        return merged.length;
    }

    @Override
    public DataType type() {
        return DataType.STRING;
    }

    @Override
    public List<RespArray> toCommands(KvBytes key) {
        return Collections.singletonList(new RespArray(new Resp[]{
                SET, BulkString.create(key), BulkString.create(value)
        }));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KvString && value.equals(((KvString) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "KvString(" + value.getString() + ")";
    }
}
