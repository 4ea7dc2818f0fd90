package site.kvmini.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import site.kvmini.datastructure.KvBytes;

import java.util.Objects;

/**
 * 批量字符串帧 {@code $len\r\nbytes\r\n}，内容为 null 时编码为 {@code $-1\r\n}。
 *
 * <p>内容使用 {@link KvBytes} 保存，二进制安全。
 * 外部数据使用 {@link #create(byte[])} 保证安全，内部可信路径使用 {@link #wrapTrusted(byte[])} 避免拷贝。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class BulkString extends Resp {
    /** 空值的RESP编码 */
    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes();

    /** 空字符串的RESP编码 */
    private static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes();

    public static final BulkString NULL = new BulkString(null);

    /** 字符串内容，null 表示空值 */
    private final KvBytes content;

    public BulkString(final KvBytes content) {
        this.content = content;
    }

    /**
     * 安全模式：复制输入的字节数组。
     */
    public static BulkString create(final byte[] content) {
        return content == null ? NULL : new BulkString(new KvBytes(content));
    }

    public static BulkString create(final KvBytes content) {
        return content == null ? NULL : new BulkString(content);
    }

    /**
     * 零拷贝工厂方法，调用者必须保证数组之后不被修改。
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        return trustedBytes == null ? NULL : new BulkString(KvBytes.wrapTrusted(trustedBytes));
    }

    public static BulkString fromString(final String str) {
        return str == null ? NULL : new BulkString(KvBytes.fromString(str));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }
        final byte[] bytes = content.getBytesUnsafe();
        if (bytes.length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }
        byteBuf.ensureWritable(bytes.length + 16);
        byteBuf.writeByte('$');
        writeLongAsBytes(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof BulkString && Objects.equals(content, ((BulkString) o).content);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(content);
    }

    /**
     * @return 字符串内容，空值时返回 null
     */
    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
