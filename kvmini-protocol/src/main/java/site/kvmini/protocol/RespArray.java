package site.kvmini.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * 数组帧 {@code *count\r\n...}，内容为 null 时编码为 {@code *-1\r\n}。
 *
 * <p>命令请求和 AOF 记录都是由批量字符串组成的数组。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class RespArray extends Resp {
    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes();
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes();

    public static final RespArray EMPTY = new RespArray(new Resp[0]);
    public static final RespArray NULL = new RespArray((Resp[]) null);

    private final Resp[] content;

    public RespArray(final Resp[] content) {
        this.content = content;
    }

    public static RespArray valueOf(final Resp[] content) {
        if (content == null) {
            return NULL;
        }
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    public static RespArray valueOf(final List<? extends Resp> content) {
        return valueOf(content.toArray(new Resp[0]));
    }

    /**
     * 由字符串构造命令数组，主要用于测试和内部生成的命令。
     */
    public static RespArray command(final String... parts) {
        final Resp[] array = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            array[i] = BulkString.fromString(parts[i]);
        }
        return new RespArray(array);
    }

    public boolean isNull() {
        return content == null;
    }

    public int size() {
        return content == null ? 0 : content.length;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_ARRAY_BYTES);
            return;
        }
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }
        byteBuf.writeByte('*');
        writeLongAsBytes(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RespArray && Arrays.equals(content, ((RespArray) o).content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "*-1" : Arrays.toString(content);
    }
}
