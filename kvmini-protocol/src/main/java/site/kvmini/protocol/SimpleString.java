package site.kvmini.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 简单字符串帧 {@code +text\r\n}，常用于状态回复。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class SimpleString extends Resp {
    public static final SimpleString OK = new SimpleString("OK");
    public static final SimpleString PONG = new SimpleString("PONG");

    private final String content;

    private final byte[] contentBytes;

    public SimpleString(final String content) {
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("简单字符串不能包含换行符");
        }
        this.content = content;
        this.contentBytes = content.getBytes(StandardCharsets.UTF_8);
    }

    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        } else if ("PONG".equals(content)) {
            return PONG;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(contentBytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SimpleString && content.equals(((SimpleString) o).content);
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return "+" + content;
    }
}
