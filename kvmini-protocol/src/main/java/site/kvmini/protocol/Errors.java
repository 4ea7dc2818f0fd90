package site.kvmini.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误帧 {@code -text\r\n}。
 *
 * <p>内容包含错误前缀，例如 {@code ERR unknown command} 或 {@code WRONGTYPE ...}。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class Errors extends Resp {

    private final String content;

    public Errors(String content) {
        // 错误文本只占一行
        this.content = content.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void encode(ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Errors && content.equals(((Errors) o).content);
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return "-" + content;
    }
}
