package site.kvmini.protocol;

/**
 * 协议错误：输入字节流不符合 RESP 规范。
 *
 * <p>抛出后当前连接应当回复错误并关闭，其他连接不受影响。
 * 继承 {@link IllegalArgumentException}，消息文本可以直接拼接到 {@code -ERR Protocol error: } 之后返回给客户端。
 *
 * @author hnfy258
 * @since 1.0
 */
public class ProtocolException extends IllegalArgumentException {

    private final long offset;

    public ProtocolException(String message) {
        this(message, -1);
    }

    public ProtocolException(String message, long offset) {
        super(message);
        this.offset = offset;
    }

    /**
     * @return 出错帧在输入中的起始偏移，未知时为 -1
     */
    public long getOffset() {
        return offset;
    }

    /**
     * @return 返回给客户端的错误文本
     */
    public String toErrorReply() {
        return "ERR Protocol error: " + getMessage();
    }
}
