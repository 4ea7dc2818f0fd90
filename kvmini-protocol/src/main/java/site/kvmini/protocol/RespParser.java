package site.kvmini.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.List;

/**
 * 可恢复的增量解析器。
 *
 * <p>字节可以按任意大小分块喂入，不完整的尾部保留到下一次 {@link #feed(ByteBuf)}。
 * 解析器不会阻塞，也不假设一个帧在一次读取中到达。
 * Netty 管道中的 {@link site.kvmini.protocol.handler.RespDecoder} 依赖
 * {@code ByteToMessageDecoder} 自己的累积缓冲区，本类用于管道之外的场景，比如 AOF 回放。
 *
 * <p>非线程安全。
 *
 * @author hnfy258
 * @since 1.0
 */
public class RespParser implements AutoCloseable {

    private final ByteBuf buffer = Unpooled.buffer(4096);

    private final long maxBulkLen;

    /** 已经解析成完整帧的字节总数 */
    private long consumed;

    public RespParser() {
        this(Resp.DEFAULT_MAX_BULK_LEN);
    }

    public RespParser(long maxBulkLen) {
        this.maxBulkLen = maxBulkLen;
    }

    /**
     * 追加字节并取出所有已经完整的帧。
     *
     * @param data 新到达的字节，读索引会被推进到末尾
     * @return 完整的帧，可能为空列表
     * @throws ProtocolException 遇到格式错误，之前已经完整的帧仍可通过 {@link #next()} 取得
     */
    public List<Resp> feed(ByteBuf data) {
        append(data);
        final List<Resp> frames = new ArrayList<>();
        Resp frame;
        while ((frame = next()) != null) {
            frames.add(frame);
        }
        return frames;
    }

    public List<Resp> feed(byte[] data) {
        return feed(Unpooled.wrappedBuffer(data));
    }

    /**
     * 只追加字节，不解析。
     */
    public void append(ByteBuf data) {
        buffer.writeBytes(data);
    }

    /**
     * 取出下一个完整的帧。
     *
     * @return 帧，数据不足时返回 null
     * @throws ProtocolException 格式错误，出错的字节保留在缓冲区中
     */
    public Resp next() {
        final int before = buffer.readerIndex();
        final Resp frame;
        try {
            frame = Resp.decode(buffer, maxBulkLen);
        } catch (ProtocolException e) {
            throw new ProtocolException(e.getMessage(), consumed);
        }
        if (frame == null) {
            buffer.discardSomeReadBytes();
            return null;
        }
        consumed += buffer.readerIndex() - before;
        return frame;
    }

    /**
     * @return 尚未组成完整帧的字节数
     */
    public int remaining() {
        return buffer.readableBytes();
    }

    /**
     * @return 已经解析成完整帧的字节总数
     */
    public long consumed() {
        return consumed;
    }

    @Override
    public void close() {
        buffer.release();
    }
}
