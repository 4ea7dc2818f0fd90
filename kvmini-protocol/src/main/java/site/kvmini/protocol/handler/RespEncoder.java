package site.kvmini.protocol.handler;

import io.netty.channel.ChannelHandler;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;

/**
 * RESP 编码器，无状态，可在多个管道间共享。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@ChannelHandler.Sharable
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected ByteBuf allocateBuffer(ChannelHandlerContext ctx, Resp msg, boolean preferDirect) {
        final int estimatedSize = estimateMessageSize(msg);
        return preferDirect
                ? ctx.alloc().ioBuffer(estimatedSize)
                : ctx.alloc().heapBuffer(estimatedSize);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Resp msg, ByteBuf out) {
        msg.encode(out);
    }

    private static int estimateMessageSize(final Resp msg) {
        if (msg instanceof BulkString) {
            final BulkString bulkString = (BulkString) msg;
            return bulkString.isNull() ? 5 : bulkString.getContent().length() + 16;
        } else if (msg instanceof RespArray) {
            final RespArray array = (RespArray) msg;
            if (array.isNull()) {
                return 5;
            }
            int totalSize = 16;
            for (final Resp element : array.getContent()) {
                totalSize += estimateMessageSize(element);
            }
            return totalSize;
        }
        return 32;
    }
}
