package site.kvmini.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.ProtocolException;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 解码器。
 *
 * <p>请求模式下（服务端使用）：
 * <ul>
 *     <li>以 {@code *} 开头的输入按 RESP 数组解析，其余按 inline 命令（空白分隔、支持引号）解析</li>
 *     <li>每个请求必须是非空数组且元素都是非空批量字符串</li>
 *     <li>格式错误时抛出 {@link ProtocolException}，此后丢弃该连接上的所有输入</li>
 * </ul>
 * 异常由 {@code ByteToMessageDecoder} 在已解码的帧之后向下游传播，
 * 所以错误回复排在之前请求的回复后面。
 *
 * <p>客户端模式下接受任意帧。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {
    private static final int MAX_INLINE_LENGTH = 64 * 1024;

    private final long maxBulkLen;

    private final boolean requestMode;

    /** 出现协议错误后丢弃后续输入 */
    private boolean failed;

    public RespDecoder() {
        this(Resp.DEFAULT_MAX_BULK_LEN, false);
    }

    public RespDecoder(long maxBulkLen, boolean requestMode) {
        this.maxBulkLen = maxBulkLen;
        this.requestMode = requestMode;
    }

    public static RespDecoder forRequests(long maxBulkLen) {
        return new RespDecoder(maxBulkLen, true);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        try {
            while (in.isReadable()) {
                final byte firstByte = in.getByte(in.readerIndex());
                if (!requestMode) {
                    final Resp resp = Resp.decode(in, maxBulkLen);
                    if (resp == null) {
                        return;
                    }
                    out.add(resp);
                    continue;
                }
                // 跳过请求之间多余的换行
                if (firstByte == '\r' || firstByte == '\n') {
                    in.skipBytes(1);
                    continue;
                }
                final Resp request = firstByte == '*'
                        ? Resp.decode(in, maxBulkLen)
                        : decodeInlineCommand(in);
                if (request == null) {
                    return;
                }
                validateRequest(request);
                out.add(request);
            }
        } catch (ProtocolException e) {
            failed = true;
            log.debug("协议错误，丢弃剩余输入: {}", e.getMessage());
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }

    private static void validateRequest(Resp request) {
        final RespArray array = (RespArray) request;
        if (array.isNull() || array.size() == 0) {
            throw new ProtocolException("empty or null request");
        }
        for (Resp element : array.getContent()) {
            if (!(element instanceof BulkString) || ((BulkString) element).isNull()) {
                throw new ProtocolException("expected bulk string in request, got " + element);
            }
        }
    }

    /**
     * 解析一行 inline 命令。
     *
     * @return 命令数组，行不完整时返回 null
     */
    private Resp decodeInlineCommand(ByteBuf in) {
        final int startIndex = in.readerIndex();
        final int newline = in.indexOf(startIndex, in.writerIndex(), (byte) '\n');
        if (newline < 0) {
            if (in.readableBytes() > MAX_INLINE_LENGTH) {
                throw new ProtocolException("too big inline request");
            }
            return null;
        }
        int end = newline;
        if (end > startIndex && in.getByte(end - 1) == '\r') {
            end--;
        }
        final byte[] line = new byte[end - startIndex];
        in.getBytes(startIndex, line);
        in.readerIndex(newline + 1);

        final List<byte[]> parts = splitArgs(line);
        if (parts.isEmpty()) {
            // 空行没有请求，继续解析后面的字节
            return decodeNext(in);
        }
        final Resp[] result = new Resp[parts.size()];
        for (int i = 0; i < parts.size(); i++) {
            result[i] = BulkString.wrapTrusted(parts.get(i));
        }
        return new RespArray(result);
    }

    private Resp decodeNext(ByteBuf in) {
        while (in.isReadable()) {
            final byte b = in.getByte(in.readerIndex());
            if (b == '\r' || b == '\n') {
                in.skipBytes(1);
                continue;
            }
            return b == '*' ? Resp.decode(in, maxBulkLen) : decodeInlineCommand(in);
        }
        return null;
    }

    /**
     * 按空白切分参数，支持双引号（含 \n \r \t \xHH 等转义）和单引号。
     */
    static List<byte[]> splitArgs(byte[] line) {
        final List<byte[]> parts = new ArrayList<>();
        int i = 0;
        while (true) {
            while (i < line.length && isSpace(line[i])) {
                i++;
            }
            if (i >= line.length) {
                return parts;
            }
            final ByteArrayOutputStream current = new ByteArrayOutputStream();
            boolean inDouble = false;
            boolean inSingle = false;
            boolean done = false;
            while (!done) {
                if (inDouble) {
                    if (i >= line.length) {
                        throw new ProtocolException("unbalanced quotes in request");
                    }
                    final byte b = line[i];
                    if (b == '\\' && i + 3 < line.length && line[i + 1] == 'x'
                            && isHex(line[i + 2]) && isHex(line[i + 3])) {
                        current.write(Integer.parseInt(new String(line, i + 2, 2), 16));
                        i += 3;
                    } else if (b == '\\' && i + 1 < line.length) {
                        i++;
                        switch (line[i]) {
                            case 'n': current.write('\n'); break;
                            case 'r': current.write('\r'); break;
                            case 't': current.write('\t'); break;
                            case 'b': current.write('\b'); break;
                            case 'a': current.write(7); break;
                            default: current.write(line[i]); break;
                        }
                    } else if (b == '"') {
                        if (i + 1 < line.length && !isSpace(line[i + 1])) {
                            throw new ProtocolException("unbalanced quotes in request");
                        }
                        done = true;
                    } else {
                        current.write(b);
                    }
                } else if (inSingle) {
                    if (i >= line.length) {
                        throw new ProtocolException("unbalanced quotes in request");
                    }
                    final byte b = line[i];
                    if (b == '\\' && i + 1 < line.length && line[i + 1] == '\'') {
                        i++;
                        current.write('\'');
                    } else if (b == '\'') {
                        if (i + 1 < line.length && !isSpace(line[i + 1])) {
                            throw new ProtocolException("unbalanced quotes in request");
                        }
                        done = true;
                    } else {
                        current.write(b);
                    }
                } else {
                    if (i >= line.length) {
                        done = true;
                        continue;
                    }
                    final byte b = line[i];
                    if (isSpace(b)) {
                        done = true;
                    } else if (b == '"') {
                        inDouble = true;
                    } else if (b == '\'') {
                        inSingle = true;
                    } else {
                        current.write(b);
                    }
                }
                if (i < line.length) {
                    i++;
                }
            }
            parts.add(current.toByteArray());
        }
    }

    private static boolean isSpace(byte b) {
        return b == ' ' || b == '\t' || b == '\r' || b == '\n';
    }

    private static boolean isHex(byte b) {
        return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'f') || (b >= 'A' && b <= 'F');
    }
}
