package site.kvmini.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 协议帧的基类。
 *
 * <p>子类对应五种帧：简单字符串 {@code +}、错误 {@code -}、整数 {@code :}、
 * 批量字符串 {@code $}（可为 null）、数组 {@code *}（可为 null）。帧构造后不可变。
 *
 * <p>{@link #decode(ByteBuf)} 是可恢复的：数据不完整时回滚读索引并返回 null，
 * 调用者在收到更多字节后重新调用即可；格式错误抛出 {@link ProtocolException}。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 默认的批量字符串最大长度 512MB */
    public static final long DEFAULT_MAX_BULK_LEN = 512L * 1024 * 1024;

    /** 数组最大元素数 */
    public static final int MAX_ARRAY_LEN = 1024 * 1024;

    /** 简单字符串和错误帧一行的最大长度，与 inline 命令相同 */
    static final int MAX_LINE_LEN = 64 * 1024;

    /** 数字字段最多 20 个字符 */
    private static final int MAX_NUMBER_LEN = 20;

    /** 数组最大嵌套深度 */
    private static final int MAX_NESTING_DEPTH = 32;

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[512][];

    private static final int MAX_CACHED_NUMBER = 255;

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + 256] = String.valueOf(-i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 数据不完整的内部信号，不携带堆栈。
     */
    private static final class Incomplete extends RuntimeException {
        private static final Incomplete INSTANCE = new Incomplete();

        private Incomplete() {
            super(null, null, false, false);
        }
    }

    /**
     * 把帧编码为 RESP 字节写入缓冲区。
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    protected static void writeLongAsBytes(ByteBuf buf, long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + 256]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 使用默认的批量字符串长度上限解码。
     *
     * @see #decode(ByteBuf, long)
     */
    public static Resp decode(ByteBuf buffer) {
        return decode(buffer, DEFAULT_MAX_BULK_LEN);
    }

    /**
     * 从缓冲区解码一个完整的帧。
     *
     * @param buffer     输入缓冲区
     * @param maxBulkLen 批量字符串允许的最大长度
     * @return 解码后的帧，数据不完整时返回null且读索引保持不变
     * @throws ProtocolException 数据格式不符合 RESP 规范
     */
    public static Resp decode(ByteBuf buffer, long maxBulkLen) {
        if (!buffer.isReadable()) {
            return null;
        }
        final int initialIndex = buffer.readerIndex();
        try {
            return decodeFrame(buffer, maxBulkLen, 0);
        } catch (Incomplete e) {
            buffer.readerIndex(initialIndex);
            return null;
        } catch (ProtocolException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    private static Resp decodeFrame(ByteBuf buffer, long maxBulkLen, int depth) {
        if (!buffer.isReadable()) {
            throw Incomplete.INSTANCE;
        }
        final byte typeIndicator = buffer.readByte();
        switch (typeIndicator) {
            case '+':
                return SimpleString.valueOf(readLine(buffer));
            case '-':
                return new Errors(readLine(buffer));
            case ':':
                return RespInteger.valueOf(readNumber(buffer));
            case '$': {
                final long length = readNumber(buffer);
                if (length == -1) {
                    return BulkString.NULL;
                }
                if (length < 0 || length > maxBulkLen) {
                    throw new ProtocolException("invalid bulk length " + length);
                }
                final int len = (int) length;
                if (buffer.readableBytes() < len + 2) {
                    throw Incomplete.INSTANCE;
                }
                final byte[] content = new byte[len];
                buffer.readBytes(content);
                if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
                    throw new ProtocolException("bulk string not terminated by CRLF");
                }
                return BulkString.wrapTrusted(content);
            }
            case '*': {
                final long count = readNumber(buffer);
                if (count == -1) {
                    return RespArray.NULL;
                }
                if (count < 0 || count > MAX_ARRAY_LEN) {
                    throw new ProtocolException("invalid multibulk length " + count);
                }
                if (count == 0) {
                    return RespArray.EMPTY;
                }
                if (depth >= MAX_NESTING_DEPTH) {
                    throw new ProtocolException("nesting too deep");
                }
                // 每个元素至少一个字节，未到达的元素不预先分配
                final List<Resp> elements = new ArrayList<>((int) Math.min(count, buffer.readableBytes()));
                for (long i = 0; i < count; i++) {
                    elements.add(decodeFrame(buffer, maxBulkLen, depth + 1));
                }
                return new RespArray(elements.toArray(new Resp[0]));
            }
            default:
                throw new ProtocolException("unexpected type byte '" + printable(typeIndicator) + "'");
        }
    }

    /**
     * 在 {@code limit} 个字节内查找 CR，超过仍未找到时抛出协议错误。
     *
     * @return CR 的位置
     */
    private static int findCr(ByteBuf buffer, int limit, String tooLong) {
        final int startIndex = buffer.readerIndex();
        final int searchEnd = (int) Math.min(buffer.writerIndex(), (long) startIndex + limit + 1);
        final int endIndex = buffer.indexOf(startIndex, searchEnd, (byte) '\r');
        if (endIndex < 0) {
            if (searchEnd - startIndex > limit) {
                throw new ProtocolException(tooLong);
            }
            throw Incomplete.INSTANCE;
        }
        if (endIndex + 1 >= buffer.writerIndex()) {
            throw Incomplete.INSTANCE;
        }
        return endIndex;
    }

    /**
     * 读取到 CRLF 为止的一行文本，用于简单字符串和错误帧。
     */
    static String readLine(ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findCr(buffer, MAX_LINE_LEN, "line too long");
        if (buffer.indexOf(startIndex, endIndex, (byte) '\n') >= 0) {
            throw new ProtocolException("unexpected LF inside line");
        }
        final String result = buffer.toString(startIndex, endIndex - startIndex, StandardCharsets.UTF_8);
        buffer.readerIndex(endIndex);
        buffer.skipBytes(1);
        if (buffer.readByte() != '\n') {
            throw new ProtocolException("expected LF after CR");
        }
        return result;
    }

    /**
     * 读取到 CRLF 为止的有符号十进制整数，用于整数帧和长度前缀。
     */
    static long readNumber(ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = findCr(buffer, MAX_NUMBER_LEN, "number field too long");
        int i = startIndex;
        boolean negative = false;
        if (buffer.getByte(i) == '-') {
            negative = true;
            i++;
        }
        if (i == endIndex) {
            throw new ProtocolException("empty number field");
        }
        long value = 0;
        for (; i < endIndex; i++) {
            final byte b = buffer.getByte(i);
            if (b < '0' || b > '9') {
                throw new ProtocolException("invalid number field, unexpected '" + printable(b) + "'");
            }
            final int digit = b - '0';
            // 负数方向累加，能表示 Long.MIN_VALUE
            if (value < (Long.MIN_VALUE + digit) / 10) {
                throw new ProtocolException("number out of range");
            }
            value = value * 10 - digit;
        }
        if (!negative) {
            if (value == Long.MIN_VALUE) {
                throw new ProtocolException("number out of range");
            }
            value = -value;
        }
        buffer.readerIndex(endIndex + 1);
        if (buffer.readByte() != '\n') {
            throw new ProtocolException("expected LF after CR");
        }
        return value;
    }

    private static String printable(byte b) {
        if (b >= 32 && b <= 126) {
            return String.valueOf((char) b);
        }
        return String.format("\\x%02x", b & 0xFF);
    }
}
