package site.kvmini.rdb;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * RDB 长度、字符串和时间戳的编解码。
 *
 * <p>长度编码：
 * <ul>
 *     <li>0-63：1 字节，高 2 位为 00</li>
 *     <li>64-16383：2 字节，高 2 位为 01，大端</li>
 *     <li>32 位以内：0x80 后跟 4 字节大端</li>
 *     <li>更大：0x81 后跟 8 字节大端</li>
 * </ul>
 * 高 2 位为 11 表示字符串用整数编码，只在读取时支持。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class RdbUtils {

    private RdbUtils() {
    }

    public static void writeLength(DataOutputStream dos, long length) throws IOException {
        if (length < 0) {
            throw new IllegalArgumentException("长度不能为负: " + length);
        }
        if (length < (1 << 6)) {
            dos.writeByte((int) length);
        } else if (length < (1 << 14)) {
            dos.writeByte((int) ((length >>> 8) & 0x3F) | (RdbConstants.LEN_14BIT << 6));
            dos.writeByte((int) (length & 0xFF));
        } else if (length <= 0xFFFFFFFFL) {
            dos.writeByte(RdbConstants.LEN_32BIT);
            dos.writeInt((int) length);
        } else {
            dos.writeByte(RdbConstants.LEN_64BIT);
            dos.writeLong(length);
        }
    }

    public static long readLength(DataInputStream dis) throws IOException {
        return readLength(dis.readUnsignedByte(), dis);
    }

    public static void writeString(DataOutputStream dos, byte[] bytes) throws IOException {
        writeLength(dos, bytes.length);
        dos.write(bytes);
    }

    /**
     * 读取字符串，支持 8/16/32 位整数编码（小端）。
     *
     * @param maxLength 允许的最大长度，防止损坏的长度字段触发巨大分配
     */
    public static byte[] readString(DataInputStream dis, long maxLength) throws IOException {
        final int first = dis.readUnsignedByte();
        if ((first & 0xC0) >> 6 == RdbConstants.LEN_ENCVAL) {
            final long value;
            switch (first & 0x3F) {
                case RdbConstants.ENC_INT8:
                    value = dis.readByte();
                    break;
                case RdbConstants.ENC_INT16:
                    value = Short.reverseBytes(dis.readShort());
                    break;
                case RdbConstants.ENC_INT32:
                    value = Integer.reverseBytes(dis.readInt());
                    break;
                default:
                    throw new CorruptSnapshotException("不支持的字符串编码: 0x" + Integer.toHexString(first));
            }
            return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
        }
        final long length = readLength(first, dis);
        if (length > maxLength || length > Integer.MAX_VALUE - 8) {
            throw new CorruptSnapshotException("字符串长度超出文件范围: " + length);
        }
        final byte[] bytes = new byte[(int) length];
        dis.readFully(bytes);
        return bytes;
    }

    private static long readLength(int first, DataInputStream dis) throws IOException {
        switch ((first & 0xC0) >> 6) {
            case RdbConstants.LEN_6BIT:
                return first & 0x3F;
            case RdbConstants.LEN_14BIT:
                return ((first & 0x3F) << 8) | dis.readUnsignedByte();
            case RdbConstants.LEN_ENCVAL:
                throw new CorruptSnapshotException("此处不允许整数编码: 0x" + Integer.toHexString(first));
            default:
                if (first == RdbConstants.LEN_32BIT) {
                    return dis.readInt() & 0xFFFFFFFFL;
                }
                if (first == RdbConstants.LEN_64BIT) {
                    final long length = dis.readLong();
                    if (length < 0) {
                        throw new CorruptSnapshotException("长度溢出");
                    }
                    return length;
                }
                throw new CorruptSnapshotException("未知的长度编码: 0x" + Integer.toHexString(first));
        }
    }

    /**
     * 毫秒时间戳，小端 8 字节。
     */
    public static void writeMillis(DataOutputStream dos, long millis) throws IOException {
        dos.writeLong(Long.reverseBytes(millis));
    }

    public static long readMillis(DataInputStream dis) throws IOException {
        return Long.reverseBytes(dis.readLong());
    }

    /**
     * 秒级时间戳，小端 4 字节无符号。
     */
    public static long readSeconds(DataInputStream dis) throws IOException {
        return Integer.reverseBytes(dis.readInt()) & 0xFFFFFFFFL;
    }
}
