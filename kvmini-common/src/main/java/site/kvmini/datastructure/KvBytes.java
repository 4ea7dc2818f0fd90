package site.kvmini.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变字节序列，用作键、值、频道名等二进制安全数据的统一载体。
 *
 * <p>主要特点：
 * <ul>
 *   <li>构造时预计算哈希值，适合作为 HashMap 的键
 *   <li>字符串表示延迟初始化并缓存
 *   <li>受信任场景提供零拷贝构造，避免重复复制
 * </ul>
 *
 * <p>线程安全性：本类不可变，线程安全。
 *
 * @author hnfy258
 * @since 1.0
 */
public final class KvBytes implements Comparable<KvBytes> {

    /**
     * 字符串编码解码使用的字符集。
     */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    public static final KvBytes EMPTY = new KvBytes(new byte[0], true);

    private final byte[] bytes;

    private final int hashCode;

    /**
     * 延迟初始化的字符串值。
     */
    private volatile String stringValue;

    /**
     * 创建实例并对参数做防御性拷贝。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public KvBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private KvBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝构造。
     *
     * <p><b>警告</b>：调用者必须保证参数数组在实例生命周期内不被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return 实例，输入为null时返回null
     */
    public static KvBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new KvBytes(trustedBytes, true);
    }

    /**
     * 以 UTF-8 编码字符串创建实例。
     *
     * @param str 源字符串
     * @return 实例，输入为null时返回null
     */
    public static KvBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final KvBytes result = new KvBytes(str.getBytes(CHARSET), true);
        result.stringValue = str;
        return result;
    }

    /**
     * 获取底层字节数组的副本。
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层字节数组的直接引用，调用者不得修改返回的数组。
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * ASCII 大小写不敏感比较，用于命令名匹配。
     *
     * @param other 另一个实例
     * @return 忽略大小写后是否相等
     */
    public boolean equalsIgnoreCase(final KvBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || bytes.length != other.bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLower(bytes[i]) != toLower(other.bytes[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * 返回 ASCII 大写形式的字符串，命令表以此为键。
     */
    public String toUpperCaseString() {
        final byte[] upper = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            final byte b = bytes[i];
            upper[i] = (b >= 'a' && b <= 'z') ? (byte) (b - 32) : b;
        }
        return new String(upper, CHARSET);
    }

    private static byte toLower(final byte b) {
        return (b >= 'A' && b <= 'Z') ? (byte) (b + 32) : b;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final KvBytes other = (KvBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("KvBytes[length=").append(bytes.length);
        if (bytes.length <= 32) {
            sb.append(", preview='");
            for (int i = 0; i < Math.min(bytes.length, 16); i++) {
                final byte b = bytes[i];
                if (b >= 32 && b <= 126) {
                    sb.append((char) b);
                } else {
                    sb.append("\\x").append(String.format("%02x", b & 0xFF));
                }
            }
            if (bytes.length > 16) {
                sb.append("...");
            }
            sb.append("'");
        }
        sb.append("]");
        return sb.toString();
    }

    /**
     * 按无符号字节做字典序比较，较短的前缀排在前面。
     */
    @Override
    public int compareTo(final KvBytes other) {
        if (this == other) {
            return 0;
        }
        final byte[] otherBytes = other.bytes;
        final int minLength = Math.min(bytes.length, otherBytes.length);
        for (int i = 0; i < minLength; i++) {
            final int a = bytes[i] & 0xFF;
            final int b = otherBytes[i] & 0xFF;
            if (a != b) {
                return a - b;
            }
        }
        return Integer.compare(bytes.length, otherBytes.length);
    }
}
