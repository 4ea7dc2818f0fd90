package site.kvmini.rdb.crc;

/**
 * Redis 兼容的 CRC64（Jones 多项式，反射输入输出，初始值 0，不做最终取反）。
 *
 * <p>校验值：{@code crc64("123456789") == 0xe9c6d914c4b8d9caL}。
 *
 * <pre>{@code
 * long crc = Crc64.INITIAL_CRC;
 * crc = Crc64.crc64(crc, data1, 0, data1.length);
 * crc = Crc64.crc64(crc, data2, 0, data2.length);
 * }</pre>
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class Crc64 {

    /** 反射形式的 Jones 多项式 */
    private static final long POLY = 0x95ac9329ac4bc9b5L;

    private static final long[] TABLE = new long[256];

    public static final long INITIAL_CRC = 0L;

    static {
        for (int i = 0; i < 256; i++) {
            long crc = i;
            for (int j = 0; j < 8; j++) {
                if ((crc & 1) != 0) {
                    crc = (crc >>> 1) ^ POLY;
                } else {
                    crc >>>= 1;
                }
            }
            TABLE[i] = crc;
        }
    }

    private Crc64() {
        throw new UnsupportedOperationException("工具类不允许实例化");
    }

    /**
     * 增量计算 CRC64。
     *
     * @param crc    之前的结果，首次使用 {@link #INITIAL_CRC}
     * @param data   数据
     * @param offset 起始偏移
     * @param length 长度
     * @return 更新后的 CRC64
     */
    public static long crc64(long crc, byte[] data, int offset, int length) {
        if (data == null) {
            throw new IllegalArgumentException("数据不能为null");
        }
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IllegalArgumentException("无效的偏移量或长度参数");
        }
        for (int i = offset; i < offset + length; i++) {
            crc = TABLE[(int) ((crc ^ data[i]) & 0xFF)] ^ (crc >>> 8);
        }
        return crc;
    }

    public static long crc64(byte[] data) {
        return crc64(INITIAL_CRC, data, 0, data.length);
    }
}
