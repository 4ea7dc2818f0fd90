package site.kvmini.rdb;

import java.nio.charset.StandardCharsets;

/**
 * RDB 文件格式常量。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public final class RdbConstants {

    private RdbConstants() {
    }

    public static final byte[] MAGIC = "REDIS0009".getBytes(StandardCharsets.US_ASCII);

    public static final int CHECKSUM_LENGTH = 8;

    // ========== 操作码 ==========

    public static final int OPCODE_AUX = 0xFA;

    public static final int OPCODE_RESIZEDB = 0xFB;

    public static final int OPCODE_EXPIRETIME_MS = 0xFC;

    /** 秒级过期时间，只在读取旧文件时出现 */
    public static final int OPCODE_EXPIRETIME = 0xFD;

    public static final int OPCODE_SELECTDB = 0xFE;

    public static final int OPCODE_EOF = 0xFF;

    // ========== 值类型 ==========

    public static final int TYPE_STRING = 0;

    public static final int TYPE_LIST = 1;

    public static final int TYPE_HASH = 4;

    // ========== 长度编码 ==========

    public static final int LEN_6BIT = 0;

    public static final int LEN_14BIT = 1;

    public static final int LEN_32BIT = 0x80;

    public static final int LEN_64BIT = 0x81;

    public static final int LEN_ENCVAL = 3;

    public static final int ENC_INT8 = 0;

    public static final int ENC_INT16 = 1;

    public static final int ENC_INT32 = 2;
}
