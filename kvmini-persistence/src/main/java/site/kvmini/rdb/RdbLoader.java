package site.kvmini.rdb;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.common.Clock;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvData;
import site.kvmini.datastructure.KvHash;
import site.kvmini.datastructure.KvList;
import site.kvmini.datastructure.KvString;
import site.kvmini.rdb.crc.Crc64InputStream;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * RDB 快照加载器。
 *
 * <p>边读边计算 CRC64，读到 EOF 标记后与末尾存储的校验和比较，不一致时整个快照作废。
 * 解析失败、截断或校验不通过都抛出 {@link CorruptSnapshotException}，不会返回部分数据。
 * 加载时已经过期的键直接丢弃。
 *
 * <p>{@link #read(InputStream, long)} 只消费到校验和为止，AOF 的 RDB 前导也用它读取。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RdbLoader {

    private final Clock clock;

    public RdbLoader(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param file 快照文件
     * @return 加载的数据，文件不存在时返回 null
     * @throws CorruptSnapshotException 文件损坏
     * @throws IOException              文件无法读取
     */
    public Snapshot load(final File file) throws IOException {
        if (!file.exists()) {
            log.info("RDB文件不存在: {}", file.getAbsolutePath());
            return null;
        }
        final long fileLength = file.length();
        final int minLength = RdbConstants.MAGIC.length + 1 + RdbConstants.CHECKSUM_LENGTH;
        if (fileLength < minLength) {
            throw new CorruptSnapshotException("RDB文件过短: " + fileLength + " 字节");
        }
        try (InputStream in = new BufferedInputStream(new FileInputStream(file))) {
            final Snapshot snapshot = read(in, fileLength);
            if (snapshot.getLength() != fileLength) {
                throw new CorruptSnapshotException("校验和之后还有 " + (fileLength - snapshot.getLength()) + " 字节");
            }
            log.info("RDB文件加载成功: {}，{} 个键，跳过 {} 个已过期的键",
                    file.getAbsolutePath(), snapshot.getData().size(), snapshot.getSkippedExpired());
            return snapshot;
        }
    }

    /**
     * 从流中读取一个完整的快照，读到校验和为止。
     *
     * @param in        输入流，读取位置在魔数处
     * @param maxLength 单个字符串允许的最大长度，一般取文件大小
     * @return 快照内容，{@link Snapshot#getLength()} 为消费的字节数
     * @throws CorruptSnapshotException 格式错误、截断或校验和不匹配
     */
    public Snapshot read(final InputStream in, final long maxLength) throws IOException {
        final Crc64InputStream crcStream = new Crc64InputStream(in);
        final DataInputStream dis = new DataInputStream(crcStream);
        try {
            final byte[] magic = new byte[RdbConstants.MAGIC.length];
            dis.readFully(magic);
            if (!Arrays.equals(magic, RdbConstants.MAGIC)) {
                throw new CorruptSnapshotException("RDB文件头不正确");
            }
            final EntryTables tables = readEntries(dis, maxLength);
            final long actual = crcStream.getCrc64();
            final long expected = crcStream.readChecksum();
            if (expected != actual) {
                throw new CorruptSnapshotException(String.format(
                        "CRC64校验失败，期望: 0x%x，实际: 0x%x", expected, actual));
            }
            return new Snapshot(tables.data, tables.expires, tables.skipped, crcStream.getCount());
        } catch (EOFException e) {
            throw new CorruptSnapshotException("RDB数据在校验和之前结束", e);
        }
    }

    private EntryTables readEntries(DataInputStream dis, long maxLength) throws IOException {
        final Map<KvBytes, KvData> data = new HashMap<>();
        final Map<KvBytes, Long> expires = new HashMap<>();
        final long now = clock.currentTimeMillis();
        long expireAt = -1;
        int skipped = 0;
        while (true) {
            final int opcode = dis.readUnsignedByte();
            switch (opcode) {
                case RdbConstants.OPCODE_EOF:
                    return new EntryTables(data, expires, skipped);
                case RdbConstants.OPCODE_SELECTDB:
                    final long db = RdbUtils.readLength(dis);
                    if (db != 0) {
                        throw new CorruptSnapshotException("只支持0号数据库，读取到: " + db);
                    }
                    break;
                case RdbConstants.OPCODE_RESIZEDB:
                    RdbUtils.readLength(dis);
                    RdbUtils.readLength(dis);
                    break;
                case RdbConstants.OPCODE_AUX:
                    RdbUtils.readString(dis, maxLength);
                    RdbUtils.readString(dis, maxLength);
                    break;
                case RdbConstants.OPCODE_EXPIRETIME_MS:
                    expireAt = RdbUtils.readMillis(dis);
                    break;
                case RdbConstants.OPCODE_EXPIRETIME:
                    expireAt = RdbUtils.readSeconds(dis) * 1000;
                    break;
                default:
                    final KvBytes key = KvBytes.wrapTrusted(RdbUtils.readString(dis, maxLength));
                    final KvData value = readValue(opcode, dis, maxLength);
                    if (expireAt != -1 && expireAt <= now) {
                        skipped++;
                    } else {
                        data.put(key, value);
                        if (expireAt != -1) {
                            expires.put(key, expireAt);
                        }
                    }
                    expireAt = -1;
                    break;
            }
        }
    }

    private KvData readValue(int type, DataInputStream dis, long maxLength) throws IOException {
        switch (type) {
            case RdbConstants.TYPE_STRING:
                return new KvString(KvBytes.wrapTrusted(RdbUtils.readString(dis, maxLength)));
            case RdbConstants.TYPE_LIST:
                final long listSize = RdbUtils.readLength(dis);
                final KvList list = new KvList();
                for (long i = 0; i < listSize; i++) {
                    list.rpush(KvBytes.wrapTrusted(RdbUtils.readString(dis, maxLength)));
                }
                return list;
            case RdbConstants.TYPE_HASH:
                final long hashSize = RdbUtils.readLength(dis);
                final KvHash hash = new KvHash();
                for (long i = 0; i < hashSize; i++) {
                    final KvBytes field = KvBytes.wrapTrusted(RdbUtils.readString(dis, maxLength));
                    hash.put(field, KvBytes.wrapTrusted(RdbUtils.readString(dis, maxLength)));
                }
                return hash;
            default:
                throw new CorruptSnapshotException("不支持的数据类型: " + type);
        }
    }

    private static final class EntryTables {
        private final Map<KvBytes, KvData> data;
        private final Map<KvBytes, Long> expires;
        private final int skipped;

        private EntryTables(Map<KvBytes, KvData> data, Map<KvBytes, Long> expires, int skipped) {
            this.data = data;
            this.expires = expires;
            this.skipped = skipped;
        }
    }

    /**
     * 加载得到的键值和过期时间表。
     */
    @Getter
    public static final class Snapshot {
        private final Map<KvBytes, KvData> data;
        private final Map<KvBytes, Long> expires;
        private final int skippedExpired;
        /** 从魔数到校验和结束的字节数 */
        private final long length;

        Snapshot(Map<KvBytes, KvData> data, Map<KvBytes, Long> expires, int skippedExpired, long length) {
            this.data = data;
            this.expires = expires;
            this.skippedExpired = skippedExpired;
            this.length = length;
        }
    }
}
