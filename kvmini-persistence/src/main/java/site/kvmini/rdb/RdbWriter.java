package site.kvmini.rdb;

import lombok.extern.slf4j.Slf4j;
import site.kvmini.aof.utils.FileUtils;
import site.kvmini.database.Keyspace;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvData;
import site.kvmini.datastructure.KvHash;
import site.kvmini.datastructure.KvList;
import site.kvmini.datastructure.KvString;
import site.kvmini.rdb.crc.Crc64OutputStream;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * RDB 快照写入器。
 *
 * <p>快照分两步：{@link #serialize(Keyspace)} 在键空间锁内把所有未过期的键编码到内存，
 * 这段时间命令处理会短暂停顿；{@link #writeFile(byte[], File)} 在锁外写临时文件并原子替换。
 * 文件的内容因此对应加锁那一刻的键空间。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RdbWriter {

    /**
     * 在键空间锁内序列化整个键空间。
     *
     * @return 包含头部、数据、EOF 和 CRC64 校验和的完整文件内容
     */
    public byte[] serialize(final Keyspace keyspace) {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        final Crc64OutputStream crcStream = new Crc64OutputStream(buffer);
        final DataOutputStream dos = new DataOutputStream(crcStream);
        final int[] written = {0};
        try {
            keyspace.execute(() -> {
                try {
                    dos.write(RdbConstants.MAGIC);
                    dos.writeByte(RdbConstants.OPCODE_SELECTDB);
                    RdbUtils.writeLength(dos, 0);
                    dos.writeByte(RdbConstants.OPCODE_RESIZEDB);
                    RdbUtils.writeLength(dos, keyspace.size());
                    RdbUtils.writeLength(dos, keyspace.expiresSize());
                    keyspace.forEach((key, value, expireAt) -> {
                        writeEntry(dos, key, value, expireAt);
                        written[0]++;
                    });
                    return null;
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            dos.writeByte(RdbConstants.OPCODE_EOF);
            dos.flush();
            crcStream.writeChecksum();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        log.debug("快照序列化完成，{} 个键，{} 字节，CRC64: 0x{}",
                written[0], buffer.size(), Long.toHexString(crcStream.getCrc64()));
        return buffer.toByteArray();
    }

    private void writeEntry(DataOutputStream dos, KvBytes key, KvData value, long expireAt) throws IOException {
        if (expireAt != Keyspace.NO_EXPIRY) {
            dos.writeByte(RdbConstants.OPCODE_EXPIRETIME_MS);
            RdbUtils.writeMillis(dos, expireAt);
        }
        switch (value.type()) {
            case STRING:
                dos.writeByte(RdbConstants.TYPE_STRING);
                RdbUtils.writeString(dos, key.getBytesUnsafe());
                RdbUtils.writeString(dos, ((KvString) value).getValue().getBytesUnsafe());
                break;
            case LIST:
                final KvList list = (KvList) value;
                dos.writeByte(RdbConstants.TYPE_LIST);
                RdbUtils.writeString(dos, key.getBytesUnsafe());
                RdbUtils.writeLength(dos, list.size());
                for (KvBytes element : list.getAll()) {
                    RdbUtils.writeString(dos, element.getBytesUnsafe());
                }
                break;
            case HASH:
                final Map<KvBytes, KvBytes> hash = ((KvHash) value).getAll();
                dos.writeByte(RdbConstants.TYPE_HASH);
                RdbUtils.writeString(dos, key.getBytesUnsafe());
                RdbUtils.writeLength(dos, hash.size());
                for (Map.Entry<KvBytes, KvBytes> field : hash.entrySet()) {
                    RdbUtils.writeString(dos, field.getKey().getBytesUnsafe());
                    RdbUtils.writeString(dos, field.getValue().getBytesUnsafe());
                }
                break;
            default:
                throw new IllegalStateException("不支持的数据类型: " + value.type());
        }
    }

    /**
     * 写入临时文件，fsync 后原子替换正式文件。失败时正式文件保持原样。
     */
    public void writeFile(final byte[] content, final File target) throws IOException {
        final File temp = new File(target.getAbsolutePath() + ".tmp");
        try {
            FileUtils.writeAndSync(temp, content);
            FileUtils.atomicReplace(temp, target);
        } finally {
            FileUtils.deleteQuietly(temp);
        }
        log.info("RDB文件已保存: {}, {} 字节", target.getAbsolutePath(), content.length);
    }
}
