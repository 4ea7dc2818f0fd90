package site.kvmini.rdb.crc;

import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * 读取时同步计算 CRC64 并统计字节数的输入流。
 *
 * <p>快照末尾的校验和通过 {@link #readChecksum()} 读取，不计入 CRC，但计入字节数。
 * 跳过的字节同样计入 CRC。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public class Crc64InputStream extends FilterInputStream {

    private long crc64 = Crc64.INITIAL_CRC;

    private long count;

    public Crc64InputStream(InputStream in) {
        super(in);
    }

    public long getCrc64() {
        return crc64;
    }

    /**
     * @return 已经读取的字节数，包括校验和
     */
    public long getCount() {
        return count;
    }

    @Override
    public int read() throws IOException {
        final int b = in.read();
        if (b >= 0) {
            crc64 = Crc64.crc64(crc64, new byte[]{(byte) b}, 0, 1);
            count++;
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        final int n = in.read(b, off, len);
        if (n > 0) {
            crc64 = Crc64.crc64(crc64, b, off, n);
            count += n;
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        final byte[] scratch = new byte[(int) Math.min(n, 8192)];
        long skipped = 0;
        while (skipped < n) {
            final int r = read(scratch, 0, (int) Math.min(scratch.length, n - skipped));
            if (r < 0) {
                break;
            }
            skipped += r;
        }
        return skipped;
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    /**
     * 读取小端序 8 字节校验和，不更新 CRC。
     *
     * @throws EOFException 校验和不完整
     */
    public long readChecksum() throws IOException {
        long checksum = 0L;
        for (int i = 0; i < 8; i++) {
            final int b = in.read();
            if (b < 0) {
                throw new EOFException("文件在CRC64校验和中间结束");
            }
            checksum |= (long) (b & 0xFF) << (i * 8);
            count++;
        }
        return checksum;
    }
}
