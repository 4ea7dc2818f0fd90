package site.kvmini.rdb.crc;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * 写入时同步计算 CRC64 的输出流。校验和本身通过 {@link #writeChecksum()} 写出，不计入 CRC。
 *
 * @author hnfy258
 * @since 1.0
 */
public class Crc64OutputStream extends FilterOutputStream {

    private long crc64 = Crc64.INITIAL_CRC;

    public Crc64OutputStream(OutputStream out) {
        super(out);
    }

    public long getCrc64() {
        return crc64;
    }

    @Override
    public void write(int b) throws IOException {
        crc64 = Crc64.crc64(crc64, new byte[]{(byte) b}, 0, 1);
        out.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        crc64 = Crc64.crc64(crc64, b, off, len);
        out.write(b, off, len);
    }

    /**
     * 以小端序写出 8 字节的当前校验和。
     */
    public void writeChecksum() throws IOException {
        for (int i = 0; i < 8; i++) {
            out.write((int) (crc64 >>> (i * 8)) & 0xFF);
        }
    }
}
