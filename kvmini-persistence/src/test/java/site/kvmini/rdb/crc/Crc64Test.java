package site.kvmini.rdb.crc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CRC64算法测试")
class Crc64Test {

    private static final byte[] CHECK_INPUT = "123456789".getBytes(StandardCharsets.US_ASCII);

    @Test
    @DisplayName("标准校验值与Redis一致")
    void testRedisCheckValue() {
        assertEquals(0xe9c6d914c4b8d9caL, Crc64.crc64(CHECK_INPUT));
    }

    @Test
    @DisplayName("空数据返回初始值")
    void testEmpty() {
        assertEquals(Crc64.INITIAL_CRC, Crc64.crc64(new byte[0]));
    }

    @Test
    @DisplayName("分段计算与一次计算结果相同")
    void testIncremental() {
        long crc = Crc64.INITIAL_CRC;
        crc = Crc64.crc64(crc, CHECK_INPUT, 0, 4);
        crc = Crc64.crc64(crc, CHECK_INPUT, 4, CHECK_INPUT.length - 4);
        assertEquals(Crc64.crc64(CHECK_INPUT), crc);
    }

    @Test
    @DisplayName("非法偏移量被拒绝")
    void testInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> Crc64.crc64(0, CHECK_INPUT, 5, 10));
        assertThrows(IllegalArgumentException.class, () -> Crc64.crc64(0, null, 0, 0));
    }

    @Test
    @DisplayName("输出流写出小端校验和且校验和不参与计算")
    void testOutputStreamChecksum() throws IOException {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        try (Crc64OutputStream out = new Crc64OutputStream(sink)) {
            out.write(CHECK_INPUT, 0, 3);
            out.write(CHECK_INPUT[3]);
            out.write(CHECK_INPUT, 4, CHECK_INPUT.length - 4);
            out.writeChecksum();
            assertEquals(0xe9c6d914c4b8d9caL, out.getCrc64());
        }
        byte[] written = sink.toByteArray();
        assertEquals(CHECK_INPUT.length + 8, written.length);
        assertEquals((byte) 0xca, written[CHECK_INPUT.length]);
        assertEquals((byte) 0xe9, written[written.length - 1]);
    }

    @Test
    @DisplayName("输入流读出的校验和与数据计算结果一致")
    void testInputStreamChecksum() throws IOException {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        try (Crc64OutputStream out = new Crc64OutputStream(sink)) {
            out.write(CHECK_INPUT);
            out.writeChecksum();
        }

        Crc64InputStream in = new Crc64InputStream(new ByteArrayInputStream(sink.toByteArray()));
        assertEquals('1', in.read());
        byte[] rest = new byte[CHECK_INPUT.length - 1];
        assertEquals(rest.length, in.read(rest, 0, rest.length));
        long actual = in.getCrc64();

        assertEquals(Crc64.crc64(CHECK_INPUT), actual);
        assertEquals(actual, in.readChecksum());
        assertEquals(actual, in.getCrc64());
        assertEquals(CHECK_INPUT.length + 8, in.getCount());
    }

    @Test
    @DisplayName("校验和不完整时抛出EOFException")
    void testShortChecksum() throws IOException {
        Crc64InputStream in = new Crc64InputStream(new ByteArrayInputStream(new byte[]{1, 2, 3}));
        assertThrows(EOFException.class, in::readChecksum);
    }
}
