package site.kvmini.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("增量解析器测试")
class RespParserTest {

    private static byte[] encodeAll(Resp... frames) {
        ByteBuf buf = Unpooled.buffer();
        try {
            for (Resp frame : frames) {
                frame.encode(buf);
            }
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    @Test
    @DisplayName("逐字节喂入与一次喂入结果相同")
    void testByteByByteFeed() {
        RespArray request = RespArray.command("SET", "key", "some value with spaces", "EX", "10");
        byte[] bytes = encodeAll(request);

        try (RespParser parser = new RespParser()) {
            List<Resp> frames = new ArrayList<>();
            for (byte b : bytes) {
                frames.addAll(parser.feed(new byte[]{b}));
            }
            assertEquals(List.of(request), frames);
            assertEquals(0, parser.remaining());
            assertEquals(bytes.length, parser.consumed());
        }
    }

    @Test
    @DisplayName("随机切分的流水线请求按顺序解析")
    void testRandomChunksPipelined() {
        Resp[] requests = {
                RespArray.command("SET", "a", "1"),
                RespArray.command("GET", "a"),
                RespArray.command("DEL", "a", "b", "c"),
                RespArray.command("PUBLISH", "ch", "\r\nbinary\r\n")
        };
        byte[] bytes = encodeAll(requests);
        Random random = new Random(42);

        for (int round = 0; round < 20; round++) {
            try (RespParser parser = new RespParser()) {
                List<Resp> frames = new ArrayList<>();
                int offset = 0;
                while (offset < bytes.length) {
                    int len = Math.min(bytes.length - offset, 1 + random.nextInt(7));
                    byte[] chunk = new byte[len];
                    System.arraycopy(bytes, offset, chunk, 0, len);
                    frames.addAll(parser.feed(chunk));
                    offset += len;
                }
                assertEquals(List.of(requests), frames);
            }
        }
    }

    @Test
    @DisplayName("不完整的尾部保留到下一次喂入")
    void testPartialTailRetained() {
        try (RespParser parser = new RespParser()) {
            assertTrue(parser.feed("*2\r\n$3\r\nGET\r\n$3\r\nfo".getBytes(StandardCharsets.UTF_8)).isEmpty());
            assertEquals(19, parser.remaining());

            List<Resp> frames = parser.feed("o\r\n".getBytes(StandardCharsets.UTF_8));
            assertEquals(List.of(RespArray.command("GET", "foo")), frames);
            assertEquals(0, parser.remaining());
        }
    }

    @Test
    @DisplayName("格式错误携带出错帧的偏移")
    void testProtocolErrorOffset() {
        try (RespParser parser = new RespParser()) {
            parser.append(Unpooled.copiedBuffer("+OK\r\n:12x\r\n", StandardCharsets.UTF_8));
            assertEquals(SimpleString.OK, parser.next());
            ProtocolException e = assertThrows(ProtocolException.class, parser::next);
            assertEquals(5, e.getOffset());
        }
    }
}
