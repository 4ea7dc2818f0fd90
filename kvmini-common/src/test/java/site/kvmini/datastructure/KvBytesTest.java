package site.kvmini.datastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KvBytes 单元测试
 *
 * @author hnfy258
 */
@DisplayName("KvBytes 单元测试")
class KvBytesTest {

    @Nested
    @DisplayName("构造与拷贝")
    class ConstructorTests {

        @Test
        @DisplayName("标准构造函数执行防御性拷贝")
        void testDefensiveCopy() {
            final byte[] source = "abc".getBytes(KvBytes.CHARSET);
            final KvBytes kb = new KvBytes(source);
            source[0] = 'x';

            assertEquals("abc", kb.getString());
            assertEquals(3, kb.length());
        }

        @Test
        @DisplayName("null 输入抛出异常")
        void testNullInput() {
            assertThrows(IllegalArgumentException.class, () -> new KvBytes(null));
            assertNull(KvBytes.wrapTrusted(null));
            assertNull(KvBytes.fromString(null));
        }

        @Test
        @DisplayName("空字符串返回共享的 EMPTY 实例")
        void testEmpty() {
            assertSame(KvBytes.EMPTY, KvBytes.fromString(""));
            assertTrue(KvBytes.EMPTY.isEmpty());
        }

        @Test
        @DisplayName("fromString 保留原始大小写")
        void testFromStringKeepsCase() {
            assertEquals("get", KvBytes.fromString("get").getString());
            assertNotEquals(KvBytes.fromString("get"), KvBytes.fromString("GET"));
        }
    }

    @Nested
    @DisplayName("比较操作")
    class ComparisonTests {

        @Test
        @DisplayName("equals 与 hashCode 基于内容")
        void testEqualsAndHashCode() {
            final KvBytes a = KvBytes.fromString("key");
            final KvBytes b = new KvBytes("key".getBytes(KvBytes.CHARSET));

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());

            Map<KvBytes, Integer> map = new HashMap<>();
            map.put(a, 1);
            assertEquals(1, map.get(b));
        }

        @Test
        @DisplayName("忽略大小写比较只处理 ASCII 字母")
        void testEqualsIgnoreCase() {
            assertTrue(KvBytes.fromString("Subscribe").equalsIgnoreCase(KvBytes.fromString("SUBSCRIBE")));
            assertFalse(KvBytes.fromString("set").equalsIgnoreCase(KvBytes.fromString("get")));
            assertFalse(KvBytes.fromString("set").equalsIgnoreCase(null));
            assertEquals("PEXPIREAT", KvBytes.fromString("pExpireAt").toUpperCaseString());
        }

        @Test
        @DisplayName("compareTo 按无符号字节排序")
        void testCompareTo() {
            final KvBytes high = KvBytes.wrapTrusted(new byte[]{(byte) 0xFF});
            final KvBytes low = KvBytes.wrapTrusted(new byte[]{0x01});

            assertTrue(high.compareTo(low) > 0);
            assertTrue(KvBytes.fromString("ab").compareTo(KvBytes.fromString("abc")) < 0);
            assertEquals(0, KvBytes.fromString("x").compareTo(KvBytes.fromString("x")));
        }
    }

    @Test
    @DisplayName("toString 对二进制内容做转义")
    void testToStringPreview() {
        final KvBytes kb = KvBytes.wrapTrusted(new byte[]{'a', 0x00});
        assertEquals("KvBytes[length=2, preview='a\\x00']", kb.toString());
    }
}
