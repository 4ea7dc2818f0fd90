package site.kvmini.database;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvString;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("过期键后台清理测试")
class ExpirySweeperTest {

    @Test
    @DisplayName("一个周期内清理大部分已过期的键")
    void testCycleRemovesExpiredWithoutAccess() {
        AtomicLong now = new AtomicLong(0);
        Keyspace keyspace = new Keyspace(now::get);
        for (int i = 0; i < 200; i++) {
            keyspace.set(KvBytes.fromString("tmp:" + i), KvString.of("v"), 100);
        }
        keyspace.set(KvBytes.fromString("keep"), KvString.of("v"));
        now.set(100);

        try (ExpirySweeper sweeper = new ExpirySweeper(keyspace, 10)) {
            int removed = 0;
            // 过期比例高时一个周期会连续抽样多轮
            for (int i = 0; i < 20 && keyspace.storedExpiresSize() > 0; i++) {
                removed += sweeper.runCycle();
            }
            assertEquals(200, removed);
        }
        assertEquals(1, keyspace.storedSize());
    }

    @Test
    @DisplayName("过期比例低时只抽样一轮")
    void testStopsWhenFewExpired() {
        AtomicLong now = new AtomicLong(0);
        Keyspace keyspace = new Keyspace(now::get);
        for (int i = 0; i < 100; i++) {
            keyspace.set(KvBytes.fromString("live:" + i), KvString.of("v"), 1_000_000);
        }

        try (ExpirySweeper sweeper = new ExpirySweeper(keyspace, 10)) {
            assertEquals(0, sweeper.runCycle());
        }
        assertEquals(100, keyspace.size());
    }

    @Test
    @DisplayName("后台线程按周期清理")
    void testBackgroundThread() throws InterruptedException {
        Keyspace keyspace = new Keyspace();
        keyspace.set(KvBytes.fromString("short"), KvString.of("v"), keyspace.now() + 50);

        try (ExpirySweeper sweeper = new ExpirySweeper(keyspace, 50)) {
            sweeper.start();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (keyspace.storedSize() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }
        }
        assertEquals(0, keyspace.storedSize());
    }

    @Test
    @DisplayName("非法的 hz 被拒绝")
    void testInvalidHz() {
        assertThrows(IllegalArgumentException.class, () -> new ExpirySweeper(new Keyspace(), 0));
    }
}
