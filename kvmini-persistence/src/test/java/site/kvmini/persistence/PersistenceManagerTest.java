package site.kvmini.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import site.kvmini.aof.AofManager;
import site.kvmini.aof.writer.AofSyncPolicy;
import site.kvmini.database.Keyspace;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvList;
import site.kvmini.datastructure.KvString;
import site.kvmini.protocol.RespArray;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("持久化管理器测试")
class PersistenceManagerTest {

    @TempDir
    Path tempDir;

    private final AtomicLong clock = new AtomicLong(1_000_000L);

    private Keyspace keyspace;

    @BeforeEach
    void setUp() {
        keyspace = new Keyspace(clock::get);
    }

    private PersistenceOptions options(boolean aof, boolean rdb) {
        return PersistenceOptions.builder()
                .dir(tempDir.toFile())
                .aofEnabled(aof)
                .rdbEnabled(rdb)
                .syncPolicy(AofSyncPolicy.ALWAYS)
                .saveIntervalSeconds(0)
                .rewritePercentage(0)
                .build();
    }

    private static KvBytes bytes(String s) {
        return KvBytes.fromString(s);
    }

    /**
     * 模拟命令执行：修改键空间并在同一次加锁内追加到 AOF。
     */
    private void set(PersistenceManager manager, String key, String value) throws IOException {
        keyspace.set(bytes(key), KvString.of(value));
        manager.append(RespArray.command("SET", key, value));
        manager.afterWrite();
    }

    private void incr(PersistenceManager manager, String key) throws IOException {
        KvString current = keyspace.get(bytes(key), KvString.class);
        long next = current == null ? 1 : Long.parseLong(current.getValue().getString()) + 1;
        keyspace.set(bytes(key), KvString.of(String.valueOf(next)));
        manager.append(RespArray.command("INCR", key));
        manager.afterWrite();
    }

    private Keyspace restart(PersistenceOptions options) throws IOException {
        Keyspace restored = new Keyspace(clock::get);
        PersistenceManager manager = new PersistenceManager(restored, options);
        manager.load(new ReplayExecutor(restored));
        if (manager.isAofEnabled()) {
            manager.getAofManager().close();
        }
        return restored;
    }

    private void awaitBackground(PersistenceManager manager) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (manager.isBackgroundRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(manager.isBackgroundRunning());
    }

    @Test
    @DisplayName("只开AOF时重启后通过回放恢复")
    void testAofOnlyRestart() throws IOException {
        PersistenceOptions options = options(true, false);
        PersistenceManager manager = new PersistenceManager(keyspace, options);
        manager.load(new ReplayExecutor(keyspace));
        set(manager, "a", "1");
        set(manager, "b", "2");
        manager.shutdown(1000);

        Keyspace restored = restart(options);
        assertEquals(KvString.of("1"), restored.get(bytes("a")));
        assertEquals(KvString.of("2"), restored.get(bytes("b")));
    }

    @Test
    @DisplayName("命令模式重写后文件只包含重建数据的命令和过期时间")
    void testCommandRewrite() throws Exception {
        PersistenceOptions options = options(true, false);
        PersistenceManager manager = new PersistenceManager(keyspace, options);
        manager.load(new ReplayExecutor(keyspace));
        for (int i = 0; i < 50; i++) {
            set(manager, "counter", String.valueOf(i));
        }
        KvList list = new KvList();
        list.rpush(bytes("x"), bytes("y"));
        keyspace.set(bytes("list"), list, clock.get() + 60_000);
        long before = manager.getAofManager().getCurrentSize();

        assertTrue(manager.bgRewriteAof());
        awaitBackground(manager);
        assertTrue(manager.getAofManager().getCurrentSize() < before);
        manager.shutdown(1000);

        Keyspace restored = restart(options);
        assertEquals(KvString.of("49"), restored.get(bytes("counter")));
        assertEquals(list, restored.get(bytes("list")));
        assertEquals(clock.get() + 60_000, restored.getExpireAt(bytes("list")));
    }

    @Test
    @DisplayName("重写后的AOF以RDB快照开头，重启后恢复并可以继续追加")
    void testPreambleRewrite() throws Exception {
        PersistenceOptions options = options(true, true);
        PersistenceManager manager = new PersistenceManager(keyspace, options);
        manager.load(new ReplayExecutor(keyspace));
        set(manager, "a", "1");
        keyspace.set(bytes("ttl"), KvString.of("t"), clock.get() + 60_000);

        assertTrue(manager.bgRewriteAof());
        awaitBackground(manager);
        set(manager, "b", "2");
        manager.getAofManager().close();

        byte[] content = Files.readAllBytes(options.aofFile().toPath());
        assertEquals("REDIS0009", new String(content, 0, 9, StandardCharsets.US_ASCII));
        Keyspace restored = restart(options);
        assertEquals(KvString.of("1"), restored.get(bytes("a")));
        assertEquals(KvString.of("2"), restored.get(bytes("b")));
        assertEquals(clock.get() + 60_000, restored.getExpireAt(bytes("ttl")));
    }

    @Test
    @DisplayName("AOF替换失败时旧文件保持完整，重启后不会重复执行命令")
    void testFailedRewriteKeepsHistory() throws Exception {
        PersistenceOptions options = options(true, true);
        AofManager failingSwap = new AofManager(options.aofFile(), AofSyncPolicy.ALWAYS, 0, 0,
                options.getMaxBulkLen()) {
            @Override
            public void completeRewrite(byte[] base) throws IOException {
                throw new IOException("No space left on device");
            }
        };
        PersistenceManager manager = new PersistenceManager(keyspace, options, failingSwap);
        manager.load(new ReplayExecutor(keyspace));
        for (int i = 0; i < 3; i++) {
            incr(manager, "counter");
        }

        assertTrue(manager.bgRewriteAof());
        awaitBackground(manager);
        assertFalse(failingSwap.isRewriting());
        assertTrue(manager.save());
        failingSwap.close();

        Keyspace restored = restart(options);
        assertEquals(KvString.of("3"), restored.get(bytes("counter")));
    }

    @Test
    @DisplayName("快照之后的写入只回放一次")
    void testSnapshotThenMoreWrites() throws Exception {
        PersistenceOptions options = options(true, true);
        PersistenceManager manager = new PersistenceManager(keyspace, options);
        manager.load(new ReplayExecutor(keyspace));
        incr(manager, "counter");
        incr(manager, "counter");

        assertTrue(manager.bgSave());
        awaitBackground(manager);
        incr(manager, "counter");
        manager.shutdown(1000);

        assertTrue(options.rdbFile().exists());
        assertEquals(KvString.of("3"), restart(options).get(bytes("counter")));
    }

    @Test
    @DisplayName("没有AOF时从RDB恢复，并立即生成以快照开头的AOF")
    void testBaselineFromSnapshot() throws Exception {
        PersistenceManager rdbOnly = new PersistenceManager(keyspace, options(false, true));
        rdbOnly.load(new ReplayExecutor(keyspace));
        keyspace.set(bytes("k"), KvString.of("v"));
        rdbOnly.shutdown(1000);

        PersistenceOptions options = options(true, true);
        Keyspace restored = new Keyspace(clock::get);
        PersistenceManager manager = new PersistenceManager(restored, options);
        manager.load(new ReplayExecutor(restored));
        assertEquals(KvString.of("v"), restored.get(bytes("k")));
        byte[] content = Files.readAllBytes(options.aofFile().toPath());
        assertEquals("REDIS", new String(content, 0, 5, StandardCharsets.US_ASCII));

        restored.set(bytes("k2"), KvString.of("v2"));
        manager.append(RespArray.command("SET", "k2", "v2"));
        manager.getAofManager().close();
        Files.delete(options.rdbFile().toPath());

        Keyspace again = restart(options);
        assertEquals(KvString.of("v"), again.get(bytes("k")));
        assertEquals(KvString.of("v2"), again.get(bytes("k2")));
    }

    @Test
    @DisplayName("AOF开头的快照损坏时保留原文件并改用RDB恢复")
    void testCorruptPreambleFallsBackToSnapshot() throws Exception {
        PersistenceOptions options = options(true, true);
        PersistenceManager manager = new PersistenceManager(keyspace, options);
        manager.load(new ReplayExecutor(keyspace));
        set(manager, "a", "1");
        assertTrue(manager.bgRewriteAof());
        awaitBackground(manager);
        manager.shutdown(1000);

        byte[] content = Files.readAllBytes(options.aofFile().toPath());
        // 文件只有前导快照，最后一个字节属于校验和
        content[content.length - 1] ^= 0x7F;
        Files.write(options.aofFile().toPath(), content);

        Keyspace restored = restart(options);
        assertEquals(KvString.of("1"), restored.get(bytes("a")));
        assertTrue(new File(options.aofFile().getAbsolutePath() + ".corrupt").exists());
        assertEquals("REDIS", new String(Files.readAllBytes(options.aofFile().toPath()), 0, 5,
                StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("关闭时保存最终快照")
    void testShutdownSavesSnapshot() throws IOException {
        PersistenceOptions options = options(false, true);
        PersistenceManager manager = new PersistenceManager(keyspace, options);
        manager.load(new ReplayExecutor(keyspace));
        keyspace.set(bytes("k"), KvString.of("v"));

        manager.shutdown(1000);

        assertTrue(options.rdbFile().exists());
        assertEquals(KvString.of("v"), restart(options).get(bytes("k")));
    }

    @Test
    @DisplayName("RDB文件损坏不影响AOF恢复")
    void testCorruptSnapshotWithAof() throws IOException {
        PersistenceOptions options = options(true, true);
        Files.write(options.rdbFile().toPath(), "REDIS0009garbage-garbage".getBytes());
        Files.write(options.aofFile().toPath(),
                "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n".getBytes());

        Keyspace restored = restart(options);

        assertEquals(1, restored.size());
        assertEquals(KvString.of("v"), restored.get(bytes("k")));
    }

    @Test
    @DisplayName("没有AOF且RDB文件损坏时从空数据开始")
    void testCorruptSnapshotStartsEmpty() throws IOException {
        PersistenceOptions options = options(true, true);
        Files.write(options.rdbFile().toPath(), "REDIS0009garbage-garbage".getBytes());

        Keyspace restored = restart(options);

        assertEquals(0, restored.size());
        assertEquals(0, options.aofFile().length());
    }

    @Test
    @DisplayName("后台任务运行时拒绝新的任务")
    void testSingleBackgroundTask() throws IOException {
        PersistenceOptions options = options(true, false);
        PersistenceManager manager = new PersistenceManager(keyspace, options);
        manager.load(new ReplayExecutor(keyspace));
        manager.getAofManager().beginRewrite();

        // AOF 已经在重写，捕获阶段失败后标志位被清除
        assertThrows(IllegalStateException.class, manager::bgRewriteAof);
        assertFalse(manager.isBackgroundRunning());
        manager.getAofManager().abortRewrite();
        manager.shutdown(1000);
    }

    @Test
    @DisplayName("未开启的持久化方式拒绝对应操作")
    void testDisabledModes() {
        PersistenceManager aofOnly = new PersistenceManager(keyspace, options(true, false));
        assertThrows(IllegalStateException.class, aofOnly::bgSave);
        PersistenceManager rdbOnly = new PersistenceManager(keyspace, options(false, true));
        assertThrows(IllegalStateException.class, rdbOnly::bgRewriteAof);
        assertFalse(rdbOnly.isWriteBlocked());
        File aof = options(false, true).aofFile();
        assertFalse(aof.exists());
    }
}
