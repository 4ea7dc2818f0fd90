package site.kvmini.persistence;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.aof.AofManager;
import site.kvmini.aof.AofWriteException;
import site.kvmini.aof.loader.AofLoader;
import site.kvmini.core.CommandExecutor;
import site.kvmini.database.Keyspace;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.rdb.CorruptSnapshotException;
import site.kvmini.rdb.RdbLoader;
import site.kvmini.rdb.RdbManager;
import site.kvmini.rdb.RdbWriter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 持久化统一入口，协调 AOF 和 RDB。
 *
 * <p>开启 AOF 时，AOF 文件自身就能重建全部数据：要么从空数据开始记录，要么以重写时的 RDB 快照开头，
 * 后面跟着快照之后的命令。重写只替换这一个文件，一次原子改名完成，任何时刻崩溃都不会让同一条命令回放两次。
 * 启动时：
 * <ul>
 *     <li>AOF 存在且不为空：只用 AOF 恢复，先装入开头的快照（如果有），再回放之后的命令</li>
 *     <li>否则加载 RDB 文件；开启了 AOF 且加载到了数据时，立即写一个以快照开头的新 AOF</li>
 * </ul>
 * RDB 文件（SAVE、BGSAVE、周期快照和关闭时的快照）独立写入，不改动 AOF。
 *
 * <p>任何时刻最多一个后台任务（BGSAVE 或 BGREWRITEAOF），需要对齐的数据都在一次键空间加锁内捕获。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class PersistenceManager {

    private static final BulkString PEXPIREAT = BulkString.fromString("PEXPIREAT");

    private final Keyspace keyspace;

    private final PersistenceOptions options;

    private final AofManager aofManager;

    private final RdbManager rdbManager;

    /** AOF 前导的读写不依赖 RDB 文件是否开启 */
    private final RdbWriter preambleWriter = new RdbWriter();

    private final RdbLoader preambleLoader;

    private final AtomicBoolean backgroundRunning = new AtomicBoolean(false);

    /** 上次快照之后的写命令数，周期快照只在有写入时进行 */
    private final AtomicLong dirty = new AtomicLong();

    private final ExecutorService backgroundExecutor;

    private ScheduledExecutorService snapshotScheduler;

    private volatile boolean shutdown;

    public PersistenceManager(Keyspace keyspace, PersistenceOptions options) {
        this(keyspace, options, options.isAofEnabled()
                ? new AofManager(options.aofFile(), options.getSyncPolicy(), options.getRewriteMinSize(),
                options.getRewritePercentage(), options.getMaxBulkLen())
                : null);
    }

    /**
     * 可以传入定制的 AOF 管理器（比如替换写入器），为 null 时关闭 AOF。
     */
    public PersistenceManager(Keyspace keyspace, PersistenceOptions options, AofManager aofManager) {
        this.keyspace = keyspace;
        this.options = options;
        this.aofManager = aofManager;
        this.rdbManager = options.isRdbEnabled() ? new RdbManager(keyspace, options.rdbFile()) : null;
        this.preambleLoader = new RdbLoader(keyspace::now);
        this.backgroundExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "Persistence-BG");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 启动时恢复数据。
     *
     * <p>AOF 的前导快照损坏时，把 AOF 改名保留并改用 RDB 文件恢复；RDB 文件损坏时记录错误并从空数据开始。
     *
     * @param replayExecutor 回放 AOF 的执行器，执行时不能写回 AOF
     * @throws IOException AOF 无法读取、打开或写入初始快照
     */
    public void load(CommandExecutor replayExecutor) throws IOException {
        final long start = System.currentTimeMillis();
        boolean restoredFromAof = false;
        if (aofManager != null && aofManager.hasData()) {
            restoredFromAof = replayAof(replayExecutor);
        }
        if (!restoredFromAof && rdbManager != null) {
            try {
                rdbManager.load();
            } catch (CorruptSnapshotException e) {
                log.error("RDB文件损坏，从空数据开始: {}", e.getMessage());
                keyspace.clear();
            }
        }
        if (aofManager != null) {
            aofManager.open();
            if (!restoredFromAof && keyspace.size() > 0) {
                // 之后的追加都以这份快照为起点，写不成功就不能接受写命令
                rewriteNow();
                log.info("已从RDB数据生成新的AOF文件");
            }
        }
        log.info("数据加载完成，{} 个键，耗时 {} ms", keyspace.size(), System.currentTimeMillis() - start);
    }

    /**
     * @return AOF 可用并已回放；前导快照损坏时返回 false，键空间为空
     */
    private boolean replayAof(CommandExecutor replayExecutor) throws IOException {
        try {
            final AofLoader.LoadResult result = aofManager.load(replayExecutor, this::applyPreamble);
            log.info("AOF回放完成: 前导快照 {} bytes，{} 条命令，{} 条失败",
                    result.getPreambleBytes(), result.getCommands(), result.getFailed());
            return true;
        } catch (CorruptSnapshotException e) {
            log.error("AOF开头的RDB快照损坏，改用RDB文件恢复: {}", e.getMessage());
            keyspace.clear();
            aofManager.setAside();
            return false;
        }
    }

    private long applyPreamble(InputStream in, long maxLength) throws IOException {
        final RdbLoader.Snapshot snapshot = preambleLoader.read(in, maxLength);
        keyspace.replaceAll(snapshot.getData(), snapshot.getExpires());
        return snapshot.getLength();
    }

    /**
     * 同步重写 AOF，只在启动阶段使用。
     */
    private void rewriteNow() throws IOException {
        final byte[] base = keyspace.execute(() -> {
            final byte[] content = captureRewriteBase();
            aofManager.beginRewrite();
            return content;
        });
        try {
            aofManager.completeRewrite(base);
        } catch (IOException | RuntimeException e) {
            aofManager.abortRewrite();
            throw e;
        }
    }

    /**
     * 启动周期快照。只在开启 RDB 且设置了间隔时生效。
     */
    public void startSnapshotTimer() {
        final long interval = options.getSaveIntervalSeconds();
        if (rdbManager == null || interval <= 0) {
            return;
        }
        snapshotScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "Snapshot-Timer");
            thread.setDaemon(true);
            return thread;
        });
        snapshotScheduler.scheduleWithFixedDelay(this::periodicSnapshot, interval, interval, TimeUnit.SECONDS);
        log.info("周期快照已启动，间隔 {} 秒", interval);
    }

    private void periodicSnapshot() {
        if (dirty.get() == 0) {
            return;
        }
        try {
            if (bgSave()) {
                log.info("周期快照已开始，{} 次写入", dirty.get());
            }
        } catch (RuntimeException e) {
            log.error("周期快照启动失败", e);
        }
    }

    /**
     * 追加一条写命令到 AOF。必须在执行该命令的同一次键空间加锁内调用。
     */
    public void append(RespArray command) throws AofWriteException {
        if (aofManager != null) {
            aofManager.append(command);
        }
    }

    /**
     * 写命令执行之后调用，计数并检查是否需要自动重写。
     */
    public void afterWrite() {
        dirty.incrementAndGet();
        if (aofManager != null && !shutdown && aofManager.shouldRewrite()) {
            if (bgRewriteAof()) {
                log.info("AOF文件大小 {} 字节，触发自动重写", aofManager.getCurrentSize());
            }
        }
    }

    /**
     * @return AOF 写入失败尚未恢复，此时应拒绝写命令
     */
    public boolean isWriteBlocked() {
        return aofManager != null && aofManager.isWriteBlocked();
    }

    public boolean isAofEnabled() {
        return aofManager != null;
    }

    public boolean isRdbEnabled() {
        return rdbManager != null;
    }

    public boolean isBackgroundRunning() {
        return backgroundRunning.get();
    }

    /**
     * 后台保存 RDB 快照。
     *
     * @return 已经有后台任务在运行时返回 false
     * @throws IllegalStateException RDB 未开启
     */
    public boolean bgSave() {
        if (rdbManager == null) {
            throw new IllegalStateException("RDB未开启");
        }
        if (!backgroundRunning.compareAndSet(false, true)) {
            return false;
        }
        final byte[] snapshot;
        try {
            snapshot = keyspace.execute(this::captureSnapshot);
        } catch (RuntimeException e) {
            backgroundRunning.set(false);
            throw e;
        }
        backgroundExecutor.execute(() -> {
            try {
                rdbManager.write(snapshot);
            } catch (IOException | RuntimeException e) {
                log.error("BGSAVE失败", e);
            } finally {
                backgroundRunning.set(false);
            }
        });
        return true;
    }

    /**
     * 后台重写 AOF。新文件在同一次加锁内捕获的数据之上，加上重写期间的追加，原子替换旧文件；
     * 失败时旧文件保持完整可用。
     *
     * @return 已经有后台任务在运行时返回 false
     * @throws IllegalStateException AOF 未开启
     */
    public boolean bgRewriteAof() {
        if (aofManager == null) {
            throw new IllegalStateException("AOF未开启");
        }
        if (!backgroundRunning.compareAndSet(false, true)) {
            return false;
        }
        final byte[] base;
        try {
            base = keyspace.execute(() -> {
                final byte[] content = captureRewriteBase();
                aofManager.beginRewrite();
                return content;
            });
        } catch (RuntimeException e) {
            backgroundRunning.set(false);
            throw e;
        }
        backgroundExecutor.execute(() -> {
            try {
                aofManager.completeRewrite(base);
            } catch (IOException | RuntimeException e) {
                log.error("AOF重写失败，继续使用原文件", e);
                aofManager.abortRewrite();
            } finally {
                backgroundRunning.set(false);
            }
        });
        return true;
    }

    /**
     * 同步保存快照，整个过程持有键空间锁。
     *
     * @return 已经有后台任务在运行时返回 false
     * @throws IOException 写文件失败
     */
    public boolean save() throws IOException {
        if (rdbManager == null) {
            throw new IllegalStateException("RDB未开启");
        }
        if (!backgroundRunning.compareAndSet(false, true)) {
            return false;
        }
        try {
            keyspace.execute(() -> {
                try {
                    rdbManager.write(captureSnapshot());
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return null;
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } finally {
            backgroundRunning.set(false);
        }
        return true;
    }

    /**
     * 重写的基础内容：RDB 快照，或者关闭前导时重建数据的命令序列。调用方持有键空间锁。
     */
    private byte[] captureRewriteBase() {
        return options.isAofUseRdbPreamble() ? preambleWriter.serialize(keyspace) : encodeCommands();
    }

    /**
     * 调用方持有键空间锁。
     */
    private byte[] captureSnapshot() {
        dirty.set(0);
        return rdbManager.capture();
    }

    /**
     * 把当前数据编码成能重建它的最少命令，过期时间用 PEXPIREAT 表示绝对时间。调用方持有键空间锁。
     */
    private byte[] encodeCommands() {
        final ByteBuf buf = Unpooled.buffer();
        try {
            keyspace.forEach((key, value, expireAt) -> {
                for (RespArray command : value.toCommands(key)) {
                    command.encode(buf);
                }
                if (expireAt != Keyspace.NO_EXPIRY) {
                    expireCommand(key, expireAt).encode(buf);
                }
            });
            final byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            buf.release();
        }
    }

    private static RespArray expireCommand(KvBytes key, long expireAt) {
        return new RespArray(new Resp[]{
                PEXPIREAT, BulkString.create(key), BulkString.fromString(Long.toString(expireAt))
        });
    }

    /**
     * 关闭持久化：等待后台任务，开启 RDB 时做最后一次快照，最后刷盘并关闭 AOF。
     *
     * @param timeoutMillis 等待后台任务的最长时间
     * @throws IOException 第一个发生的错误，其余步骤仍会执行
     */
    public void shutdown(long timeoutMillis) throws IOException {
        shutdown = true;
        IOException firstError = null;
        if (snapshotScheduler != null) {
            snapshotScheduler.shutdownNow();
        }
        backgroundExecutor.shutdown();
        try {
            if (!backgroundExecutor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("后台持久化任务在 {} ms 内未完成", timeoutMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (aofManager != null) {
            try {
                aofManager.flush();
            } catch (IOException e) {
                log.error("关闭时AOF刷盘失败", e);
                firstError = e;
            }
        }
        if (rdbManager != null) {
            try {
                if (!save()) {
                    log.warn("后台任务仍在运行，跳过关闭时的快照");
                }
            } catch (IOException | RuntimeException e) {
                log.error("关闭时保存快照失败", e);
                if (firstError == null) {
                    firstError = e instanceof IOException ? (IOException) e : new IOException(e);
                }
            }
        }
        if (aofManager != null) {
            try {
                aofManager.close();
            } catch (IOException e) {
                log.error("关闭AOF失败", e);
                if (firstError == null) {
                    firstError = e;
                }
            }
        }
        if (firstError != null) {
            throw firstError;
        }
        log.info("持久化已关闭");
    }

    public AofManager getAofManager() {
        return aofManager;
    }

    public RdbManager getRdbManager() {
        return rdbManager;
    }
}
