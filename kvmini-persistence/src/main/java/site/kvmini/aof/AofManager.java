package site.kvmini.aof;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocator;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.aof.loader.AofLoader;
import site.kvmini.aof.utils.FileUtils;
import site.kvmini.aof.writer.AofSyncPolicy;
import site.kvmini.aof.writer.AofWriter;
import site.kvmini.aof.writer.Writer;
import site.kvmini.core.CommandExecutor;
import site.kvmini.protocol.RespArray;
import site.kvmini.rdb.CorruptSnapshotException;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * AOF 管理器，负责追加、刷盘、加载和重写时的文件切换。
 *
 * <p>追加是同步的：写命令执行成功后、回复客户端之前调用 {@link #append(RespArray)}，
 * 记录写入操作系统缓存后才返回。刷盘按策略进行：
 * <ul>
 *     <li>ALWAYS - 在调用线程里 fsync，失败时抛出 {@link AofWriteException}</li>
 *     <li>EVERYSEC - 由定时任务每秒 fsync 一次</li>
 *     <li>NO - 交给操作系统</li>
 * </ul>
 *
 * <p>写入或刷盘失败后进入写阻塞状态（{@link #isWriteBlocked()}），调用方应拒绝新的写命令；
 * 定时任务会重试刷盘，成功后自动解除。
 *
 * <p>重写分两步：{@link #beginRewrite()} 在键空间锁内调用，之后的追加同时写入重写缓冲；
 * {@link #completeRewrite(byte[])} 在后台线程调用，把基础内容和缓冲的追加写入临时文件后原子替换。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class AofManager implements AutoCloseable {

    private static final long FSYNC_INTERVAL_MS = 1000;

    private final File aofFile;

    private final File rewriteTempFile;

    private final AofSyncPolicy syncPolicy;

    private final long rewriteMinSize;

    private final int rewritePercentage;

    private final long maxBulkLen;

    /** 保护 writer、rewriteBuffer 和文件大小 */
    private final ReentrantLock writeLock = new ReentrantLock();

    private final ByteBufAllocator allocator = PooledByteBufAllocator.DEFAULT;

    private final ScheduledExecutorService fsyncScheduler;

    private Writer writer;

    /** 重写期间的追加缓冲，不在重写时为 null */
    private ByteBuf rewriteBuffer;

    /** 最近一次加载或重写后的文件大小，自动重写以此计算增长比例 */
    private long baseSize;

    private long currentSize;

    private volatile boolean dirty;

    private volatile IOException writeError;

    public AofManager(File aofFile, AofSyncPolicy syncPolicy, long rewriteMinSize,
                      int rewritePercentage, long maxBulkLen) {
        this.aofFile = aofFile;
        this.rewriteTempFile = new File(aofFile.getAbsolutePath() + ".rewrite.tmp");
        this.syncPolicy = syncPolicy;
        this.rewriteMinSize = rewriteMinSize;
        this.rewritePercentage = rewritePercentage;
        this.maxBulkLen = maxBulkLen;
        this.fsyncScheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r);
            thread.setName("AOF-Fsync-Scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @return AOF 文件存在且不为空
     */
    public boolean hasData() {
        return aofFile.exists() && aofFile.length() > 0;
    }

    public AofLoader.LoadResult load(CommandExecutor executor) throws IOException {
        return load(executor, null);
    }

    /**
     * 回放现有的 AOF。回放在最后一条完整记录处停止时，截断文件的剩余部分，
     * 之后追加的记录才能在下次启动时被读到。
     *
     * @param executor       回放使用的命令执行器，执行时不能再写回 AOF
     * @param preambleReader 文件以 RDB 快照开头时用来装载快照
     * @return 加载结果
     * @throws CorruptSnapshotException RDB 前导损坏，文件保持原样
     * @throws IOException              文件无法读取或截断
     */
    public AofLoader.LoadResult load(CommandExecutor executor, AofLoader.PreambleReader preambleReader)
            throws IOException {
        final AofLoader.LoadResult result =
                new AofLoader(aofFile, executor, maxBulkLen, preambleReader).load();
        if (result.isTruncated()) {
            log.warn("AOF文件从 {} 字节截断到 {} 字节，丢弃不完整或损坏的尾部",
                    result.getFileSize(), result.getValidBytes());
            try (Writer truncating = openWriter(aofFile)) {
                truncating.truncate(result.getValidBytes());
                truncating.flush();
            }
        }
        return result;
    }

    /**
     * 把无法使用的 AOF 改名保留，原位置留给新文件。只能在 {@link #open()} 之前调用。
     *
     * @return 保留下来的文件
     */
    public File setAside() throws IOException {
        final File corrupt = new File(aofFile.getAbsolutePath() + ".corrupt");
        FileUtils.atomicReplace(aofFile, corrupt);
        log.warn("AOF文件已改名保留: {}", corrupt.getAbsolutePath());
        return corrupt;
    }

    /**
     * 打开 AOF 准备追加，并启动定时刷盘任务。
     */
    public void open() throws IOException {
        writeLock.lock();
        try {
            writer = openWriter(aofFile);
            currentSize = writer.size();
            baseSize = currentSize;
        } finally {
            writeLock.unlock();
        }
        fsyncScheduler.scheduleAtFixedRate(this::scheduledFsync,
                FSYNC_INTERVAL_MS, FSYNC_INTERVAL_MS, TimeUnit.MILLISECONDS);
        log.info("AOF已打开: {}, 刷盘策略: {}, 当前大小: {} bytes",
                aofFile.getAbsolutePath(), syncPolicy.getConfigName(), currentSize);
    }

    protected Writer openWriter(File file) throws IOException {
        return new AofWriter(file);
    }

    /**
     * 追加一条命令记录。
     *
     * @param command 命令数组
     * @throws AofWriteException 写入失败，或 ALWAYS 策略下刷盘失败
     */
    public void append(final RespArray command) throws AofWriteException {
        final ByteBuf byteBuf = allocator.buffer();
        try {
            command.encode(byteBuf);
            final int length = byteBuf.readableBytes();
            writeLock.lock();
            try {
                if (writer == null) {
                    throw new AofWriteException("AOF文件未打开", writeError);
                }
                try {
                    writer.write(byteBuf.nioBuffer());
                } catch (IOException e) {
                    markFailed(e);
                    discardPartialWrite();
                    throw new AofWriteException("AOF写入失败: " + e.getMessage(), e);
                }
                currentSize += length;
                if (rewriteBuffer != null) {
                    rewriteBuffer.writeBytes(byteBuf, byteBuf.readerIndex(), length);
                }
                if (syncPolicy == AofSyncPolicy.ALWAYS) {
                    try {
                        writer.flush();
                    } catch (IOException e) {
                        markFailed(e);
                        throw new AofWriteException("AOF刷盘失败: " + e.getMessage(), e);
                    }
                } else {
                    dirty = true;
                }
            } finally {
                writeLock.unlock();
            }
        } finally {
            byteBuf.release();
        }
    }

    private void markFailed(IOException e) {
        if (writeError == null) {
            log.error("AOF写入失败，停止接受写命令直到刷盘恢复: {}", aofFile.getAbsolutePath(), e);
        }
        writeError = e;
    }

    /**
     * 写入失败时文件中可能留下半条记录，截断回上一条完整记录的结尾。调用方持有 writeLock。
     */
    private void discardPartialWrite() {
        try {
            writer.truncate(currentSize);
        } catch (IOException e) {
            log.error("截断AOF未写完的记录失败", e);
        }
    }

    /**
     * @return 最近一次写入或刷盘失败且尚未恢复
     */
    public boolean isWriteBlocked() {
        return writeError != null;
    }

    /**
     * @return 导致写阻塞的错误，没有时为 null
     */
    public IOException getWriteError() {
        return writeError;
    }

    /**
     * 定时刷盘。EVERYSEC 下刷有改动的数据；任何策略下都会在写阻塞时重试，成功后解除阻塞。
     */
    private void scheduledFsync() {
        final boolean recovering = writeError != null;
        if (!recovering && !(syncPolicy == AofSyncPolicy.EVERYSEC && dirty)) {
            return;
        }
        writeLock.lock();
        try {
            if (writer == null) {
                writer = openWriter(aofFile);
                currentSize = writer.size();
            }
            if (recovering) {
                writer.truncate(currentSize);
            }
            dirty = false;
            writer.flush();
            if (recovering) {
                writeError = null;
                log.info("AOF刷盘已恢复，重新接受写命令");
            }
        } catch (IOException e) {
            dirty = true;
            markFailed(e);
        } catch (RuntimeException e) {
            log.error("AOF定时刷盘任务异常", e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 立即 fsync。
     */
    public void flush() throws IOException {
        writeLock.lock();
        try {
            if (writer != null) {
                writer.flush();
                dirty = false;
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return 文件超过最小重写大小，且相对上次重写增长超过设定比例
     */
    public boolean shouldRewrite() {
        if (rewritePercentage <= 0) {
            return false;
        }
        writeLock.lock();
        try {
            if (rewriteBuffer != null || writer == null || currentSize < rewriteMinSize) {
                return false;
            }
            final long base = Math.max(1, baseSize);
            return (currentSize - base) * 100 / base >= rewritePercentage;
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isRewriting() {
        writeLock.lock();
        try {
            return rewriteBuffer != null;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 开始重写，之后的追加同时进入重写缓冲。必须在捕获基础内容的同一次键空间加锁内调用。
     *
     * @throws IllegalStateException 已经有重写在进行
     */
    public void beginRewrite() {
        writeLock.lock();
        try {
            if (rewriteBuffer != null) {
                throw new IllegalStateException("AOF重写已在进行中");
            }
            rewriteBuffer = allocator.buffer();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 完成重写：基础内容加上重写期间的追加组成新文件，原子替换旧文件。
     *
     * @param base 重写开始时刻的基础内容：RDB 快照或者重建数据的命令序列
     * @throws IOException 写临时文件或替换失败，旧文件保持不变
     */
    public void completeRewrite(byte[] base) throws IOException {
        FileUtils.writeAndSync(rewriteTempFile, base);
        writeLock.lock();
        try {
            if (rewriteBuffer == null) {
                throw new IllegalStateException("没有进行中的AOF重写");
            }
            try (Writer tempWriter = openWriter(rewriteTempFile)) {
                tempWriter.write(rewriteBuffer.nioBuffer());
                tempWriter.flush();
            }
            FileUtils.atomicReplace(rewriteTempFile, aofFile);

            final Writer oldWriter = writer;
            writer = null;
            if (oldWriter != null) {
                try {
                    oldWriter.close();
                } catch (IOException e) {
                    log.warn("关闭旧AOF文件失败: {}", e.getMessage());
                }
            }
            try {
                writer = openWriter(aofFile);
                currentSize = writer.size();
                baseSize = currentSize;
            } catch (IOException e) {
                markFailed(e);
                throw e;
            }
            log.info("AOF重写完成，新文件大小: {} bytes（其中重写期间追加 {} bytes）",
                    currentSize, rewriteBuffer.readableBytes());
        } finally {
            releaseRewriteBuffer();
            writeLock.unlock();
            FileUtils.deleteQuietly(rewriteTempFile);
        }
    }

    /**
     * 放弃进行中的重写。
     */
    public void abortRewrite() {
        writeLock.lock();
        try {
            releaseRewriteBuffer();
        } finally {
            writeLock.unlock();
        }
        FileUtils.deleteQuietly(rewriteTempFile);
    }

    private void releaseRewriteBuffer() {
        if (rewriteBuffer != null) {
            rewriteBuffer.release();
            rewriteBuffer = null;
        }
    }

    public long getCurrentSize() {
        writeLock.lock();
        try {
            return currentSize;
        } finally {
            writeLock.unlock();
        }
    }

    public File getAofFile() {
        return aofFile;
    }

    public AofSyncPolicy getSyncPolicy() {
        return syncPolicy;
    }

    /**
     * 停止定时任务，最后一次 fsync 后关闭文件。
     */
    @Override
    public void close() throws IOException {
        fsyncScheduler.shutdown();
        try {
            if (!fsyncScheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                fsyncScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            fsyncScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        writeLock.lock();
        try {
            releaseRewriteBuffer();
            if (writer != null) {
                writer.flush();
                writer.close();
                writer = null;
                log.info("AOF已刷盘并关闭: {}", aofFile.getAbsolutePath());
            }
        } finally {
            writeLock.unlock();
        }
    }
}
