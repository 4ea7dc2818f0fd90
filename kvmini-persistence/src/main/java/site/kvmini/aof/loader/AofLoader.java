package site.kvmini.aof.loader;

import io.netty.buffer.Unpooled;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.core.CommandExecutor;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Errors;
import site.kvmini.protocol.ProtocolException;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.protocol.RespParser;
import site.kvmini.rdb.CorruptSnapshotException;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

/**
 * AOF 文件加载器。
 *
 * <p>从头顺序读取 RESP 格式的命令记录，每条都交给 {@link CommandExecutor} 执行，
 * 与在线请求走同一条分发路径。文件按块流式读取，不需要一次装入内存。
 *
 * <p>错误处理策略：
 * <ul>
 *     <li>文件尾部的记录不完整：视为异常关机时最后一次写入没写完，停止回放，不算错误</li>
 *     <li>中间出现无法解析的记录：停止回放，保留之前已经执行的部分</li>
 *     <li>记录能解析但执行返回错误：记录日志后继续</li>
 * </ul>
 * 两种停止情况都会在结果中给出最后一条完整记录的结束位置，调用方据此截断文件。
 *
 * <p>重写产生的文件以 RDB 快照开头（以 {@code REDIS} 魔数识别），快照交给 {@link PreambleReader}
 * 装入键空间，之后的命令记录接着回放。快照部分损坏时抛出 {@link CorruptSnapshotException}，
 * 不做任何截断。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class AofLoader {

    private static final int BUFFER_SIZE = 64 * 1024;

    private static final byte[] PREAMBLE_PREFIX = "REDIS".getBytes(StandardCharsets.US_ASCII);

    private final File file;

    private final CommandExecutor executor;

    private final long maxBulkLen;

    private final PreambleReader preambleReader;

    public AofLoader(File file, CommandExecutor executor, long maxBulkLen) {
        this(file, executor, maxBulkLen, null);
    }

    /**
     * @param preambleReader 读取 RDB 前导的回调，为 null 时遇到前导视为损坏
     */
    public AofLoader(File file, CommandExecutor executor, long maxBulkLen, PreambleReader preambleReader) {
        this.file = file;
        this.executor = executor;
        this.maxBulkLen = maxBulkLen;
        this.preambleReader = preambleReader;
    }

    /**
     * 加载并回放整个文件。
     *
     * @return 加载结果，文件不存在时返回空结果
     * @throws CorruptSnapshotException RDB 前导损坏
     * @throws IOException              文件无法读取
     */
    public LoadResult load() throws IOException {
        if (!file.exists() || file.length() == 0) {
            log.info("AOF文件不存在或为空: {}", file.getAbsolutePath());
            return new LoadResult(0, 0, 0, 0, 0, null);
        }

        log.info("开始加载AOF文件: {}, 大小: {} bytes", file.getAbsolutePath(), file.length());
        long commands = 0;
        long failed = 0;
        final long fileSize;
        try (FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.READ);
             RespParser parser = new RespParser(maxBulkLen)) {
            fileSize = channel.size();
            final long base = readPreamble(channel, fileSize);
            channel.position(base);
            final ByteBuffer chunk = ByteBuffer.allocate(BUFFER_SIZE);
            while (channel.read(chunk) > 0) {
                chunk.flip();
                parser.append(Unpooled.wrappedBuffer(chunk));
                chunk.clear();
                try {
                    RespArray command;
                    while ((command = nextCommand(parser)) != null) {
                        final Resp reply = executor.execute(command);
                        commands++;
                        if (reply instanceof Errors) {
                            failed++;
                            log.warn("AOF命令执行失败: {} -> {}", command, ((Errors) reply).getContent());
                        }
                    }
                } catch (CorruptLogRecordException e) {
                    log.warn("AOF记录损坏，停止回放: {}", e.getMessage());
                    return new LoadResult(base, commands, failed, base + parser.consumed(), fileSize, e);
                }
            }
            if (parser.remaining() > 0) {
                log.warn("AOF文件尾部有 {} 字节的不完整记录，视为未写完的最后一条命令", parser.remaining());
            }
            log.info("AOF文件加载完成，执行 {} 条命令，失败 {} 条", commands, failed);
            return new LoadResult(base, commands, failed, base + parser.consumed(), fileSize, null);
        }
    }

    /**
     * 文件以 RDB 魔数开头时读取前导快照。
     *
     * @return 前导的字节数，没有前导时为 0
     */
    private long readPreamble(FileChannel channel, long fileSize) throws IOException {
        final ByteBuffer head = ByteBuffer.allocate(PREAMBLE_PREFIX.length);
        while (head.hasRemaining()) {
            if (channel.read(head, head.position()) <= 0) {
                break;
            }
        }
        if (head.hasRemaining()
                || !Arrays.equals(head.array(), PREAMBLE_PREFIX)) {
            return 0;
        }
        if (preambleReader == null) {
            throw new CorruptSnapshotException("AOF文件以RDB快照开头，但没有配置快照加载");
        }
        channel.position(0);
        // 不关闭这个流，否则会连带关闭通道
        final InputStream in = new BufferedInputStream(Channels.newInputStream(channel), BUFFER_SIZE);
        final long length = preambleReader.read(in, fileSize);
        log.info("AOF的RDB前导加载完成: {} bytes", length);
        return length;
    }

    /**
     * 取出下一条完整的命令记录。
     *
     * @return 命令，数据不足时返回 null
     * @throws CorruptLogRecordException 记录无法解析或不是命令数组
     */
    private static RespArray nextCommand(RespParser parser) throws CorruptLogRecordException {
        final long offset = parser.consumed();
        final Resp frame;
        try {
            frame = parser.next();
        } catch (ProtocolException e) {
            throw new CorruptLogRecordException(e.getMessage(), offset, e);
        }
        if (frame == null) {
            return null;
        }
        if (!(frame instanceof RespArray) || ((RespArray) frame).size() == 0) {
            throw new CorruptLogRecordException("record is not a command array", offset, null);
        }
        for (Resp element : ((RespArray) frame).getContent()) {
            if (!(element instanceof BulkString) || ((BulkString) element).isNull()) {
                throw new CorruptLogRecordException("command contains a non bulk element", offset, null);
            }
        }
        return (RespArray) frame;
    }

    /**
     * 读取并应用 AOF 开头的 RDB 快照。
     */
    @FunctionalInterface
    public interface PreambleReader {
        /**
         * @param in        位于快照魔数处的输入流，可能已经预读了快照之后的数据
         * @param maxLength 单个字符串允许的最大长度
         * @return 快照占用的字节数
         * @throws CorruptSnapshotException 快照损坏
         */
        long read(InputStream in, long maxLength) throws IOException;
    }

    /**
     * 加载结果。
     */
    @Getter
    public static final class LoadResult {
        /** RDB 前导的字节数 */
        private final long preambleBytes;
        /** 执行的命令数 */
        private final long commands;
        /** 执行返回错误的命令数 */
        private final long failed;
        /** 最后一条完整记录的结束位置 */
        private final long validBytes;
        private final long fileSize;
        /** 回放因损坏记录停止时的原因 */
        private final CorruptLogRecordException corruption;

        public LoadResult(long preambleBytes, long commands, long failed, long validBytes, long fileSize,
                          CorruptLogRecordException corruption) {
            this.preambleBytes = preambleBytes;
            this.commands = commands;
            this.failed = failed;
            this.validBytes = validBytes;
            this.fileSize = fileSize;
            this.corruption = corruption;
        }

        /**
         * @return 文件在最后一条完整记录之后还有多余字节
         */
        public boolean isTruncated() {
            return validBytes < fileSize;
        }
    }
}
