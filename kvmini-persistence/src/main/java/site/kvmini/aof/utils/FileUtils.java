package site.kvmini.aof.utils;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * 持久化文件的操作工具。
 *
 * <p>AOF 重写和 RDB 快照都先写临时文件，fsync 之后再用 {@link #atomicReplace(File, File)}
 * 覆盖正式文件，所以正式文件要么是旧版本，要么是完整的新版本。
 *
 * <p>线程安全性：方法本身无状态，同一目标文件的并发替换需要调用方同步。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public final class FileUtils {

    private FileUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 用源文件原子地替换目标文件，并刷新目录项。
     *
     * <p>优先使用 ATOMIC_MOVE，文件系统不支持时降级为 REPLACE_EXISTING。
     *
     * @param source 已经写完并 fsync 的临时文件
     * @param target 正式文件
     * @throws IOException 两种移动方式都失败
     */
    public static void atomicReplace(final File source, final File target) throws IOException {
        if (!source.exists()) {
            throw new IOException("Source file does not exist: " + source.getAbsolutePath());
        }
        final Path sourcePath = source.toPath();
        final Path targetPath = target.toPath();
        try {
            Files.move(sourcePath, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException | UnsupportedOperationException e) {
            log.debug("原子性移动失败，尝试普通移动: {}", e.getMessage());
            try {
                Files.move(sourcePath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            } catch (final IOException ex) {
                ex.addSuppressed(e);
                throw new IOException(String.format(
                        "Both atomic and regular file move failed from %s to %s", sourcePath, targetPath), ex);
            }
        }
        flushDir(targetPath.toAbsolutePath().normalize().getParent());
        log.debug("文件替换完成: {} -> {}", source.getAbsolutePath(), target.getAbsolutePath());
    }

    /**
     * 把字节完整写入文件并 fsync。
     */
    public static void writeAndSync(final File file, final byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            final ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    /**
     * 删除文件，失败只记录日志。用于清理失败任务留下的临时文件。
     */
    public static void deleteQuietly(final File file) {
        if (file == null || !file.exists()) {
            return;
        }
        try {
            Files.delete(file.toPath());
        } catch (IOException e) {
            log.warn("无法删除临时文件 {}: {}", file.getAbsolutePath(), e.getMessage());
        }
    }

    /**
     * 刷新目录，让重命名产生的目录项落盘。Windows 和 z/OS 不支持目录 fsync，直接跳过。
     */
    private static void flushDir(final Path path) {
        if (path == null) {
            return;
        }
        final String os = System.getProperty("os.name").toLowerCase();
        if (os.contains("win") || os.contains("z/os")) {
            return;
        }
        try (final FileChannel dir = FileChannel.open(path, StandardOpenOption.READ)) {
            dir.force(true);
        } catch (final IOException e) {
            // 目录刷新失败不影响已经完成的替换
            log.debug("目录刷新失败: {}, 错误: {}", path, e.getMessage());
        }
    }
}
