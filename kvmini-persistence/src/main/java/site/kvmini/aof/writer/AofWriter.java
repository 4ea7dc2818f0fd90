package site.kvmini.aof.writer;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;

/**
 * 基于 {@link FileChannel} 的 AOF 写入器，打开时定位到文件末尾追加。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class AofWriter implements Writer {

    private final File file;

    private final FileChannel channel;

    public AofWriter(File file) throws IOException {
        this.file = file;
        this.channel = FileChannel.open(file.toPath(), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        this.channel.position(channel.size());
        log.debug("AOF文件已打开: {}, 当前大小: {}", file.getAbsolutePath(), channel.size());
    }

    @Override
    public int write(ByteBuffer buffer) throws IOException {
        int written = 0;
        while (buffer.hasRemaining()) {
            written += channel.write(buffer);
        }
        return written;
    }

    @Override
    public void flush() throws IOException {
        channel.force(false);
    }

    @Override
    public long size() throws IOException {
        return channel.size();
    }

    @Override
    public void truncate(long size) throws IOException {
        channel.truncate(size);
        channel.position(size);
    }

    public File getFile() {
        return file;
    }

    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            channel.force(true);
            channel.close();
        }
    }
}
