package site.kvmini.aof.writer;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * AOF 底层写入接口。
 *
 * @author hnfy258
 * @since 1.0
 */
public interface Writer extends AutoCloseable {

    /**
     * 把缓冲区内容完整写入文件（写入操作系统缓存，不保证落盘）。
     *
     * @return 写入的字节数
     */
    int write(ByteBuffer buffer) throws IOException;

    /**
     * fsync，返回后已写入的数据全部落盘。
     */
    void flush() throws IOException;

    /**
     * @return 当前文件长度
     */
    long size() throws IOException;

    /**
     * 把文件截断到指定长度，后续写入从该位置继续。用于丢弃写了一半的记录。
     */
    void truncate(long size) throws IOException;

    @Override
    void close() throws IOException;
}
