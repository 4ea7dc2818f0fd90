package site.kvmini.aof.loader;

import java.io.IOException;

/**
 * AOF 中出现无法解析或不是命令的记录。
 *
 * @author hnfy258
 * @since 1.0
 */
public class CorruptLogRecordException extends IOException {

    private final long offset;

    public CorruptLogRecordException(String message, long offset, Throwable cause) {
        super(message + " (offset " + offset + ")", cause);
        this.offset = offset;
    }

    /**
     * @return 损坏记录在文件中的起始偏移
     */
    public long getOffset() {
        return offset;
    }
}
