package site.kvmini.rdb;

import java.io.IOException;

/**
 * 快照文件损坏：魔数不对、校验和不匹配、结构无法解析或被截断。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public class CorruptSnapshotException extends IOException {

    public CorruptSnapshotException(String message) {
        super(message);
    }

    public CorruptSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
