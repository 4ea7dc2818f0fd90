package site.kvmini.aof;

import java.io.IOException;

/**
 * AOF 写入或刷盘失败。命令的结果没有持久化，不能向客户端返回成功。
 *
 * @author hnfy258
 * @since 1.0
 */
public class AofWriteException extends IOException {

    public AofWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
