package site.kvmini.core;

import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;

/**
 * 命令执行器。
 *
 * <p>持久化模块通过这个接口回放 AOF 记录，服务端模块提供实现，
 * 回放和在线请求走同一条分发路径。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface CommandExecutor {

    /**
     * 执行一条命令。
     *
     * @param command 由批量字符串组成的命令数组
     * @return 命令的回复，失败时为错误帧
     */
    Resp execute(RespArray command);
}
