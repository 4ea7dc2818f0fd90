package site.kvmini.command;

import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;

/**
 * 命令接口。每次请求创建一个实例：先 {@link #setContext(Resp[])} 解析参数，再 {@link #handle()} 执行。
 *
 * <p>写命令执行后由分发器调用 {@link #propagate()} 取得要写入 AOF 的记录。
 *
 * @author hnfy258
 * @since 1.0
 */
public interface Command {

    CommandType getType();

    /**
     * 设置参数并做语法检查。
     *
     * @param array 完整的请求数组，第一个元素是命令名
     * @throws CommandException 参数不合法
     */
    void setContext(Resp[] array);

    /**
     * 执行命令。在键空间锁内调用（发布订阅命令除外）。
     *
     * @return 回复，已经通过会话自行回复时返回 null
     * @throws CommandException 执行失败
     */
    Resp handle();

    default boolean isWriteCommand() {
        return getType().isWrite();
    }

    /**
     * 写命令要追加到 AOF 的记录。时间相关的参数换算成绝对时间，保证回放结果与执行时一致。
     *
     * @return 记录，命令没有改变任何数据时返回 null
     */
    default RespArray propagate() {
        return null;
    }
}
