package site.kvmini.command;

/**
 * 命令属性位。
 *
 * @author hnfy258
 * @since 1.0
 */
public final class CommandFlags {

    private CommandFlags() {
    }

    /** 会修改键空间，改变数据时追加到 AOF */
    public static final int WRITE = 1;

    /** 连接处于订阅状态时仍然允许 */
    public static final int SUBSCRIBE_CONTEXT = 1 << 1;

    /** 不访问键空间，执行时不需要键空间锁 */
    public static final int NO_KEYSPACE = 1 << 2;
}
