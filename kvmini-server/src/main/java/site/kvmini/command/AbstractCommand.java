package site.kvmini.command;

import site.kvmini.database.Keyspace;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * 命令的公共部分：保存参数，提供参数读取和 AOF 传播的默认实现。
 *
 * <p>写命令在实际改变了数据时调用 {@link #markChanged()}，默认按原样传播请求；
 * 需要改写记录的命令覆盖 {@link #propagate()}。
 *
 * @author hnfy258
 * @since 1.0
 */
public abstract class AbstractCommand implements Command {

    protected final ServerContext context;

    /** 发起请求的连接，AOF 回放时为 null */
    protected final ClientSession session;

    protected Resp[] args;

    private boolean changed;

    protected AbstractCommand(ServerContext context, ClientSession session) {
        this.context = context;
        this.session = session;
    }

    @Override
    public void setContext(Resp[] array) {
        this.args = array;
        parseArgs();
    }

    /**
     * 子类在这里解析和校验参数，此时还没有持有键空间锁。
     */
    protected void parseArgs() {
    }

    protected Keyspace keyspace() {
        return context.getKeyspace();
    }

    protected KvBytes arg(int index) {
        return ((BulkString) args[index]).getContent();
    }

    protected int argCount() {
        return args.length;
    }

    protected long argLong(int index) {
        return parseLong(arg(index));
    }

    protected String commandName() {
        return getType().getLowerName();
    }

    protected void markChanged() {
        changed = true;
    }

    protected boolean isChanged() {
        return changed;
    }

    @Override
    public RespArray propagate() {
        return changed ? new RespArray(args) : null;
    }

    /**
     * 按 Redis 的整数规则解析：可选的负号加十进制数字，不允许空白和前导 +。
     *
     * @throws CommandException 不是合法的 64 位整数
     */
    public static long parseLong(KvBytes value) {
        final byte[] bytes = value.getBytesUnsafe();
        if (bytes.length == 0 || bytes.length > 20) {
            throw CommandException.notInteger();
        }
        final boolean negative = bytes[0] == '-';
        int i = negative ? 1 : 0;
        if (i == bytes.length) {
            throw CommandException.notInteger();
        }
        long result = 0;
        for (; i < bytes.length; i++) {
            final int digit = bytes[i] - '0';
            if (digit < 0 || digit > 9) {
                throw CommandException.notInteger();
            }
            if (result < (Long.MIN_VALUE + digit) / 10) {
                throw CommandException.notInteger();
            }
            result = result * 10 - digit;
        }
        if (!negative) {
            if (result == Long.MIN_VALUE) {
                throw CommandException.notInteger();
            }
            result = -result;
        }
        return result;
    }
}
