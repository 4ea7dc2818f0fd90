package site.kvmini.command.impl.string;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * INCR、INCRBY、DECR、DECRBY 的共同实现。键不存在时按 0 计算，保留原有的过期时间。
 *
 * @author hnfy258
 * @since 1.0
 */
public class Incr extends AbstractCommand {

    private final CommandType type;

    private KvBytes key;

    private long delta;

    public Incr(ServerContext context, ClientSession session, CommandType type) {
        super(context, session);
        this.type = type;
    }

    @Override
    public CommandType getType() {
        return type;
    }

    @Override
    protected void parseArgs() {
        key = arg(1);
        switch (type) {
            case INCR:
                delta = 1;
                break;
            case DECR:
                delta = -1;
                break;
            case INCRBY:
                delta = argLong(2);
                break;
            case DECRBY:
                final long decrement = argLong(2);
                if (decrement == Long.MIN_VALUE) {
                    throw new CommandException("ERR decrement would overflow");
                }
                delta = -decrement;
                break;
            default:
                throw new IllegalStateException("不是计数命令: " + type);
        }
    }

    @Override
    public Resp handle() {
        final KvString current = keyspace().get(key, KvString.class);
        final long base = current == null ? 0 : parseLong(current.getValue());
        final long result;
        try {
            result = Math.addExact(base, delta);
        } catch (ArithmeticException e) {
            throw new CommandException("ERR increment or decrement would overflow");
        }
        final KvBytes encoded = KvBytes.fromString(Long.toString(result));
        if (current == null) {
            keyspace().putKeepTtl(key, new KvString(encoded));
        } else {
            current.setValue(encoded);
        }
        markChanged();
        return RespInteger.valueOf(result);
    }
}
