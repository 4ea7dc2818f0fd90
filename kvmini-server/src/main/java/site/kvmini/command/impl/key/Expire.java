package site.kvmini.command.impl.key;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.database.Keyspace;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * EXPIRE key seconds
 *
 * <p>相对时间在执行时换算成绝对时间，AOF 中记录为 PEXPIREAT，回放结果与重启时间无关。
 * 非正数的秒数会让键立即过期。
 *
 * @author hnfy258
 * @since 1.0
 */
public class Expire extends AbstractCommand {

    private static final BulkString PEXPIREAT = BulkString.fromString("PEXPIREAT");

    private KvBytes key;

    private long seconds;

    private long expireAt = Keyspace.NO_EXPIRY;

    public Expire(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.EXPIRE;
    }

    @Override
    protected void parseArgs() {
        key = arg(1);
        seconds = argLong(2);
    }

    @Override
    public Resp handle() {
        final long at;
        try {
            at = Math.addExact(keyspace().now(), Math.multiplyExact(seconds, 1000L));
        } catch (ArithmeticException e) {
            throw CommandException.invalidExpireTime(commandName());
        }
        if (!keyspace().expireAt(key, at)) {
            return RespInteger.ZERO;
        }
        expireAt = at;
        markChanged();
        return RespInteger.ONE;
    }

    @Override
    public RespArray propagate() {
        if (!isChanged()) {
            return null;
        }
        return new RespArray(new Resp[]{PEXPIREAT, BulkString.create(key),
                BulkString.fromString(Long.toString(expireAt))});
    }
}
