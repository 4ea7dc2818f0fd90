package site.kvmini.command.impl.key;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * PEXPIREAT key unix-milliseconds，也是 AOF 记录过期时间使用的形式。
 */
public class Pexpireat extends AbstractCommand {

    private long expireAt;

    public Pexpireat(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.PEXPIREAT;
    }

    @Override
    protected void parseArgs() {
        expireAt = argLong(2);
    }

    @Override
    public Resp handle() {
        if (!keyspace().expireAt(arg(1), expireAt)) {
            return RespInteger.ZERO;
        }
        markChanged();
        return RespInteger.ONE;
    }
}
