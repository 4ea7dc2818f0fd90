package site.kvmini.command.impl.key;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * TTL 和 PTTL。键不存在返回 -2，没有过期时间返回 -1。
 */
public class Ttl extends AbstractCommand {

    private final CommandType type;

    public Ttl(ServerContext context, ClientSession session, CommandType type) {
        super(context, session);
        this.type = type;
    }

    @Override
    public CommandType getType() {
        return type;
    }

    @Override
    public Resp handle() {
        final long millis = keyspace().ttlMillis(arg(1));
        if (millis < 0) {
            return RespInteger.valueOf(millis);
        }
        return RespInteger.valueOf(type == CommandType.PTTL ? millis : (millis + 500) / 1000);
    }
}
