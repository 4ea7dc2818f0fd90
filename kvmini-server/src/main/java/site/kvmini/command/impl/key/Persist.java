package site.kvmini.command.impl.key;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Persist extends AbstractCommand {

    public Persist(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.PERSIST;
    }

    @Override
    public Resp handle() {
        if (!keyspace().persist(arg(1))) {
            return RespInteger.ZERO;
        }
        markChanged();
        return RespInteger.ONE;
    }
}
