package site.kvmini.command.impl.server;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Dbsize extends AbstractCommand {

    public Dbsize(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.DBSIZE;
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(keyspace().size());
    }
}
