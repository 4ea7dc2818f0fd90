package site.kvmini.command.impl.connection;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Echo extends AbstractCommand {

    public Echo(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public Resp handle() {
        return BulkString.create(arg(1));
    }
}
