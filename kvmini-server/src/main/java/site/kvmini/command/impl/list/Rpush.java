package site.kvmini.command.impl.list;

import site.kvmini.command.CommandType;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Rpush extends AbstractPush {

    public Rpush(ServerContext context, ClientSession session) {
        super(context, session, false);
    }

    @Override
    public CommandType getType() {
        return CommandType.RPUSH;
    }
}
