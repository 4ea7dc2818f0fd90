package site.kvmini.command.impl.list;

import site.kvmini.command.CommandType;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Lpop extends AbstractPop {

    public Lpop(ServerContext context, ClientSession session) {
        super(context, session, true);
    }

    @Override
    public CommandType getType() {
        return CommandType.LPOP;
    }
}
