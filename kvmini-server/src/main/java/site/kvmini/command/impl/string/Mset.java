package site.kvmini.command.impl.string;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Mset extends AbstractCommand {

    public Mset(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.MSET;
    }

    @Override
    protected void parseArgs() {
        if ((argCount() - 1) % 2 != 0) {
            throw CommandException.wrongArgCount(commandName());
        }
    }

    @Override
    public Resp handle() {
        for (int i = 1; i < argCount(); i += 2) {
            keyspace().set(arg(i), new KvString(arg(i + 1)));
        }
        markChanged();
        return SimpleString.OK;
    }
}
