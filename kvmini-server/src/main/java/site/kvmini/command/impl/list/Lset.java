package site.kvmini.command.impl.list;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvList;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Lset extends AbstractCommand {

    private long index;

    public Lset(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.LSET;
    }

    @Override
    protected void parseArgs() {
        index = argLong(2);
    }

    @Override
    public Resp handle() {
        final KvList list = keyspace().get(arg(1), KvList.class);
        if (list == null) {
            throw CommandException.noSuchKey();
        }
        if (!list.set(index, arg(3))) {
            throw CommandException.indexOutOfRange();
        }
        markChanged();
        return SimpleString.OK;
    }
}
