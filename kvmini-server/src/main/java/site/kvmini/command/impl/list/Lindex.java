package site.kvmini.command.impl.list;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvList;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Lindex extends AbstractCommand {

    private long index;

    public Lindex(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.LINDEX;
    }

    @Override
    protected void parseArgs() {
        index = argLong(2);
    }

    @Override
    public Resp handle() {
        final KvList list = keyspace().get(arg(1), KvList.class);
        if (list == null) {
            return BulkString.NULL;
        }
        final KvBytes element = list.index(index);
        return element == null ? BulkString.NULL : BulkString.create(element);
    }
}
