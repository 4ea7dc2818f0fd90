package site.kvmini.command.impl.list;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvList;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Llen extends AbstractCommand {

    public Llen(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.LLEN;
    }

    @Override
    public Resp handle() {
        final KvList list = keyspace().get(arg(1), KvList.class);
        return RespInteger.valueOf(list == null ? 0 : list.size());
    }
}
