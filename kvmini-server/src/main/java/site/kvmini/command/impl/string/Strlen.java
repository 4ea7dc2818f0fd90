package site.kvmini.command.impl.string;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Strlen extends AbstractCommand {

    public Strlen(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.STRLEN;
    }

    @Override
    public Resp handle() {
        final KvString value = keyspace().get(arg(1), KvString.class);
        return RespInteger.valueOf(value == null ? 0 : value.getValue().length());
    }
}
