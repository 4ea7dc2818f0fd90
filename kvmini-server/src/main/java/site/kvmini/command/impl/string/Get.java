package site.kvmini.command.impl.string;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvString;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Get extends AbstractCommand {

    public Get(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public Resp handle() {
        final KvString value = keyspace().get(arg(1), KvString.class);
        return value == null ? BulkString.NULL : BulkString.create(value.getValue());
    }
}
