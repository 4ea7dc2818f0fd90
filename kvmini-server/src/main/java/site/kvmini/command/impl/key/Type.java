package site.kvmini.command.impl.key;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvData;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Type extends AbstractCommand {

    private static final SimpleString NONE = new SimpleString("none");

    public Type(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.TYPE;
    }

    @Override
    public Resp handle() {
        final KvData data = keyspace().get(arg(1));
        return data == null ? NONE : new SimpleString(data.type().getTypeName());
    }
}
