package site.kvmini.command.impl.string;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Append extends AbstractCommand {

    public Append(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.APPEND;
    }

    @Override
    public Resp handle() {
        final KvBytes key = arg(1);
        final KvString current = keyspace().get(key, KvString.class);
        final int length;
        if (current == null) {
            keyspace().putKeepTtl(key, new KvString(arg(2)));
            length = arg(2).length();
        } else {
            length = current.append(arg(2));
        }
        markChanged();
        return RespInteger.valueOf(length);
    }
}
