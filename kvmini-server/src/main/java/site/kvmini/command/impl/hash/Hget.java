package site.kvmini.command.impl.hash;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvHash;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Hget extends AbstractCommand {

    public Hget(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.HGET;
    }

    @Override
    public Resp handle() {
        final KvHash hash = keyspace().get(arg(1), KvHash.class);
        if (hash == null) {
            return BulkString.NULL;
        }
        final KvBytes value = hash.get(arg(2));
        return value == null ? BulkString.NULL : BulkString.create(value);
    }
}
