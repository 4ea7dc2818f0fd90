package site.kvmini.command.impl.hash;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvHash;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Hlen extends AbstractCommand {

    public Hlen(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.HLEN;
    }

    @Override
    public Resp handle() {
        final KvHash hash = keyspace().get(arg(1), KvHash.class);
        return RespInteger.valueOf(hash == null ? 0 : hash.size());
    }
}
