package site.kvmini.command.impl.hash;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvHash;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * HSETNX key field value，只在字段不存在时写入。
 */
public class Hsetnx extends AbstractCommand {

    public Hsetnx(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.HSETNX;
    }

    @Override
    public Resp handle() {
        final KvBytes key = arg(1);
        KvHash hash = keyspace().get(key, KvHash.class);
        if (hash != null && hash.contains(arg(2))) {
            return RespInteger.ZERO;
        }
        if (hash == null) {
            hash = new KvHash();
            keyspace().set(key, hash);
        }
        hash.put(arg(2), arg(3));
        markChanged();
        return RespInteger.ONE;
    }
}
