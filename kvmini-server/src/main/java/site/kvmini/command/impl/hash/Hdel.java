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
 * HDEL key field [field ...]，删除最后一个字段时一并删除键。
 */
public class Hdel extends AbstractCommand {

    public Hdel(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.HDEL;
    }

    @Override
    public Resp handle() {
        final KvBytes key = arg(1);
        final KvHash hash = keyspace().get(key, KvHash.class);
        if (hash == null) {
            return RespInteger.ZERO;
        }
        int removed = 0;
        for (int i = 2; i < argCount(); i++) {
            if (hash.delete(arg(i))) {
                removed++;
            }
        }
        if (removed > 0) {
            if (hash.isEmpty()) {
                keyspace().delete(key);
            }
            markChanged();
        }
        return RespInteger.valueOf(removed);
    }
}
