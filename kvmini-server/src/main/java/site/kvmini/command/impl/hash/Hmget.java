package site.kvmini.command.impl.hash;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvHash;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * HMGET key field [field ...]，不存在的字段对应空值，键不存在时全部为空值。
 */
public class Hmget extends AbstractCommand {

    public Hmget(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.HMGET;
    }

    @Override
    public Resp handle() {
        final KvHash hash = keyspace().get(arg(1), KvHash.class);
        final Resp[] values = new Resp[argCount() - 2];
        for (int i = 2; i < argCount(); i++) {
            final KvBytes value = hash == null ? null : hash.get(arg(i));
            values[i - 2] = value == null ? BulkString.NULL : BulkString.create(value);
        }
        return new RespArray(values);
    }
}
