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
 * HKEYS key，按插入顺序返回所有字段。
 */
public class Hkeys extends AbstractCommand {

    public Hkeys(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.HKEYS;
    }

    @Override
    public Resp handle() {
        final KvHash hash = keyspace().get(arg(1), KvHash.class);
        if (hash == null) {
            return RespArray.EMPTY;
        }
        final Resp[] result = new Resp[hash.size()];
        int i = 0;
        for (KvBytes field : hash.getAll().keySet()) {
            result[i++] = BulkString.create(field);
        }
        return new RespArray(result);
    }
}
