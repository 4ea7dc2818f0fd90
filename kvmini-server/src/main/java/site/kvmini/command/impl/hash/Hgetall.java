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

import java.util.Map;

/**
 * HGETALL key，按插入顺序返回字段和值交替排列的数组。
 */
public class Hgetall extends AbstractCommand {

    public Hgetall(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.HGETALL;
    }

    @Override
    public Resp handle() {
        final KvHash hash = keyspace().get(arg(1), KvHash.class);
        if (hash == null) {
            return RespArray.EMPTY;
        }
        final Map<KvBytes, KvBytes> all = hash.getAll();
        final Resp[] result = new Resp[all.size() * 2];
        int i = 0;
        for (Map.Entry<KvBytes, KvBytes> entry : all.entrySet()) {
            result[i++] = BulkString.create(entry.getKey());
            result[i++] = BulkString.create(entry.getValue());
        }
        return new RespArray(result);
    }
}
