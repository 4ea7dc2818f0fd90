package site.kvmini.command.impl.list;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvList;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

import java.util.List;

/**
 * LRANGE key start stop，下标含两端，负数从表尾计数。
 *
 * @author hnfy258
 * @since 1.0
 */
public class Lrange extends AbstractCommand {

    private long start;

    private long stop;

    public Lrange(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.LRANGE;
    }

    @Override
    protected void parseArgs() {
        start = argLong(2);
        stop = argLong(3);
    }

    @Override
    public Resp handle() {
        final KvList list = keyspace().get(arg(1), KvList.class);
        if (list == null) {
            return RespArray.EMPTY;
        }
        final List<KvBytes> elements = list.range(start, stop);
        final Resp[] result = new Resp[elements.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = BulkString.create(elements.get(i));
        }
        return new RespArray(result);
    }
}
