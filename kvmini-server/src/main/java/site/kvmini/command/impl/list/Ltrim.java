package site.kvmini.command.impl.list;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvList;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * LTRIM key start stop，只保留区间内的元素，区间为空时删除键。
 */
public class Ltrim extends AbstractCommand {

    private long start;

    private long stop;

    public Ltrim(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.LTRIM;
    }

    @Override
    protected void parseArgs() {
        start = argLong(2);
        stop = argLong(3);
    }

    @Override
    public Resp handle() {
        final KvBytes key = arg(1);
        final KvList list = keyspace().get(key, KvList.class);
        if (list == null) {
            return SimpleString.OK;
        }
        if (list.trim(start, stop) > 0) {
            if (list.isEmpty()) {
                keyspace().delete(key);
            }
            markChanged();
        }
        return SimpleString.OK;
    }
}
