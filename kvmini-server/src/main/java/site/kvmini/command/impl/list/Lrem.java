package site.kvmini.command.impl.list;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvList;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * LREM key count element。count 为正从表头删除，为负从表尾删除，为 0 删除全部匹配元素。
 * 列表删空后删除键。
 *
 * @author hnfy258
 * @since 1.0
 */
public class Lrem extends AbstractCommand {

    private long count;

    public Lrem(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.LREM;
    }

    @Override
    protected void parseArgs() {
        count = argLong(2);
    }

    @Override
    public Resp handle() {
        final KvBytes key = arg(1);
        final KvList list = keyspace().get(key, KvList.class);
        if (list == null) {
            return RespInteger.ZERO;
        }
        final int removed = list.remove(count, arg(3));
        if (removed > 0) {
            if (list.isEmpty()) {
                keyspace().delete(key);
            }
            markChanged();
        }
        return RespInteger.valueOf(removed);
    }
}
