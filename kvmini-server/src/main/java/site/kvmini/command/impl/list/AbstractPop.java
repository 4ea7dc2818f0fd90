package site.kvmini.command.impl.list;

import site.kvmini.command.AbstractCommand;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvList;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * LPOP 和 RPOP。弹出最后一个元素后删除键。
 */
abstract class AbstractPop extends AbstractCommand {

    private final boolean head;

    AbstractPop(ServerContext context, ClientSession session, boolean head) {
        super(context, session);
        this.head = head;
    }

    @Override
    public Resp handle() {
        final KvBytes key = arg(1);
        final KvList list = keyspace().get(key, KvList.class);
        if (list == null) {
            return BulkString.NULL;
        }
        final KvBytes element = head ? list.lpop() : list.rpop();
        if (element == null) {
            return BulkString.NULL;
        }
        if (list.isEmpty()) {
            keyspace().delete(key);
        }
        markChanged();
        return BulkString.create(element);
    }
}
