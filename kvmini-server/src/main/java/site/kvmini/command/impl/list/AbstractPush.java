package site.kvmini.command.impl.list;

import site.kvmini.command.AbstractCommand;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvList;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * LPUSH 和 RPUSH 的共同实现，键不存在时创建新列表，返回推入后的长度。
 *
 * @author hnfy258
 * @since 1.0
 */
abstract class AbstractPush extends AbstractCommand {

    private final boolean head;

    private KvBytes[] values;

    AbstractPush(ServerContext context, ClientSession session, boolean head) {
        super(context, session);
        this.head = head;
    }

    @Override
    protected void parseArgs() {
        values = new KvBytes[argCount() - 2];
        for (int i = 2; i < argCount(); i++) {
            values[i - 2] = arg(i);
        }
    }

    @Override
    public Resp handle() {
        final KvBytes key = arg(1);
        KvList list = keyspace().get(key, KvList.class);
        if (list == null) {
            list = new KvList();
            keyspace().set(key, list);
        }
        final int size = head ? list.lpush(values) : list.rpush(values);
        markChanged();
        return RespInteger.valueOf(size);
    }
}
