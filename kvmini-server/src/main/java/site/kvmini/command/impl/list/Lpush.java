package site.kvmini.command.impl.list;

import site.kvmini.command.CommandType;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * LPUSH key element [element ...]，元素依次插入表头，结果与参数顺序相反。
 */
public class Lpush extends AbstractPush {

    public Lpush(ServerContext context, ClientSession session) {
        super(context, session, true);
    }

    @Override
    public CommandType getType() {
        return CommandType.LPUSH;
    }
}
