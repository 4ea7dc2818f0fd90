package site.kvmini.command.impl.key;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * DEL key [key ...]，返回实际删除的键数量。
 */
public class Del extends AbstractCommand {

    public Del(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.DEL;
    }

    @Override
    public Resp handle() {
        int deleted = 0;
        for (int i = 1; i < argCount(); i++) {
            if (keyspace().delete(arg(i))) {
                deleted++;
            }
        }
        if (deleted > 0) {
            markChanged();
        }
        return RespInteger.valueOf(deleted);
    }
}
