package site.kvmini.command.impl.key;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Exists extends AbstractCommand {

    public Exists(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.EXISTS;
    }

    @Override
    public Resp handle() {
        // 重复的键重复计数
        int count = 0;
        for (int i = 1; i < argCount(); i++) {
            if (keyspace().exists(arg(i))) {
                count++;
            }
        }
        return RespInteger.valueOf(count);
    }
}
