package site.kvmini.command.impl.pubsub;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * PUBLISH channel message，返回接收到消息的订阅数量。
 */
public class Publish extends AbstractCommand {

    public Publish(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.PUBLISH;
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(context.getBroker().publish(arg(1), arg(2)));
    }
}
