package site.kvmini.command.impl.pubsub;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

import java.util.ArrayList;
import java.util.List;

/**
 * 订阅类命令的公共部分。每个频道或模式单独回复一条确认，确认通过会话发送，
 * {@link #handle()} 返回 null。
 *
 * @author hnfy258
 * @since 1.0
 */
abstract class AbstractSubscriptionCommand extends AbstractCommand {

    AbstractSubscriptionCommand(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public Resp handle() {
        if (session == null) {
            throw new CommandException("ERR " + commandName() + " is not allowed in this context");
        }
        final List<KvBytes> targets = new ArrayList<>();
        for (int i = 1; i < argCount(); i++) {
            targets.add(arg(i));
        }
        apply(targets);
        return null;
    }

    /**
     * 对每个目标执行订阅或退订，并调用 {@link #confirm(String, KvBytes)}。
     */
    protected abstract void apply(List<KvBytes> targets);

    /**
     * 发送确认，计数是本连接当前的频道加模式订阅总数。
     */
    protected void confirm(String kind, KvBytes name) {
        session.reply(new RespArray(new Resp[]{
                BulkString.fromString(kind),
                name == null ? BulkString.NULL : BulkString.create(name),
                RespInteger.valueOf(session.subscriptionCount())}));
    }
}
