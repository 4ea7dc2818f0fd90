package site.kvmini.command.impl.pubsub;

import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

import java.util.List;

/**
 * PSUBSCRIBE pattern [pattern ...]，模式使用 glob 语法。
 */
public class Psubscribe extends AbstractSubscriptionCommand {

    public Psubscribe(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.PSUBSCRIBE;
    }

    @Override
    protected void apply(List<KvBytes> targets) {
        for (KvBytes pattern : targets) {
            if (session.addPattern(pattern)) {
                context.getBroker().psubscribe(session, pattern);
            }
            confirm("psubscribe", pattern);
        }
    }
}
