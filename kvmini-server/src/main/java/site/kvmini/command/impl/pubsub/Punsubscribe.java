package site.kvmini.command.impl.pubsub;

import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

import java.util.List;

public class Punsubscribe extends AbstractSubscriptionCommand {

    public Punsubscribe(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.PUNSUBSCRIBE;
    }

    @Override
    protected void apply(List<KvBytes> targets) {
        final List<KvBytes> patterns = targets.isEmpty() ? session.getPatterns() : targets;
        if (patterns.isEmpty()) {
            confirm("punsubscribe", null);
            return;
        }
        for (KvBytes pattern : patterns) {
            if (session.removePattern(pattern)) {
                context.getBroker().punsubscribe(session, pattern);
            }
            confirm("punsubscribe", pattern);
        }
    }
}
