package site.kvmini.command.impl.pubsub;

import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

import java.util.List;

/**
 * UNSUBSCRIBE [channel ...]，不带参数时退订全部频道。
 */
public class Unsubscribe extends AbstractSubscriptionCommand {

    public Unsubscribe(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.UNSUBSCRIBE;
    }

    @Override
    protected void apply(List<KvBytes> targets) {
        final List<KvBytes> channels = targets.isEmpty() ? session.getChannels() : targets;
        if (channels.isEmpty()) {
            confirm("unsubscribe", null);
            return;
        }
        for (KvBytes channel : channels) {
            if (session.removeChannel(channel)) {
                context.getBroker().unsubscribe(session, channel);
            }
            confirm("unsubscribe", channel);
        }
    }
}
