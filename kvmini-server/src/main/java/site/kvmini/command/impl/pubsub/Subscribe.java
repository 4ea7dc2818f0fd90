package site.kvmini.command.impl.pubsub;

import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

import java.util.List;

public class Subscribe extends AbstractSubscriptionCommand {

    public Subscribe(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.SUBSCRIBE;
    }

    @Override
    protected void apply(List<KvBytes> targets) {
        for (KvBytes channel : targets) {
            if (session.addChannel(channel)) {
                context.getBroker().subscribe(session, channel);
            }
            confirm("subscribe", channel);
        }
    }
}
