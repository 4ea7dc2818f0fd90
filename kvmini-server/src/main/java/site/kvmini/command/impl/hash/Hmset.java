package site.kvmini.command.impl.hash;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvHash;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * HMSET key field value [field value ...]，与 HSET 相同但回复 OK。
 *
 * @author hnfy258
 * @since 1.0
 */
public class Hmset extends AbstractCommand {

    public Hmset(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.HMSET;
    }

    @Override
    protected void parseArgs() {
        if (argCount() % 2 != 0) {
            throw CommandException.wrongArgCount(commandName());
        }
    }

    @Override
    public Resp handle() {
        final KvBytes key = arg(1);
        KvHash hash = keyspace().get(key, KvHash.class);
        if (hash == null) {
            hash = new KvHash();
            keyspace().set(key, hash);
        }
        for (int i = 2; i < argCount(); i += 2) {
            hash.put(arg(i), arg(i + 1));
        }
        markChanged();
        return SimpleString.OK;
    }
}
