package site.kvmini.command.impl.hash;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvHash;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * HSET key field value [field value ...]，返回新增的字段数，覆盖已有字段不计入。
 *
 * @author hnfy258
 * @since 1.0
 */
public class Hset extends AbstractCommand {

    public Hset(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.HSET;
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
        int added = 0;
        for (int i = 2; i < argCount(); i += 2) {
            if (hash.put(arg(i), arg(i + 1))) {
                added++;
            }
        }
        markChanged();
        return RespInteger.valueOf(added);
    }
}
