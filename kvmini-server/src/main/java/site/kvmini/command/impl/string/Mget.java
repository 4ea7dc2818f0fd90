package site.kvmini.command.impl.string;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvData;
import site.kvmini.datastructure.KvString;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * MGET key [key ...]，不存在或不是字符串的键返回空值。
 */
public class Mget extends AbstractCommand {

    public Mget(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.MGET;
    }

    @Override
    public Resp handle() {
        final Resp[] values = new Resp[argCount() - 1];
        for (int i = 1; i < argCount(); i++) {
            final KvData data = keyspace().get(arg(i));
            values[i - 1] = data instanceof KvString
                    ? BulkString.create(((KvString) data).getValue())
                    : BulkString.NULL;
        }
        return new RespArray(values);
    }
}
