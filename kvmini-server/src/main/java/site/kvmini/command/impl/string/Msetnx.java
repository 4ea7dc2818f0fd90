package site.kvmini.command.impl.string;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.datastructure.KvString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespInteger;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * MSETNX key value [key value ...]，任何一个键已存在时一个都不写。
 *
 * @author hnfy258
 * @since 1.0
 */
public class Msetnx extends AbstractCommand {

    public Msetnx(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.MSETNX;
    }

    @Override
    protected void parseArgs() {
        if ((argCount() - 1) % 2 != 0) {
            throw CommandException.wrongArgCount(commandName());
        }
    }

    @Override
    public Resp handle() {
        for (int i = 1; i < argCount(); i += 2) {
            if (keyspace().exists(arg(i))) {
                return RespInteger.ZERO;
            }
        }
        for (int i = 1; i < argCount(); i += 2) {
            keyspace().set(arg(i), new KvString(arg(i + 1)));
        }
        markChanged();
        return RespInteger.ONE;
    }
}
