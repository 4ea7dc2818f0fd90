package site.kvmini.command.impl.connection;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * PING [message]。订阅状态下按推送格式回复 {@code ["pong", message]}。
 */
public class Ping extends AbstractCommand {

    private static final BulkString PONG = BulkString.fromString("pong");

    private static final BulkString EMPTY = BulkString.fromString("");

    public Ping(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public Resp handle() {
        if (session != null && session.isSubscribed()) {
            return new RespArray(new Resp[]{PONG, argCount() > 1 ? BulkString.create(arg(1)) : EMPTY});
        }
        if (argCount() > 1) {
            return BulkString.create(arg(1));
        }
        return SimpleString.PONG;
    }
}
