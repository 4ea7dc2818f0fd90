package site.kvmini.command.impl.connection;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * QUIT：回复 OK 后关闭连接。
 */
public class Quit extends AbstractCommand {

    public Quit(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.QUIT;
    }

    @Override
    public Resp handle() {
        if (session == null) {
            return SimpleString.OK;
        }
        session.reply(SimpleString.OK);
        session.closeAfterReplies();
        return null;
    }
}
