package site.kvmini.command.impl.server;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * BGSAVE：在锁内捕获快照后由后台线程写文件。
 */
public class Bgsave extends AbstractCommand {

    private static final SimpleString STARTED = new SimpleString("Background saving started");

    public Bgsave(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.BGSAVE;
    }

    @Override
    public Resp handle() {
        if (!context.getPersistence().isRdbEnabled()) {
            throw new CommandException("ERR RDB snapshots are disabled");
        }
        if (!context.getPersistence().bgSave()) {
            throw new CommandException("ERR Background save already in progress");
        }
        return STARTED;
    }
}
