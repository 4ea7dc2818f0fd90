package site.kvmini.command.impl.server;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

public class Bgrewriteaof extends AbstractCommand {

    private static final SimpleString STARTED = new SimpleString("Background append only file rewriting started");

    public Bgrewriteaof(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.BGREWRITEAOF;
    }

    @Override
    public Resp handle() {
        if (!context.getPersistence().isAofEnabled()) {
            throw new CommandException("ERR Append only file is disabled");
        }
        if (!context.getPersistence().bgRewriteAof()) {
            throw new CommandException("ERR Background append only file rewriting already in progress");
        }
        return STARTED;
    }
}
