package site.kvmini.command.impl.server;

import lombok.extern.slf4j.Slf4j;
import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.persistence.PersistenceManager;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

import java.io.IOException;

/**
 * SAVE：同步写快照，期间阻塞所有命令。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class Save extends AbstractCommand {

    public Save(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.SAVE;
    }

    @Override
    public Resp handle() {
        final PersistenceManager persistence = context.getPersistence();
        if (!persistence.isRdbEnabled()) {
            throw new CommandException("ERR RDB snapshots are disabled");
        }
        try {
            if (!persistence.save()) {
                throw new CommandException("ERR Background save already in progress");
            }
        } catch (IOException e) {
            log.error("SAVE失败", e);
            throw new CommandException("ERR " + e.getMessage());
        }
        return SimpleString.OK;
    }
}
