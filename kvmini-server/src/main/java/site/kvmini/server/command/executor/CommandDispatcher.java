package site.kvmini.server.command.executor;

import lombok.extern.slf4j.Slf4j;
import site.kvmini.aof.AofWriteException;
import site.kvmini.command.Command;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.core.CommandExecutor;
import site.kvmini.database.TypeMismatchException;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.persistence.PersistenceManager;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Errors;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * 命令分发器，在线请求和 AOF 回放共用的执行入口。
 *
 * <p>处理顺序：
 * <ul>
 *   <li>查命令表，检查参数个数和订阅状态</li>
 *   <li>AOF 写入失败尚未恢复时拒绝写命令</li>
 *   <li>在键空间锁内执行命令，写命令在同一次加锁内追加到 AOF，之后才返回回复</li>
 * </ul>
 *
 * <p>回放时不检查写阻塞，也不再追加 AOF。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class CommandDispatcher implements CommandExecutor {

    private static final Errors EMPTY_COMMAND_ERROR = new Errors("ERR empty command");

    private final ServerContext context;

    public CommandDispatcher(ServerContext context) {
        if (context == null) {
            throw new IllegalArgumentException("服务端上下文不能为null");
        }
        this.context = context;
    }

    /**
     * 回放一条 AOF 记录。
     */
    @Override
    public Resp execute(RespArray command) {
        return dispatch(command, null, true);
    }

    /**
     * 执行客户端请求。
     *
     * @param session 发起请求的连接
     * @return 回复，命令已经通过会话自行回复时返回 null
     */
    public Resp dispatch(RespArray request, ClientSession session) {
        return dispatch(request, session, false);
    }

    Resp dispatch(RespArray request, ClientSession session, boolean replay) {
        final Resp[] array = request.getContent();
        if (array == null || array.length == 0) {
            return EMPTY_COMMAND_ERROR;
        }
        final KvBytes name = ((BulkString) array[0]).getContent();
        final CommandType type = CommandType.findByBytes(name);
        if (type == null) {
            return unknownCommand(name, array);
        }
        if (!type.acceptsArgCount(array.length)) {
            return CommandException.wrongArgCount(type.getLowerName()).toErrors();
        }
        if (session != null && session.isSubscribed() && !type.isAllowedWhenSubscribed()) {
            return new Errors("ERR Can't execute '" + type.getLowerName()
                    + "': only (P)SUBSCRIBE / (P)UNSUBSCRIBE / PING / QUIT are allowed in this context");
        }
        final PersistenceManager persistence = context.getPersistence();
        if (type.isWrite() && !replay && persistence.isWriteBlocked()) {
            return new Errors("MISCONF Errors writing to the AOF file: " + writeErrorMessage(persistence));
        }

        try {
            final Command command = type.createCommand(context, session);
            command.setContext(array);
            if (!type.isKeyspaceAccess()) {
                return command.handle();
            }
            final boolean[] logged = {false};
            final Resp result = context.getKeyspace().execute(() -> {
                final Resp reply = command.handle();
                if (command.isWriteCommand() && !replay) {
                    final RespArray record = command.propagate();
                    if (record != null) {
                        try {
                            persistence.append(record);
                        } catch (AofWriteException e) {
                            throw new AofFailure(e);
                        }
                        logged[0] = true;
                    }
                }
                return reply;
            });
            if (logged[0]) {
                persistence.afterWrite();
            }
            return result;
        } catch (TypeMismatchException e) {
            return new Errors(TypeMismatchException.MESSAGE);
        } catch (CommandException e) {
            return e.toErrors();
        } catch (AofFailure e) {
            log.error("写入AOF失败，命令: {}", type.getName(), e.getCause());
            return new Errors("IOERR Error writing to the AOF file: " + e.getCause().getMessage());
        } catch (RuntimeException e) {
            log.error("命令执行失败: {}", type.getName(), e);
            return new Errors("ERR " + e.getMessage());
        }
    }

    private static String writeErrorMessage(PersistenceManager persistence) {
        final Exception error = persistence.getAofManager().getWriteError();
        return error == null ? "unknown error" : error.getMessage();
    }

    private static Errors unknownCommand(KvBytes name, Resp[] array) {
        final StringBuilder message = new StringBuilder("ERR unknown command '")
                .append(name.getString())
                .append("', with args beginning with: ");
        for (int i = 1; i < array.length; i++) {
            message.append('\'').append(((BulkString) array[i]).getContent().getString()).append("' ");
        }
        return new Errors(message.toString());
    }

    /** 把 AOF 写入失败带出键空间锁 */
    private static final class AofFailure extends RuntimeException {

        AofFailure(AofWriteException cause) {
            super(cause.getMessage(), cause, false, false);
        }
    }
}
