package site.kvmini.command.impl.string;

import site.kvmini.command.AbstractCommand;
import site.kvmini.command.CommandException;
import site.kvmini.command.CommandType;
import site.kvmini.database.Keyspace;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvString;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.protocol.SimpleString;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

/**
 * SET命令实现
 * 语法: SET key value [EX seconds | PX milliseconds | EXAT unix-seconds | PXAT unix-milliseconds] [NX | XX]
 *
 * <p>写入 AOF 时过期时间统一换算成 PXAT 绝对时间，条件选项在执行时已经判断过，不再记录。
 *
 * @author hnfy258
 * @since 1.0
 */
public class Set extends AbstractCommand {

    private static final BulkString SET = BulkString.fromString("SET");

    private static final BulkString PXAT = BulkString.fromString("PXAT");

    private KvBytes key;

    private KvBytes value;

    private boolean nx;

    private boolean xx;

    private String expireOption;

    private long expireValue;

    private long expireAt = Keyspace.NO_EXPIRY;

    public Set(ServerContext context, ClientSession session) {
        super(context, session);
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    protected void parseArgs() {
        key = arg(1);
        value = arg(2);
        for (int i = 3; i < argCount(); i++) {
            final String option = arg(i).toUpperCaseString();
            switch (option) {
                case "NX":
                    if (xx) {
                        throw CommandException.syntaxError();
                    }
                    nx = true;
                    break;
                case "XX":
                    if (nx) {
                        throw CommandException.syntaxError();
                    }
                    xx = true;
                    break;
                case "EX":
                case "PX":
                case "EXAT":
                case "PXAT":
                    if (expireOption != null || i + 1 >= argCount()) {
                        throw CommandException.syntaxError();
                    }
                    expireOption = option;
                    expireValue = argLong(++i);
                    if (expireValue <= 0) {
                        throw CommandException.invalidExpireTime(commandName());
                    }
                    break;
                default:
                    throw CommandException.syntaxError();
            }
        }
    }

    @Override
    public Resp handle() {
        final Keyspace keyspace = keyspace();
        final boolean exists = keyspace.exists(key);
        if ((nx && exists) || (xx && !exists)) {
            return BulkString.NULL;
        }
        expireAt = resolveExpireAt(keyspace.now());
        keyspace.set(key, new KvString(value), expireAt);
        markChanged();
        return SimpleString.OK;
    }

    private long resolveExpireAt(long now) {
        if (expireOption == null) {
            return Keyspace.NO_EXPIRY;
        }
        try {
            switch (expireOption) {
                case "EX":
                    return Math.addExact(now, Math.multiplyExact(expireValue, 1000L));
                case "PX":
                    return Math.addExact(now, expireValue);
                case "EXAT":
                    return Math.multiplyExact(expireValue, 1000L);
                default:
                    return expireValue;
            }
        } catch (ArithmeticException e) {
            throw CommandException.invalidExpireTime(commandName());
        }
    }

    @Override
    public RespArray propagate() {
        if (!isChanged()) {
            return null;
        }
        if (expireAt == Keyspace.NO_EXPIRY) {
            return new RespArray(new Resp[]{SET, BulkString.create(key), BulkString.create(value)});
        }
        return new RespArray(new Resp[]{SET, BulkString.create(key), BulkString.create(value),
                PXAT, BulkString.fromString(Long.toString(expireAt))});
    }
}
