package site.kvmini.command;

import lombok.Getter;
import site.kvmini.command.impl.connection.Echo;
import site.kvmini.command.impl.connection.Ping;
import site.kvmini.command.impl.connection.Quit;
import site.kvmini.command.impl.hash.Hdel;
import site.kvmini.command.impl.hash.Hexists;
import site.kvmini.command.impl.hash.Hget;
import site.kvmini.command.impl.hash.Hgetall;
import site.kvmini.command.impl.hash.Hkeys;
import site.kvmini.command.impl.hash.Hlen;
import site.kvmini.command.impl.hash.Hmget;
import site.kvmini.command.impl.hash.Hmset;
import site.kvmini.command.impl.hash.Hset;
import site.kvmini.command.impl.hash.Hsetnx;
import site.kvmini.command.impl.hash.Hvals;
import site.kvmini.command.impl.key.Del;
import site.kvmini.command.impl.key.Exists;
import site.kvmini.command.impl.key.Expire;
import site.kvmini.command.impl.key.Persist;
import site.kvmini.command.impl.key.Pexpireat;
import site.kvmini.command.impl.key.Ttl;
import site.kvmini.command.impl.key.Type;
import site.kvmini.command.impl.list.Lindex;
import site.kvmini.command.impl.list.Llen;
import site.kvmini.command.impl.list.Lpop;
import site.kvmini.command.impl.list.Lpush;
import site.kvmini.command.impl.list.Lrange;
import site.kvmini.command.impl.list.Lrem;
import site.kvmini.command.impl.list.Lset;
import site.kvmini.command.impl.list.Ltrim;
import site.kvmini.command.impl.list.Rpop;
import site.kvmini.command.impl.list.Rpush;
import site.kvmini.command.impl.pubsub.Psubscribe;
import site.kvmini.command.impl.pubsub.Publish;
import site.kvmini.command.impl.pubsub.Punsubscribe;
import site.kvmini.command.impl.pubsub.Subscribe;
import site.kvmini.command.impl.pubsub.Unsubscribe;
import site.kvmini.command.impl.server.Bgrewriteaof;
import site.kvmini.command.impl.server.Bgsave;
import site.kvmini.command.impl.server.Dbsize;
import site.kvmini.command.impl.server.Save;
import site.kvmini.command.impl.string.Append;
import site.kvmini.command.impl.string.Get;
import site.kvmini.command.impl.string.Incr;
import site.kvmini.command.impl.string.Mget;
import site.kvmini.command.impl.string.Mset;
import site.kvmini.command.impl.string.Msetnx;
import site.kvmini.command.impl.string.Set;
import site.kvmini.command.impl.string.Strlen;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static site.kvmini.command.CommandFlags.NO_KEYSPACE;
import static site.kvmini.command.CommandFlags.SUBSCRIBE_CONTEXT;
import static site.kvmini.command.CommandFlags.WRITE;

/**
 * 命令表：命令名、参数个数范围和属性。
 *
 * <p>参数个数包含命令名本身，{@code maxArgs} 为 -1 表示不限。分发器在创建命令之前检查个数，
 * 不合法的请求不会进入命令实现。
 *
 * @author hnfy258
 * @since 1.0
 */
@Getter
public enum CommandType {

    // ========== 连接 ==========
    PING("PING", 1, 2, SUBSCRIBE_CONTEXT | NO_KEYSPACE),
    ECHO("ECHO", 2, 2, NO_KEYSPACE),
    QUIT("QUIT", 1, -1, SUBSCRIBE_CONTEXT | NO_KEYSPACE),

    // ========== 字符串 ==========
    SET("SET", 3, -1, WRITE),
    GET("GET", 2, 2, 0),
    INCR("INCR", 2, 2, WRITE),
    INCRBY("INCRBY", 3, 3, WRITE),
    DECR("DECR", 2, 2, WRITE),
    DECRBY("DECRBY", 3, 3, WRITE),
    APPEND("APPEND", 3, 3, WRITE),
    STRLEN("STRLEN", 2, 2, 0),
    MGET("MGET", 2, -1, 0),
    MSET("MSET", 3, -1, WRITE),
    MSETNX("MSETNX", 3, -1, WRITE),

    // ========== 键 ==========
    DEL("DEL", 2, -1, WRITE),
    EXISTS("EXISTS", 2, -1, 0),
    EXPIRE("EXPIRE", 3, 3, WRITE),
    PEXPIREAT("PEXPIREAT", 3, 3, WRITE),
    TTL("TTL", 2, 2, 0),
    PTTL("PTTL", 2, 2, 0),
    PERSIST("PERSIST", 2, 2, WRITE),
    TYPE("TYPE", 2, 2, 0),
    DBSIZE("DBSIZE", 1, 1, 0),

    // ========== 列表 ==========
    LPUSH("LPUSH", 3, -1, WRITE),
    RPUSH("RPUSH", 3, -1, WRITE),
    LPOP("LPOP", 2, 2, WRITE),
    RPOP("RPOP", 2, 2, WRITE),
    LLEN("LLEN", 2, 2, 0),
    LRANGE("LRANGE", 4, 4, 0),
    LINDEX("LINDEX", 3, 3, 0),
    LREM("LREM", 4, 4, WRITE),
    LSET("LSET", 4, 4, WRITE),
    LTRIM("LTRIM", 4, 4, WRITE),

    // ========== 哈希 ==========
    HSET("HSET", 4, -1, WRITE),
    HGET("HGET", 3, 3, 0),
    HDEL("HDEL", 3, -1, WRITE),
    HEXISTS("HEXISTS", 3, 3, 0),
    HLEN("HLEN", 2, 2, 0),
    HGETALL("HGETALL", 2, 2, 0),
    HKEYS("HKEYS", 2, 2, 0),
    HVALS("HVALS", 2, 2, 0),
    HMGET("HMGET", 3, -1, 0),
    HMSET("HMSET", 4, -1, WRITE),
    HSETNX("HSETNX", 4, 4, WRITE),

    // ========== 发布订阅 ==========
    SUBSCRIBE("SUBSCRIBE", 2, -1, SUBSCRIBE_CONTEXT | NO_KEYSPACE),
    UNSUBSCRIBE("UNSUBSCRIBE", 1, -1, SUBSCRIBE_CONTEXT | NO_KEYSPACE),
    PSUBSCRIBE("PSUBSCRIBE", 2, -1, SUBSCRIBE_CONTEXT | NO_KEYSPACE),
    PUNSUBSCRIBE("PUNSUBSCRIBE", 1, -1, SUBSCRIBE_CONTEXT | NO_KEYSPACE),
    PUBLISH("PUBLISH", 3, 3, NO_KEYSPACE),

    // ========== 持久化 ==========
    SAVE("SAVE", 1, 1, 0),
    BGSAVE("BGSAVE", 1, 1, 0),
    BGREWRITEAOF("BGREWRITEAOF", 1, 1, 0);

    private static final Map<String, CommandType> BY_NAME = new HashMap<>();

    static {
        for (CommandType type : values()) {
            BY_NAME.put(type.name, type);
        }
    }

    private final String name;

    private final String lowerName;

    private final int minArgs;

    private final int maxArgs;

    private final int flags;

    CommandType(String name, int minArgs, int maxArgs, int flags) {
        this.name = name;
        this.lowerName = name.toLowerCase(Locale.ROOT);
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.flags = flags;
    }

    /**
     * 按命令名查找，不区分大小写。
     *
     * @return 命令类型，不存在时返回 null
     */
    public static CommandType findByBytes(KvBytes name) {
        return BY_NAME.get(name.toUpperCaseString());
    }

    public boolean isWrite() {
        return (flags & WRITE) != 0;
    }

    public boolean isAllowedWhenSubscribed() {
        return (flags & SUBSCRIBE_CONTEXT) != 0;
    }

    public boolean isKeyspaceAccess() {
        return (flags & NO_KEYSPACE) == 0;
    }

    /**
     * @param argc 包含命令名的参数个数
     */
    public boolean acceptsArgCount(int argc) {
        return argc >= minArgs && (maxArgs < 0 || argc <= maxArgs);
    }

    public Command createCommand(ServerContext context, ClientSession session) {
        switch (this) {
            case PING:
                return new Ping(context, session);
            case ECHO:
                return new Echo(context, session);
            case QUIT:
                return new Quit(context, session);
            case SET:
                return new Set(context, session);
            case GET:
                return new Get(context, session);
            case INCR:
            case INCRBY:
            case DECR:
            case DECRBY:
                return new Incr(context, session, this);
            case APPEND:
                return new Append(context, session);
            case STRLEN:
                return new Strlen(context, session);
            case MGET:
                return new Mget(context, session);
            case MSET:
                return new Mset(context, session);
            case MSETNX:
                return new Msetnx(context, session);
            case DEL:
                return new Del(context, session);
            case EXISTS:
                return new Exists(context, session);
            case EXPIRE:
                return new Expire(context, session);
            case PEXPIREAT:
                return new Pexpireat(context, session);
            case TTL:
            case PTTL:
                return new Ttl(context, session, this);
            case PERSIST:
                return new Persist(context, session);
            case TYPE:
                return new Type(context, session);
            case DBSIZE:
                return new Dbsize(context, session);
            case LPUSH:
                return new Lpush(context, session);
            case RPUSH:
                return new Rpush(context, session);
            case LPOP:
                return new Lpop(context, session);
            case RPOP:
                return new Rpop(context, session);
            case LLEN:
                return new Llen(context, session);
            case LRANGE:
                return new Lrange(context, session);
            case LINDEX:
                return new Lindex(context, session);
            case LREM:
                return new Lrem(context, session);
            case LSET:
                return new Lset(context, session);
            case LTRIM:
                return new Ltrim(context, session);
            case HSET:
                return new Hset(context, session);
            case HGET:
                return new Hget(context, session);
            case HDEL:
                return new Hdel(context, session);
            case HEXISTS:
                return new Hexists(context, session);
            case HLEN:
                return new Hlen(context, session);
            case HGETALL:
                return new Hgetall(context, session);
            case HKEYS:
                return new Hkeys(context, session);
            case HVALS:
                return new Hvals(context, session);
            case HMGET:
                return new Hmget(context, session);
            case HMSET:
                return new Hmset(context, session);
            case HSETNX:
                return new Hsetnx(context, session);
            case SUBSCRIBE:
                return new Subscribe(context, session);
            case UNSUBSCRIBE:
                return new Unsubscribe(context, session);
            case PSUBSCRIBE:
                return new Psubscribe(context, session);
            case PUNSUBSCRIBE:
                return new Punsubscribe(context, session);
            case PUBLISH:
                return new Publish(context, session);
            case SAVE:
                return new Save(context, session);
            case BGSAVE:
                return new Bgsave(context, session);
            case BGREWRITEAOF:
                return new Bgrewriteaof(context, session);
            default:
                throw new IllegalStateException("未实现的命令: " + name);
        }
    }
}
