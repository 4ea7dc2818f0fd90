package site.kvmini.server.command.executor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import site.kvmini.database.Keyspace;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.persistence.PersistenceManager;
import site.kvmini.persistence.PersistenceOptions;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Errors;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.protocol.RespInteger;
import site.kvmini.protocol.SimpleString;
import site.kvmini.pubsub.PubSubBroker;
import site.kvmini.server.context.ServerContext;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("命令分发测试")
class CommandDispatcherTest {

    private final AtomicLong clock = new AtomicLong(1_000_000L);

    private Keyspace keyspace;

    private PersistenceManager persistence;

    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        keyspace = new Keyspace(clock::get);
        persistence = new PersistenceManager(keyspace, PersistenceOptions.builder()
                .aofEnabled(false)
                .rdbEnabled(false)
                .build());
        dispatcher = new CommandDispatcher(new ServerContext(keyspace, new PubSubBroker(), persistence));
    }

    @AfterEach
    void tearDown() throws IOException {
        persistence.shutdown(1000);
    }

    private Resp run(String... parts) {
        return dispatcher.dispatch(RespArray.command(parts), null);
    }

    private static BulkString bulk(String value) {
        return BulkString.fromString(value);
    }

    private static RespArray array(String... values) {
        final Resp[] content = new Resp[values.length];
        for (int i = 0; i < values.length; i++) {
            content[i] = bulk(values[i]);
        }
        return new RespArray(content);
    }

    private static void assertError(Resp reply, String prefix) {
        assertInstanceOf(Errors.class, reply);
        final String content = ((Errors) reply).getContent();
        assertTrue(content.startsWith(prefix), "错误回复: " + content);
    }

    @Nested
    @DisplayName("字符串")
    class StringCommands {

        @Test
        @DisplayName("SET/GET/DEL 基本流程")
        void testSetGetDel() {
            assertEquals(SimpleString.OK, run("SET", "k", "v"));
            assertEquals(bulk("v"), run("GET", "k"));
            assertEquals(RespInteger.ONE, run("DEL", "k"));
            assertEquals(BulkString.NULL, run("GET", "k"));
            assertEquals(RespInteger.ZERO, run("DEL", "k"));
        }

        @Test
        @DisplayName("SET NX/XX 条件写入")
        void testSetConditions() {
            assertEquals(BulkString.NULL, run("SET", "k", "v", "XX"));
            assertEquals(SimpleString.OK, run("SET", "k", "v", "NX"));
            assertEquals(BulkString.NULL, run("SET", "k", "other", "NX"));
            assertEquals(SimpleString.OK, run("SET", "k", "new", "XX"));
            assertEquals(bulk("new"), run("GET", "k"));
            assertError(run("SET", "k", "v", "NX", "XX"), "ERR syntax error");
        }

        @Test
        @DisplayName("SET 非法过期时间")
        void testSetInvalidExpire() {
            assertError(run("SET", "k", "v", "EX", "0"), "ERR invalid expire time in 'set' command");
            assertError(run("SET", "k", "v", "PX", "abc"), "ERR value is not an integer");
            assertError(run("SET", "k", "v", "EX"), "ERR syntax error");
            assertEquals(0, keyspace.size());
        }

        @Test
        @DisplayName("INCR 系列保留过期时间并检查溢出")
        void testIncr() {
            assertEquals(RespInteger.valueOf(1), run("INCR", "n"));
            assertEquals(RespInteger.valueOf(11), run("INCRBY", "n", "10"));
            assertEquals(RespInteger.valueOf(10), run("DECR", "n"));
            assertEquals(RespInteger.valueOf(5), run("DECRBY", "n", "5"));

            run("EXPIRE", "n", "100");
            run("INCR", "n");
            assertTrue(keyspace.ttlMillis(KvBytes.fromString("n")) > 0);

            run("SET", "big", Long.toString(Long.MAX_VALUE));
            assertError(run("INCR", "big"), "ERR increment or decrement would overflow");
            run("SET", "text", "abc");
            assertError(run("INCR", "text"), "ERR value is not an integer or out of range");
        }

        @Test
        @DisplayName("APPEND/STRLEN/MSET/MGET")
        void testMultiKeys() {
            assertEquals(RespInteger.valueOf(5), run("APPEND", "s", "hello"));
            assertEquals(RespInteger.valueOf(11), run("APPEND", "s", " world"));
            assertEquals(RespInteger.valueOf(11), run("STRLEN", "s"));
            assertEquals(SimpleString.OK, run("MSET", "a", "1", "b", "2"));
            run("RPUSH", "list", "x");
            assertEquals(new RespArray(new Resp[]{bulk("1"), bulk("2"), BulkString.NULL, BulkString.NULL}),
                    run("MGET", "a", "b", "missing", "list"));
            assertError(run("MSET", "a", "1", "b"), "ERR wrong number of arguments for 'mset' command");
        }

        @Test
        @DisplayName("MSETNX 有任何一个键存在时都不写入")
        void testMsetnx() {
            assertEquals(RespInteger.ONE, run("MSETNX", "a", "1", "b", "2"));
            assertEquals(RespInteger.ZERO, run("MSETNX", "c", "3", "a", "x"));
            assertEquals(RespInteger.ZERO, run("EXISTS", "c"));
            assertEquals(bulk("1"), run("GET", "a"));
            run("RPUSH", "list", "x");
            assertEquals(RespInteger.ZERO, run("MSETNX", "list", "v"));
            assertError(run("MSETNX", "a", "1", "b"), "ERR wrong number of arguments for 'msetnx' command");
        }
    }

    @Nested
    @DisplayName("过期")
    class Expiry {

        @Test
        @DisplayName("SET EX 到期后读不到")
        void testSetWithExpire() {
            run("SET", "k", "v", "EX", "10");
            assertEquals(RespInteger.valueOf(10), run("TTL", "k"));
            clock.addAndGet(9_999);
            assertEquals(bulk("v"), run("GET", "k"));
            clock.addAndGet(1);
            assertEquals(BulkString.NULL, run("GET", "k"));
            assertEquals(RespInteger.valueOf(-2), run("TTL", "k"));
        }

        @Test
        @DisplayName("TTL/PTTL/PERSIST")
        void testTtl() {
            run("SET", "k", "v");
            assertEquals(RespInteger.valueOf(-1), run("TTL", "k"));
            assertEquals(RespInteger.ONE, run("EXPIRE", "k", "5"));
            clock.addAndGet(1_400);
            assertEquals(RespInteger.valueOf(3_600), run("PTTL", "k"));
            assertEquals(RespInteger.valueOf(4), run("TTL", "k"));
            assertEquals(RespInteger.ONE, run("PERSIST", "k"));
            assertEquals(RespInteger.ZERO, run("PERSIST", "k"));
            assertEquals(RespInteger.valueOf(-1), run("TTL", "k"));
            assertEquals(RespInteger.ZERO, run("EXPIRE", "missing", "5"));
        }

        @Test
        @DisplayName("PEXPIREAT 使用绝对时间")
        void testPexpireat() {
            run("SET", "k", "v");
            assertEquals(RespInteger.ONE, run("PEXPIREAT", "k", Long.toString(clock.get() + 500)));
            clock.addAndGet(500);
            assertEquals(RespInteger.ZERO, run("EXISTS", "k"));
        }

        @Test
        @DisplayName("SET 覆盖会清除过期时间")
        void testSetClearsTtl() {
            run("SET", "k", "v", "PX", "100");
            run("SET", "k", "v2");
            clock.addAndGet(1_000);
            assertEquals(bulk("v2"), run("GET", "k"));
        }
    }

    @Nested
    @DisplayName("列表和哈希")
    class Collections {

        @Test
        @DisplayName("LPUSH 顺序与参数相反，弹空后删除键")
        void testListCommands() {
            assertEquals(RespInteger.valueOf(3), run("LPUSH", "l", "a", "b", "c"));
            assertEquals(array("c", "b", "a"), run("LRANGE", "l", "0", "-1"));
            assertEquals(RespInteger.valueOf(4), run("RPUSH", "l", "d"));
            assertEquals(bulk("d"), run("LINDEX", "l", "-1"));
            assertEquals(BulkString.NULL, run("LINDEX", "l", "10"));
            assertEquals(bulk("c"), run("LPOP", "l"));
            assertEquals(bulk("d"), run("RPOP", "l"));
            run("LPOP", "l");
            run("LPOP", "l");
            assertEquals(RespInteger.ZERO, run("EXISTS", "l"));
            assertEquals(BulkString.NULL, run("LPOP", "l"));
            assertEquals(RespArray.EMPTY, run("LRANGE", "l", "0", "-1"));
        }

        @Test
        @DisplayName("LREM LSET LTRIM 修改列表，删空后删除键")
        void testListEditing() {
            run("RPUSH", "l", "x", "a", "x", "b", "x");
            assertEquals(RespInteger.ONE, run("LREM", "l", "-1", "x"));
            assertEquals(RespInteger.valueOf(2), run("LREM", "l", "0", "x"));
            assertEquals(array("a", "b"), run("LRANGE", "l", "0", "-1"));
            assertEquals(RespInteger.ZERO, run("LREM", "missing", "0", "x"));

            assertEquals(SimpleString.OK, run("LSET", "l", "-1", "B"));
            assertEquals(array("a", "B"), run("LRANGE", "l", "0", "-1"));
            assertError(run("LSET", "l", "5", "z"), "ERR index out of range");
            assertError(run("LSET", "missing", "0", "z"), "ERR no such key");
            assertError(run("LSET", "l", "one", "z"), "ERR value is not an integer");

            run("RPUSH", "l", "c", "d");
            assertEquals(SimpleString.OK, run("LTRIM", "l", "1", "-2"));
            assertEquals(array("B", "c"), run("LRANGE", "l", "0", "-1"));
            assertEquals(SimpleString.OK, run("LTRIM", "l", "5", "10"));
            assertEquals(RespInteger.ZERO, run("EXISTS", "l"));
            assertEquals(SimpleString.OK, run("LTRIM", "missing", "0", "1"));

            run("RPUSH", "single", "only");
            assertEquals(RespInteger.ONE, run("LREM", "single", "1", "only"));
            assertEquals(RespInteger.ZERO, run("EXISTS", "single"));
        }

        @Test
        @DisplayName("HMSET HSETNX HMGET HKEYS HVALS")
        void testHashMultiField() {
            assertEquals(SimpleString.OK, run("HMSET", "h", "f1", "v1", "f2", "v2"));
            assertEquals(RespInteger.ZERO, run("HSETNX", "h", "f1", "other"));
            assertEquals(RespInteger.ONE, run("HSETNX", "h", "f3", "v3"));
            assertEquals(RespInteger.ONE, run("HSETNX", "fresh", "f", "v"));

            assertEquals(new RespArray(new Resp[]{bulk("v1"), BulkString.NULL, bulk("v3")}),
                    run("HMGET", "h", "f1", "nope", "f3"));
            assertEquals(new RespArray(new Resp[]{BulkString.NULL}), run("HMGET", "missing", "f"));
            assertEquals(array("f1", "f2", "f3"), run("HKEYS", "h"));
            assertEquals(array("v1", "v2", "v3"), run("HVALS", "h"));
            assertEquals(RespArray.EMPTY, run("HKEYS", "missing"));
            assertEquals(RespArray.EMPTY, run("HVALS", "missing"));

            assertError(run("HMSET", "h", "f1"), "ERR wrong number of arguments for 'hmset' command");
            run("SET", "s", "v");
            assertError(run("HKEYS", "s"), "WRONGTYPE");
            assertError(run("HSETNX", "s", "f", "v"), "WRONGTYPE");
        }

        @Test
        @DisplayName("HSET 只统计新增字段，HDEL 删除最后一个字段时删除键")
        void testHashCommands() {
            assertEquals(RespInteger.valueOf(2), run("HSET", "h", "f1", "v1", "f2", "v2"));
            assertEquals(RespInteger.ZERO, run("HSET", "h", "f1", "new"));
            assertEquals(bulk("new"), run("HGET", "h", "f1"));
            assertEquals(RespInteger.valueOf(2), run("HLEN", "h"));
            assertEquals(RespInteger.ONE, run("HEXISTS", "h", "f2"));
            assertEquals(array("f1", "new", "f2", "v2"), run("HGETALL", "h"));
            assertEquals(RespInteger.valueOf(2), run("HDEL", "h", "f1", "f2", "f3"));
            assertEquals(new SimpleString("none"), run("TYPE", "h"));
            assertError(run("HSET", "h", "f1"), "ERR wrong number of arguments for 'hset' command");
        }

        @Test
        @DisplayName("类型不符返回 WRONGTYPE 且不修改数据")
        void testTypeMismatch() {
            run("SET", "s", "v");
            assertError(run("LPUSH", "s", "x"), "WRONGTYPE");
            assertError(run("HGET", "s", "f"), "WRONGTYPE");
            run("RPUSH", "l", "x");
            assertError(run("GET", "l"), "WRONGTYPE");
            assertEquals(bulk("v"), run("GET", "s"));
            assertEquals(new SimpleString("string"), run("TYPE", "s"));
            assertEquals(new SimpleString("list"), run("TYPE", "l"));
        }
    }

    @Nested
    @DisplayName("请求检查")
    class Validation {

        @Test
        @DisplayName("未知命令列出前几个参数")
        void testUnknownCommand() {
            final Resp reply = run("FOO", "a", "b");
            assertEquals(new Errors("ERR unknown command 'FOO', with args beginning with: 'a' 'b' "), reply);
        }

        @Test
        @DisplayName("参数个数错误时不执行命令")
        void testArity() {
            assertError(run("GET"), "ERR wrong number of arguments for 'get' command");
            assertError(run("SET", "k"), "ERR wrong number of arguments for 'set' command");
            assertError(run("DBSIZE", "extra"), "ERR wrong number of arguments for 'dbsize' command");
            assertEquals(0, keyspace.size());
        }

        @Test
        @DisplayName("命令名不区分大小写")
        void testCaseInsensitive() {
            assertEquals(SimpleString.OK, run("set", "k", "v"));
            assertEquals(bulk("v"), run("gEt", "k"));
            assertEquals(RespInteger.ONE, run("dbsize"));
        }

        @Test
        @DisplayName("PING 和 ECHO")
        void testConnectionCommands() {
            assertEquals(SimpleString.PONG, run("PING"));
            assertEquals(bulk("hi"), run("PING", "hi"));
            assertEquals(bulk("hello"), run("ECHO", "hello"));
        }

        @Test
        @DisplayName("持久化关闭时 SAVE 和 BGREWRITEAOF 返回错误")
        void testPersistenceDisabled() {
            assertError(run("SAVE"), "ERR RDB snapshots are disabled");
            assertError(run("BGSAVE"), "ERR RDB snapshots are disabled");
            assertError(run("BGREWRITEAOF"), "ERR Append only file is disabled");
        }
    }
}
