package site.kvmini.server.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.timeout.IdleStateEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import site.kvmini.database.Keyspace;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.persistence.PersistenceManager;
import site.kvmini.persistence.PersistenceOptions;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.handler.RespDecoder;
import site.kvmini.protocol.handler.RespEncoder;
import site.kvmini.pubsub.PubSubBroker;
import site.kvmini.server.command.executor.CommandDispatcher;
import site.kvmini.server.context.ServerContext;
import site.kvmini.server.session.ClientSession;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("命令处理器测试")
class RespCommandHandlerTest {

    private static final int PUSH_CAPACITY = 2;

    private PubSubBroker broker;

    private PersistenceManager persistence;

    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        final Keyspace keyspace = new Keyspace();
        broker = new PubSubBroker();
        persistence = new PersistenceManager(keyspace, PersistenceOptions.builder()
                .aofEnabled(false)
                .rdbEnabled(false)
                .build());
        dispatcher = new CommandDispatcher(new ServerContext(keyspace, broker, persistence));
    }

    @AfterEach
    void tearDown() throws IOException {
        persistence.shutdown(1000);
    }

    private EmbeddedChannel newClient() {
        return new EmbeddedChannel(
                RespDecoder.forRequests(Resp.DEFAULT_MAX_BULK_LEN),
                new RespEncoder(),
                new RespCommandHandler(dispatcher, broker, PUSH_CAPACITY));
    }

    private static void send(EmbeddedChannel channel, String raw) {
        channel.writeInbound(Unpooled.copiedBuffer(raw, StandardCharsets.UTF_8));
        channel.runPendingTasks();
    }

    private static String output(EmbeddedChannel channel) {
        channel.runPendingTasks();
        final StringBuilder sb = new StringBuilder();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            sb.append(buf.toString(StandardCharsets.UTF_8));
            buf.release();
        }
        return sb.toString();
    }

    @Test
    @DisplayName("流水线请求按顺序回复")
    void testPipelining() {
        final EmbeddedChannel client = newClient();
        send(client, "*3\r\n$3\r\nSET\r\n$1\r\na\r\n$1\r\n1\r\n"
                + "*2\r\n$3\r\nGET\r\n$1\r\na\r\n"
                + "*1\r\n$4\r\nPING\r\n");
        assertEquals("+OK\r\n$1\r\n1\r\n+PONG\r\n", output(client));
        client.finishAndReleaseAll();
    }

    @Test
    @DisplayName("请求分多次到达时等待完整后执行")
    void testPartialRequest() {
        final EmbeddedChannel client = newClient();
        send(client, "*2\r\n$4\r\nECHO\r\n$5\r\nhel");
        assertEquals("", output(client));
        send(client, "lo\r\n");
        assertEquals("$5\r\nhello\r\n", output(client));
        client.finishAndReleaseAll();
    }

    @Test
    @DisplayName("inline 命令")
    void testInlineCommand() {
        final EmbeddedChannel client = newClient();
        send(client, "SET greeting \"hi there\"\r\nGET greeting\r\n");
        assertEquals("+OK\r\n$8\r\nhi there\r\n", output(client));
        client.finishAndReleaseAll();
    }

    @Test
    @DisplayName("协议错误先执行已解析的请求，再回复错误并关闭连接")
    void testProtocolError() {
        final EmbeddedChannel client = newClient();
        send(client, "*1\r\n$4\r\nPING\r\n*x\r\n*1\r\n$4\r\nPING\r\n");
        final String out = output(client);
        assertTrue(out.startsWith("+PONG\r\n-ERR Protocol error: "), out);
        assertEquals(1, out.split("PONG", -1).length - 1);
        assertFalse(client.isOpen());
    }

    @Test
    @DisplayName("QUIT 回复 OK 后关闭")
    void testQuit() {
        final EmbeddedChannel client = newClient();
        send(client, "*1\r\n$4\r\nQUIT\r\n");
        assertEquals("+OK\r\n", output(client));
        assertFalse(client.isOpen());
    }

    @Test
    @DisplayName("空闲超时关闭普通连接，订阅连接保持")
    void testIdleTimeout() {
        final EmbeddedChannel plain = newClient();
        final EmbeddedChannel subscriber = newClient();
        send(subscriber, "SUBSCRIBE news\r\n");
        output(subscriber);

        plain.pipeline().fireUserEventTriggered(IdleStateEvent.ALL_IDLE_STATE_EVENT);
        subscriber.pipeline().fireUserEventTriggered(IdleStateEvent.ALL_IDLE_STATE_EVENT);
        plain.runPendingTasks();
        subscriber.runPendingTasks();

        assertFalse(plain.isOpen());
        assertTrue(subscriber.isOpen());
        subscriber.finishAndReleaseAll();
    }

    @Test
    @DisplayName("排空后不再处理新请求并关闭连接")
    void testDrain() {
        final EmbeddedChannel client = newClient();
        final ClientSession session = client.attr(ClientSession.SESSION_KEY).get();
        assertNotNull(session);
        session.beginDrain();
        send(client, "*1\r\n$4\r\nPING\r\n");
        assertEquals("", output(client));
        assertFalse(client.isOpen());
    }

    @Nested
    @DisplayName("发布订阅")
    class PubSub {

        @Test
        @DisplayName("订阅确认计数和消息推送")
        void testSubscribeAndPublish() {
            final EmbeddedChannel subscriber = newClient();
            final EmbeddedChannel publisher = newClient();

            send(subscriber, "SUBSCRIBE news\r\n");
            assertEquals("*3\r\n$9\r\nsubscribe\r\n$4\r\nnews\r\n:1\r\n", output(subscriber));
            send(subscriber, "PSUBSCRIBE n*\r\n");
            assertEquals("*3\r\n$10\r\npsubscribe\r\n$2\r\nn*\r\n:2\r\n", output(subscriber));

            send(publisher, "PUBLISH news hello\r\n");
            assertEquals(":2\r\n", output(publisher));
            assertEquals("*3\r\n$7\r\nmessage\r\n$4\r\nnews\r\n$5\r\nhello\r\n"
                            + "*4\r\n$8\r\npmessage\r\n$2\r\nn*\r\n$4\r\nnews\r\n$5\r\nhello\r\n",
                    output(subscriber));

            send(publisher, "PUBLISH other hello\r\n");
            assertEquals(":0\r\n", output(publisher));

            subscriber.finishAndReleaseAll();
            publisher.finishAndReleaseAll();
        }

        @Test
        @DisplayName("订阅状态下只允许订阅类命令和 PING")
        void testSubscribedContext() {
            final EmbeddedChannel subscriber = newClient();
            send(subscriber, "SUBSCRIBE news\r\n");
            output(subscriber);

            send(subscriber, "GET a\r\n");
            assertTrue(output(subscriber).startsWith("-ERR Can't execute 'get'"));
            send(subscriber, "PING\r\n");
            assertEquals("*2\r\n$4\r\npong\r\n$0\r\n\r\n", output(subscriber));

            send(subscriber, "UNSUBSCRIBE\r\n");
            assertEquals("*3\r\n$11\r\nunsubscribe\r\n$4\r\nnews\r\n:0\r\n", output(subscriber));
            send(subscriber, "UNSUBSCRIBE\r\n");
            assertEquals("*3\r\n$11\r\nunsubscribe\r\n$-1\r\n:0\r\n", output(subscriber));
            send(subscriber, "PING\r\n");
            assertEquals("+PONG\r\n", output(subscriber));
            subscriber.finishAndReleaseAll();
        }

        @Test
        @DisplayName("推送积压超过上限的订阅者被断开，不影响其他订阅者")
        void testSlowSubscriber() {
            final EmbeddedChannel slow = newClient();
            final EmbeddedChannel fast = newClient();
            final EmbeddedChannel publisher = newClient();
            send(slow, "SUBSCRIBE news\r\n");
            send(fast, "SUBSCRIBE news\r\n");
            output(slow);
            output(fast);

            for (int i = 0; i < PUSH_CAPACITY; i++) {
                send(publisher, "PUBLISH news m" + i + "\r\n");
                assertEquals(":2\r\n", output(publisher));
                output(fast);
            }
            // slow 的事件循环一直没有运行，推送留在队列里
            send(publisher, "PUBLISH news overflow\r\n");
            assertEquals(":1\r\n", output(publisher));

            assertFalse(slow.isOpen());
            slow.runPendingTasks();
            assertTrue(fast.isOpen());
            assertTrue(output(fast).contains("overflow"));
            assertEquals(1, broker.subscriberCount(KvBytes.fromString("news")));

            fast.finishAndReleaseAll();
            publisher.finishAndReleaseAll();
        }

        @Test
        @DisplayName("已关闭但还没清理的订阅连接不计入 PUBLISH 的接收数")
        void testClosedSessionNotCounted() {
            final EmbeddedChannel closed = new EmbeddedChannel();
            final ClientSession session = new ClientSession(closed, closed.eventLoop(), PUSH_CAPACITY);
            broker.subscribe(session, KvBytes.fromString("news"));
            closed.close();
            final EmbeddedChannel publisher = newClient();

            send(publisher, "PUBLISH news hello\r\n");

            assertEquals(":0\r\n", output(publisher));
            assertEquals(0, session.getPendingPushes());
            assertEquals(0, broker.subscriberCount(KvBytes.fromString("news")));
            publisher.finishAndReleaseAll();
        }

        @Test
        @DisplayName("连接关闭时移除全部订阅")
        void testCleanupOnClose() {
            final EmbeddedChannel subscriber = newClient();
            send(subscriber, "SUBSCRIBE a b\r\n");
            send(subscriber, "PSUBSCRIBE c*\r\n");
            output(subscriber);
            assertEquals(2, broker.channelCount());
            assertEquals(1, broker.patternCount());

            subscriber.close();
            assertEquals(0, broker.channelCount());
            assertEquals(0, broker.patternCount());
        }
    }
}
