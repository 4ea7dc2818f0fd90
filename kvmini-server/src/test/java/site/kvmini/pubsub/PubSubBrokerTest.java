package site.kvmini.pubsub;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("发布订阅测试")
class PubSubBrokerTest {

    private PubSubBroker broker;

    @BeforeEach
    void setUp() {
        broker = new PubSubBroker();
    }

    private static KvBytes bytes(String s) {
        return KvBytes.fromString(s);
    }

    private static Subscriber subscriber(long id) {
        final Subscriber subscriber = mock(Subscriber.class);
        when(subscriber.getId()).thenReturn(id);
        when(subscriber.offer(any(RespArray.class))).thenReturn(OfferResult.QUEUED);
        return subscriber;
    }

    @Test
    @DisplayName("只有订阅了该频道的订阅者收到消息")
    void testChannelIsolation() {
        final Subscriber a = subscriber(1);
        final Subscriber b = subscriber(2);
        broker.subscribe(a, bytes("news"));
        broker.subscribe(b, bytes("sports"));

        assertEquals(1, broker.publish(bytes("news"), bytes("hello")));

        final ArgumentCaptor<RespArray> captor = ArgumentCaptor.forClass(RespArray.class);
        verify(a).offer(captor.capture());
        assertEquals(new RespArray(new Resp[]{
                BulkString.fromString("message"), BulkString.fromString("news"), BulkString.fromString("hello")}),
                captor.getValue());
        verify(b, never()).offer(any(RespArray.class));
    }

    @Test
    @DisplayName("重复订阅不重复投递")
    void testDuplicateSubscribe() {
        final Subscriber a = subscriber(1);
        assertTrue(broker.subscribe(a, bytes("news")));
        assertFalse(broker.subscribe(a, bytes("news")));
        assertEquals(1, broker.publish(bytes("news"), bytes("x")));
        verify(a, times(1)).offer(any(RespArray.class));
    }

    @Test
    @DisplayName("模式订阅使用 glob 匹配")
    void testPatternSubscribe() {
        final Subscriber a = subscriber(1);
        broker.psubscribe(a, bytes("news.*"));

        assertEquals(1, broker.publish(bytes("news.tech"), bytes("x")));
        assertEquals(0, broker.publish(bytes("sports.tech"), bytes("x")));

        final ArgumentCaptor<RespArray> captor = ArgumentCaptor.forClass(RespArray.class);
        verify(a).offer(captor.capture());
        final Resp[] content = captor.getValue().getContent();
        assertEquals(4, content.length);
        assertEquals(BulkString.fromString("pmessage"), content[0]);
        assertEquals(BulkString.fromString("news.*"), content[1]);
        assertEquals(BulkString.fromString("news.tech"), content[2]);
    }

    @Test
    @DisplayName("队列已满的订阅者被断开且不计入接收数")
    void testSlowSubscriber() {
        final Subscriber slow = subscriber(1);
        final Subscriber fast = subscriber(2);
        when(slow.offer(any(RespArray.class))).thenReturn(OfferResult.FULL);
        broker.subscribe(slow, bytes("news"));
        broker.subscribe(fast, bytes("news"));

        assertEquals(1, broker.publish(bytes("news"), bytes("x")));
        verify(slow).disconnectSlow();
        verify(fast, never()).disconnectSlow();
        assertEquals(1, broker.subscriberCount(bytes("news")));
    }

    @Test
    @DisplayName("连接已关闭的订阅者不计入接收数并被移除")
    void testClosedSubscriber() {
        final Subscriber closed = subscriber(1);
        final Subscriber live = subscriber(2);
        when(closed.offer(any(RespArray.class))).thenReturn(OfferResult.CLOSED);
        broker.subscribe(closed, bytes("news"));
        broker.psubscribe(closed, bytes("n*"));
        broker.subscribe(live, bytes("news"));

        assertEquals(1, broker.publish(bytes("news"), bytes("x")));
        verify(closed, never()).disconnectSlow();
        assertEquals(1, broker.subscriberCount(bytes("news")));
        assertEquals(0, broker.patternCount());

        assertEquals(1, broker.publish(bytes("news"), bytes("y")));
        verify(closed, times(2)).offer(any(RespArray.class));
    }

    @Test
    @DisplayName("退订后移除空频道")
    void testUnsubscribe() {
        final Subscriber a = subscriber(1);
        broker.subscribe(a, bytes("news"));
        broker.psubscribe(a, bytes("n*"));
        assertTrue(broker.unsubscribe(a, bytes("news")));
        assertFalse(broker.unsubscribe(a, bytes("news")));
        assertEquals(0, broker.channelCount());

        broker.removeAll(a, Collections.<KvBytes>emptyList(), List.of(bytes("n*")));
        assertEquals(0, broker.patternCount());
        assertEquals(0, broker.publish(bytes("news"), bytes("x")));
    }
}
