package site.kvmini.pubsub;

import lombok.extern.slf4j.Slf4j;
import site.kvmini.common.GlobMatcher;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;

import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 发布订阅中心，维护频道和模式到订阅者的映射。
 *
 * <p>发布时对当时的订阅者集合做快照，逐个放进订阅者自己的有界队列，发布者从不等待订阅者。
 * 队列已满的订阅者会被断开，连接已关闭的订阅者直接移除，两者都不计入接收数。
 *
 * <p>线程安全：映射使用并发容器，订阅、退订和发布可以在不同线程同时进行。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class PubSubBroker {

    private static final BulkString MESSAGE = BulkString.fromString("message");

    private static final BulkString PMESSAGE = BulkString.fromString("pmessage");

    private final Map<KvBytes, Set<Subscriber>> channels = new ConcurrentHashMap<>();

    private final Map<KvBytes, Set<Subscriber>> patterns = new ConcurrentHashMap<>();

    /**
     * @return 新增订阅返回 true，已经订阅过返回 false
     */
    public boolean subscribe(Subscriber subscriber, KvBytes channel) {
        return add(channels, channel, subscriber);
    }

    /**
     * @return 订阅存在并被移除时返回 true
     */
    public boolean unsubscribe(Subscriber subscriber, KvBytes channel) {
        return remove(channels, channel, subscriber);
    }

    public boolean psubscribe(Subscriber subscriber, KvBytes pattern) {
        return add(patterns, pattern, subscriber);
    }

    public boolean punsubscribe(Subscriber subscriber, KvBytes pattern) {
        return remove(patterns, pattern, subscriber);
    }

    /**
     * 移除订阅者的所有订阅，连接关闭时调用。
     */
    public void removeAll(Subscriber subscriber, Iterable<KvBytes> subscribedChannels,
                          Iterable<KvBytes> subscribedPatterns) {
        for (KvBytes channel : subscribedChannels) {
            remove(channels, channel, subscriber);
        }
        for (KvBytes pattern : subscribedPatterns) {
            remove(patterns, pattern, subscriber);
        }
    }

    private static boolean add(Map<KvBytes, Set<Subscriber>> map, KvBytes name, Subscriber subscriber) {
        final boolean[] added = {false};
        map.compute(name, (k, set) -> {
            final Set<Subscriber> target = set == null ? ConcurrentHashMap.newKeySet() : set;
            added[0] = target.add(subscriber);
            return target;
        });
        return added[0];
    }

    private static boolean remove(Map<KvBytes, Set<Subscriber>> map, KvBytes name, Subscriber subscriber) {
        final boolean[] removed = {false};
        map.computeIfPresent(name, (k, set) -> {
            removed[0] = set.remove(subscriber);
            return set.isEmpty() ? null : set;
        });
        return removed[0];
    }

    /**
     * 发布消息。
     *
     * @return 成功放进队列的接收者数量（频道订阅和模式订阅分别计数）
     */
    public int publish(KvBytes channel, KvBytes payload) {
        final BulkString channelBulk = BulkString.create(channel);
        final BulkString payloadBulk = BulkString.create(payload);
        int receivers = 0;

        final Set<Subscriber> direct = channels.get(channel);
        if (direct != null) {
            final RespArray message = new RespArray(new Resp[]{MESSAGE, channelBulk, payloadBulk});
            for (Subscriber subscriber : new ArrayList<>(direct)) {
                if (deliver(channels, channel, subscriber, message)) {
                    receivers++;
                }
            }
        }

        for (Map.Entry<KvBytes, Set<Subscriber>> entry : patterns.entrySet()) {
            if (!GlobMatcher.matches(entry.getKey().getBytesUnsafe(), channel.getBytesUnsafe())) {
                continue;
            }
            final RespArray message = new RespArray(new Resp[]{
                    PMESSAGE, BulkString.create(entry.getKey()), channelBulk, payloadBulk});
            for (Subscriber subscriber : new ArrayList<>(entry.getValue())) {
                if (deliver(patterns, entry.getKey(), subscriber, message)) {
                    receivers++;
                }
            }
        }
        return receivers;
    }

    /**
     * @return 消息进入了订阅者的发送队列
     */
    private boolean deliver(Map<KvBytes, Set<Subscriber>> map, KvBytes name, Subscriber subscriber,
                            RespArray message) {
        switch (subscriber.offer(message)) {
            case QUEUED:
                return true;
            case FULL:
                log.warn("订阅者 {} 的消息队列已满，断开连接", subscriber.getId());
                remove(map, name, subscriber);
                subscriber.disconnectSlow();
                return false;
            case CLOSED:
            default:
                // 连接关闭的清理可能还没执行到
                log.debug("订阅者 {} 的连接已关闭，移除订阅 {}", subscriber.getId(), name);
                remove(map, name, subscriber);
                return false;
        }
    }

    public int channelCount() {
        return channels.size();
    }

    public int patternCount() {
        return patterns.size();
    }

    /**
     * @return 频道当前的订阅者数量
     */
    public int subscriberCount(KvBytes channel) {
        final Set<Subscriber> set = channels.get(channel);
        return set == null ? 0 : set.size();
    }
}
