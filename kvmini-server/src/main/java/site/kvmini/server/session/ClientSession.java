package site.kvmini.server.session;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.EventExecutor;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;
import site.kvmini.pubsub.OfferResult;
import site.kvmini.pubsub.Subscriber;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 一个客户端连接的状态：发送队列、订阅集合和关闭流程。
 *
 * <p>回复和推送消息进入同一个队列，在连接的事件循环上按入队顺序写出。
 * 连接不可写时停止写出，等可写后继续。只有推送消息计入容量，
 * 已入队但还没写进套接字的推送超过容量时 {@link #offer(RespArray)} 返回 {@link OfferResult#FULL}。
 *
 * <p>订阅集合只在该连接的命令线程上访问。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class ClientSession implements Subscriber {

    public static final AttributeKey<ClientSession> SESSION_KEY = AttributeKey.valueOf("kvmini.session");

    private static final AtomicLong ID_GENERATOR = new AtomicLong();

    private final long id = ID_GENERATOR.incrementAndGet();

    private final Channel channel;

    /** 执行该连接命令的线程 */
    private final EventExecutor commandExecutor;

    /** 推送消息的队列容量，0 表示不限 */
    private final int pushCapacity;

    private final Queue<Outbound> outbound = new ConcurrentLinkedQueue<>();

    private final AtomicInteger pendingPushes = new AtomicInteger();

    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);

    private final Set<KvBytes> channels = new LinkedHashSet<>();

    private final Set<KvBytes> patterns = new LinkedHashSet<>();

    private final ChannelFutureListener releasePush = future -> pendingPushes.decrementAndGet();

    private volatile boolean draining;

    public ClientSession(Channel channel, EventExecutor commandExecutor, int pushCapacity) {
        this.channel = channel;
        this.commandExecutor = commandExecutor;
        this.pushCapacity = pushCapacity;
    }

    @Override
    public long getId() {
        return id;
    }

    public Channel getChannel() {
        return channel;
    }

    /**
     * 回复当前请求，不计入推送容量。
     */
    public void reply(Resp response) {
        enqueue(new Outbound(response, false, false));
    }

    @Override
    public OfferResult offer(RespArray message) {
        if (!channel.isActive()) {
            return OfferResult.CLOSED;
        }
        final int pending = pendingPushes.incrementAndGet();
        if (pushCapacity > 0 && pending > pushCapacity) {
            pendingPushes.decrementAndGet();
            return OfferResult.FULL;
        }
        enqueue(new Outbound(message, true, false));
        return OfferResult.QUEUED;
    }

    @Override
    public void disconnectSlow() {
        log.warn("关闭慢订阅者连接 {}，积压推送 {} 条", channel.remoteAddress(), pendingPushes.get());
        channel.close();
    }

    /**
     * 已经入队的回复全部写出后关闭连接。
     */
    public void closeAfterReplies() {
        enqueue(new Outbound(null, false, true));
    }

    /**
     * 开始排空：停止读取新的请求，当前命令完成并且回复写出后关闭连接。
     */
    public void beginDrain() {
        draining = true;
        channel.config().setAutoRead(false);
        try {
            // 排在已提交的命令之后执行
            commandExecutor.execute(this::closeAfterReplies);
        } catch (RejectedExecutionException e) {
            channel.close();
        }
    }

    public boolean isDraining() {
        return draining;
    }

    private void enqueue(Outbound item) {
        outbound.add(item);
        scheduleDrain();
    }

    /**
     * 在事件循环上写出队列中的消息。连接重新可写时也会调用。
     */
    public void scheduleDrain() {
        if (!drainScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            channel.eventLoop().execute(this::drain);
        } catch (RejectedExecutionException e) {
            drainScheduled.set(false);
            discardPending();
        }
    }

    private void drain() {
        drainScheduled.set(false);
        if (!channel.isActive()) {
            discardPending();
            return;
        }
        boolean written = false;
        Outbound next;
        while (channel.isWritable() && (next = outbound.poll()) != null) {
            if (next.close) {
                channel.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
                discardPending();
                return;
            }
            final ChannelFuture future = channel.write(next.message);
            if (next.push) {
                future.addListener(releasePush);
            }
            written = true;
        }
        if (written) {
            channel.flush();
        }
    }

    private void discardPending() {
        Outbound item;
        while ((item = outbound.poll()) != null) {
            if (item.push) {
                pendingPushes.decrementAndGet();
            }
        }
    }

    public int getPendingPushes() {
        return pendingPushes.get();
    }

    // ========== 订阅状态 ==========

    public boolean addChannel(KvBytes channelName) {
        return channels.add(channelName);
    }

    public boolean removeChannel(KvBytes channelName) {
        return channels.remove(channelName);
    }

    public boolean addPattern(KvBytes pattern) {
        return patterns.add(pattern);
    }

    public boolean removePattern(KvBytes pattern) {
        return patterns.remove(pattern);
    }

    public List<KvBytes> getChannels() {
        return new ArrayList<>(channels);
    }

    public List<KvBytes> getPatterns() {
        return new ArrayList<>(patterns);
    }

    /**
     * @return 频道和模式订阅的总数
     */
    public int subscriptionCount() {
        return channels.size() + patterns.size();
    }

    public boolean isSubscribed() {
        return subscriptionCount() > 0;
    }

    public void clearSubscriptions() {
        channels.clear();
        patterns.clear();
    }

    private static final class Outbound {
        private final Resp message;
        private final boolean push;
        private final boolean close;

        private Outbound(Resp message, boolean push, boolean close) {
            this.message = message;
            this.push = push;
            this.close = close;
        }
    }
}
