package site.kvmini.pubsub;

import site.kvmini.protocol.RespArray;

/**
 * 订阅者，通常是一个客户端连接。
 *
 * @author hnfy258
 * @since 1.0
 */
public interface Subscriber {

    long getId();

    /**
     * 把消息放进订阅者的发送队列，不阻塞。
     *
     * @return 投递结果，只有 {@link OfferResult#QUEUED} 表示消息会被发出
     */
    OfferResult offer(RespArray message);

    /**
     * 订阅者跟不上消息速度，断开它。
     */
    void disconnectSlow();
}
