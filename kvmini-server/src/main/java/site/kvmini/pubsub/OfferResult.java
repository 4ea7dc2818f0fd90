package site.kvmini.pubsub;

/**
 * 向订阅者投递一条消息的结果。
 *
 * @author hnfy258
 * @since 1.0
 */
public enum OfferResult {

    /** 已放进发送队列 */
    QUEUED,

    /** 发送队列已满 */
    FULL,

    /** 连接已经关闭，消息被丢弃 */
    CLOSED
}
