package site.kvmini.database;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.common.Clock;
import site.kvmini.datastructure.KvBytes;
import site.kvmini.datastructure.KvData;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 键空间：键到带类型值的映射，加上可选的绝对过期时间。
 *
 * <p>并发约定：
 * <ul>
 *     <li>所有读写都经过同一把 {@link ReentrantLock}，值对象不会被观察到写了一半的状态</li>
 *     <li>命令执行通过 {@link #execute(Supplier)} 把"执行 + 写 AOF"包在一次加锁里，
 *         写命令的执行顺序即日志顺序</li>
 *     <li>单个方法自身也会加锁（可重入），测试和后台任务可以直接调用</li>
 * </ul>
 *
 * <p>过期时间保存在独立的 {@code expires} 表中，和 Redis 的做法一致。
 * 访问时先检查过期，已过期的键当作不存在并顺带删除（惰性过期）；
 * {@link #sampleExpired(int)} 供后台清理任务按样本主动删除。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class Keyspace {

    /** 无过期时间 */
    public static final long NO_EXPIRY = -1;

    /** ttl 查询：键不存在 */
    public static final long TTL_ABSENT = -2;

    /** ttl 查询：键存在但没有过期时间 */
    public static final long TTL_PERSISTENT = -1;

    private final Map<KvBytes, KvData> data = new ConcurrentHashMap<>();

    private final Map<KvBytes, Long> expires = new ConcurrentHashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    private final Clock clock;

    private final AtomicLong expiredKeys = new AtomicLong();

    /** 后台清理的游标，跨周期轮转 expires 表 */
    private Iterator<Map.Entry<KvBytes, Long>> sweepCursor;

    public Keyspace() {
        this(Clock.SYSTEM);
    }

    public Keyspace(Clock clock) {
        this.clock = clock;
    }

    /**
     * 在键空间锁内执行一段操作，期间其他命令、快照和过期清理都不会交错。
     */
    public <T> T execute(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public long now() {
        return clock.currentTimeMillis();
    }

    /**
     * 获取键的值。
     *
     * @return 值，不存在或已过期时返回 null
     */
    public KvData get(KvBytes key) {
        lock.lock();
        try {
            if (expireIfNeeded(key)) {
                return null;
            }
            return data.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 获取指定类型的值。
     *
     * @throws TypeMismatchException 键存在但类型不符
     */
    public <T extends KvData> T get(KvBytes key, Class<T> type) {
        final KvData value = get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new TypeMismatchException();
        }
        return type.cast(value);
    }

    /**
     * 写入值并设置过期时间，原有的过期时间被替换。
     *
     * @param expireAt 绝对过期时间（毫秒），{@link #NO_EXPIRY} 表示不过期
     * @return 被替换的旧值，没有时返回 null
     */
    public KvData set(KvBytes key, KvData value, long expireAt) {
        lock.lock();
        try {
            expireIfNeeded(key);
            final KvData previous = data.put(key, value);
            if (expireAt == NO_EXPIRY) {
                expires.remove(key);
            } else {
                expires.put(key, expireAt);
            }
            return previous;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 写入值并清除过期时间。
     */
    public KvData set(KvBytes key, KvData value) {
        return set(key, value, NO_EXPIRY);
    }

    /**
     * 写入新建的值，保留键原有的过期时间。
     * 用于 LPUSH、HSET 这类在不存在时创建容器的命令。
     */
    public void putKeepTtl(KvBytes key, KvData value) {
        lock.lock();
        try {
            expireIfNeeded(key);
            data.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 键存在且被删除时返回 true
     */
    public boolean delete(KvBytes key) {
        lock.lock();
        try {
            if (expireIfNeeded(key)) {
                return false;
            }
            expires.remove(key);
            return data.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public boolean exists(KvBytes key) {
        return get(key) != null;
    }

    /**
     * 设置绝对过期时间，时间已过时立即删除键。
     *
     * @return 键存在时返回 true
     */
    public boolean expireAt(KvBytes key, long expireAtMillis) {
        lock.lock();
        try {
            if (get(key) == null) {
                return false;
            }
            if (expireAtMillis <= now()) {
                expires.remove(key);
                data.remove(key);
                expiredKeys.incrementAndGet();
            } else {
                expires.put(key, expireAtMillis);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 设置相对过期时间。
     *
     * @return 键存在时返回 true
     */
    public boolean expire(KvBytes key, long ttlMillis) {
        lock.lock();
        try {
            return expireAt(key, now() + ttlMillis);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 原来有过期时间并被移除时返回 true
     */
    public boolean persist(KvBytes key) {
        lock.lock();
        try {
            if (get(key) == null) {
                return false;
            }
            return expires.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 绝对过期时间，键不存在或没有过期时间时返回 {@link #NO_EXPIRY}
     */
    public long getExpireAt(KvBytes key) {
        lock.lock();
        try {
            if (get(key) == null) {
                return NO_EXPIRY;
            }
            final Long when = expires.get(key);
            return when == null ? NO_EXPIRY : when;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 剩余存活时间（毫秒）。
     *
     * @return 剩余毫秒数，键不存在返回 {@link #TTL_ABSENT}，没有过期时间返回 {@link #TTL_PERSISTENT}
     */
    public long ttlMillis(KvBytes key) {
        lock.lock();
        try {
            if (get(key) == null) {
                return TTL_ABSENT;
            }
            final Long when = expires.get(key);
            if (when == null) {
                return TTL_PERSISTENT;
            }
            return Math.max(0, when - now());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 未过期的键数量。需要扫描一遍过期表，不删除任何键。
     */
    public int size() {
        lock.lock();
        try {
            return data.size() - countExpired();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 设置了过期时间且尚未过期的键数量
     */
    public int expiresSize() {
        lock.lock();
        try {
            return expires.size() - countExpired();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 实际存储的键数量，包括已经过期但还没被删除的
     */
    public int storedSize() {
        return data.size();
    }

    public int storedExpiresSize() {
        return expires.size();
    }

    private int countExpired() {
        final long now = now();
        int expired = 0;
        for (Long when : expires.values()) {
            if (when <= now) {
                expired++;
            }
        }
        return expired;
    }

    public long getExpiredKeys() {
        return expiredKeys.get();
    }

    public void clear() {
        lock.lock();
        try {
            data.clear();
            expires.clear();
            sweepCursor = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 遍历所有未过期的条目，整个遍历在锁内完成，看到的是同一时刻的状态。
     */
    public void forEach(EntryVisitor visitor) throws IOException {
        lock.lock();
        try {
            final long now = now();
            for (Map.Entry<KvBytes, KvData> entry : data.entrySet()) {
                final Long when = expires.get(entry.getKey());
                if (when != null && when <= now) {
                    continue;
                }
                visitor.visit(entry.getKey(), entry.getValue(), when == null ? NO_EXPIRY : when);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 用加载的数据整体替换当前内容。
     *
     * @param newData    新的键值
     * @param newExpires 新的过期时间表
     */
    public void replaceAll(Map<KvBytes, KvData> newData, Map<KvBytes, Long> newExpires) {
        lock.lock();
        try {
            clear();
            data.putAll(newData);
            expires.putAll(newExpires);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 从带过期时间的键中抽样检查，删除其中已过期的键。
     *
     * @param sampleSize 本次最多检查的键数
     * @return 抽样统计
     */
    public SampleResult sampleExpired(int sampleSize) {
        lock.lock();
        try {
            final long now = now();
            int sampled = 0;
            int expired = 0;
            final int limit = Math.min(sampleSize, expires.size());
            while (sampled < limit) {
                if (sweepCursor == null || !sweepCursor.hasNext()) {
                    sweepCursor = expires.entrySet().iterator();
                    if (!sweepCursor.hasNext()) {
                        break;
                    }
                }
                final Map.Entry<KvBytes, Long> entry = sweepCursor.next();
                sampled++;
                if (entry.getValue() <= now) {
                    final KvBytes key = entry.getKey();
                    expires.remove(key);
                    data.remove(key);
                    expiredKeys.incrementAndGet();
                    expired++;
                }
            }
            return new SampleResult(sampled, expired);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 列出所有未过期的键，主要用于测试和诊断。
     */
    public List<KvBytes> keys() {
        lock.lock();
        try {
            final List<KvBytes> keys = new ArrayList<>();
            for (KvBytes key : new ArrayList<>(data.keySet())) {
                if (!expireIfNeeded(key)) {
                    keys.add(key);
                }
            }
            return keys;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 键已过期时删除它。调用方必须持有锁。
     *
     * @return 键已过期并被删除时返回 true
     */
    private boolean expireIfNeeded(KvBytes key) {
        final Long when = expires.get(key);
        if (when == null || when > now()) {
            return false;
        }
        expires.remove(key);
        data.remove(key);
        expiredKeys.incrementAndGet();
        log.trace("惰性删除过期键: {}", key);
        return true;
    }

    /**
     * 遍历回调。
     */
    @FunctionalInterface
    public interface EntryVisitor {
        void visit(KvBytes key, KvData value, long expireAt) throws IOException;
    }

    /**
     * 一次抽样的统计。
     */
    @Getter
    @AllArgsConstructor
    public static final class SampleResult {
        private final int sampled;
        private final int expired;
    }
}
