package site.kvmini.database;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 过期键的后台清理任务。
 *
 * <p>每个周期从带过期时间的键中抽样 {@value #SAMPLE_SIZE} 个，删除已过期的；
 * 如果样本中过期比例超过 {@value #ACCEPTABLE_STALE_PERCENT}%，继续下一轮抽样，
 * 直到比例降下来或者用完本周期的时间预算。每轮抽样单独加锁，不会长时间阻塞命令。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class ExpirySweeper implements AutoCloseable {

    static final int SAMPLE_SIZE = 20;

    static final int ACCEPTABLE_STALE_PERCENT = 25;

    private final Keyspace keyspace;

    private final long periodMillis;

    /** 单个周期最多占用周期长度的四分之一 */
    private final long timeBudgetNanos;

    private final ScheduledExecutorService scheduler;

    /**
     * @param keyspace 键空间
     * @param hz       每秒执行的周期数
     */
    public ExpirySweeper(Keyspace keyspace, int hz) {
        if (hz <= 0) {
            throw new IllegalArgumentException("hz必须大于0");
        }
        this.keyspace = keyspace;
        this.periodMillis = Math.max(1, 1000 / hz);
        this.timeBudgetNanos = TimeUnit.MILLISECONDS.toNanos(periodMillis) / 4;
        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r);
            thread.setName("Expire-Sweeper");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::safeCycle, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("过期键清理任务已启动，周期: {}ms", periodMillis);
    }

    private void safeCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            // 异常会取消周期任务，这里记录后继续下一周期
            log.error("过期键清理失败", e);
        }
    }

    /**
     * 执行一个清理周期。
     *
     * @return 本周期删除的键数
     */
    public int runCycle() {
        final long start = System.nanoTime();
        int removed = 0;
        while (true) {
            final Keyspace.SampleResult result = keyspace.sampleExpired(SAMPLE_SIZE);
            removed += result.getExpired();
            if (result.getSampled() == 0
                    || result.getExpired() * 100 <= result.getSampled() * ACCEPTABLE_STALE_PERCENT) {
                break;
            }
            if (System.nanoTime() - start > timeBudgetNanos) {
                log.debug("过期键清理用完时间预算，剩余的留到下个周期");
                break;
            }
        }
        if (removed > 0) {
            log.debug("本周期清理过期键 {} 个", removed);
        }
        return removed;
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
