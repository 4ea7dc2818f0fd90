package site.kvmini.common;

/**
 * 毫秒级时间源。过期判断统一从这里取当前时间，测试中可以替换为手动推进的时钟。
 *
 * @author hnfy258
 * @since 1.0
 */
@FunctionalInterface
public interface Clock {

    Clock SYSTEM = System::currentTimeMillis;

    /**
     * @return 当前 Unix 时间戳（毫秒）
     */
    long currentTimeMillis();
}
