package site.kvmini.aof.writer;

/**
 * AOF 刷盘策略。
 *
 * @author hnfy258
 * @since 1.0
 */
public enum AofSyncPolicy {
    /** 每次追加后 fsync，返回成功前数据已落盘 */
    ALWAYS("always"),
    /** 每秒 fsync 一次，默认策略 */
    EVERYSEC("everysec"),
    /** 不主动 fsync，交给操作系统 */
    NO("no");

    private final String configName;

    AofSyncPolicy(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * 解析配置值，{@code interval} 和 {@code never} 作为 everysec 和 no 的别名。
     *
     * @throws IllegalArgumentException 无法识别的值
     */
    public static AofSyncPolicy fromString(String value) {
        switch (value.trim().toLowerCase()) {
            case "always":
                return ALWAYS;
            case "everysec":
            case "interval":
                return EVERYSEC;
            case "no":
            case "never":
                return NO;
            default:
                throw new IllegalArgumentException("无效的appendfsync取值: " + value);
        }
    }
}
