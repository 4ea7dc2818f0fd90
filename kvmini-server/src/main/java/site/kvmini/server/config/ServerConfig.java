package site.kvmini.server.config;

import lombok.Builder;
import lombok.Data;
import site.kvmini.aof.writer.AofSyncPolicy;
import site.kvmini.persistence.PersistenceOptions;
import site.kvmini.protocol.Resp;

import java.io.File;
import java.util.Locale;
import java.util.Properties;

/**
 * 服务器配置。
 *
 * <p>可以用 Builder 直接创建，也可以从 properties 文件读取，键名与 redis.conf 保持一致
 * （如 {@code appendfsync}、{@code auto-aof-rewrite-min-size}）。大小类配置支持 kb/mb/gb 后缀，
 * 开关类配置接受 yes/no 和 true/false。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Data
@Builder
public class ServerConfig {

    // ========== 网络配置 ==========

    @Builder.Default
    private String host = "127.0.0.1";

    @Builder.Default
    private int port = 6379;

    @Builder.Default
    private int backlogSize = 1024;

    /** 空闲超过该秒数的非订阅连接被关闭，0 表示不检查 */
    @Builder.Default
    private int timeoutSeconds = 0;

    @Builder.Default
    private long maxBulkLen = Resp.DEFAULT_MAX_BULK_LEN;

    /** 每个订阅者允许排队的推送消息数，超过后断开，0 表示不限制 */
    @Builder.Default
    private int pubsubOutputLimit = 1024;

    // ========== 持久化配置 ==========

    @Builder.Default
    private String dir = ".";

    @Builder.Default
    private boolean aofEnabled = true;

    @Builder.Default
    private String aofFileName = "appendonly.aof";

    @Builder.Default
    private AofSyncPolicy syncPolicy = AofSyncPolicy.EVERYSEC;

    @Builder.Default
    private int aofRewritePercentage = 100;

    @Builder.Default
    private long aofRewriteMinSize = 64L * 1024 * 1024;

    /** 重写时以 RDB 快照作为 AOF 开头，关闭后写成重建数据的命令 */
    @Builder.Default
    private boolean aofUseRdbPreamble = true;

    @Builder.Default
    private boolean rdbEnabled = true;

    @Builder.Default
    private String rdbFileName = "dump.rdb";

    @Builder.Default
    private long saveIntervalSeconds = 300;

    // ========== 线程和定时任务 ==========

    /** Netty 工作线程数，0 使用 Netty 默认值 */
    @Builder.Default
    private int workerThreadCount = 0;

    @Builder.Default
    private int commandExecutorThreadCount = 1;

    /** 过期扫描每秒执行的次数 */
    @Builder.Default
    private int hz = 10;

    @Builder.Default
    private int shutdownTimeoutSeconds = 10;

    public static ServerConfig defaultConfig() {
        return ServerConfig.builder().build();
    }

    /**
     * 从 properties 读取配置，缺省的键使用默认值。
     *
     * @throws IllegalArgumentException 取值无法解析
     */
    public static ServerConfig fromProperties(Properties props) {
        final ServerConfig config = defaultConfig();
        config.setHost(props.getProperty("host", config.getHost()));
        config.setPort(intValue(props, "port", config.getPort()));
        config.setBacklogSize(intValue(props, "tcp-backlog", config.getBacklogSize()));
        config.setTimeoutSeconds(intValue(props, "timeout", config.getTimeoutSeconds()));
        config.setMaxBulkLen(sizeValue(props, "proto-max-bulk-len", config.getMaxBulkLen()));
        config.setPubsubOutputLimit(intValue(props, "client-output-buffer-limit-pubsub",
                config.getPubsubOutputLimit()));

        config.setDir(props.getProperty("dir", config.getDir()));
        config.setAofEnabled(booleanValue(props, "appendonly", config.isAofEnabled()));
        config.setAofFileName(props.getProperty("appendfilename", config.getAofFileName()));
        final String fsync = props.getProperty("appendfsync");
        if (fsync != null) {
            config.setSyncPolicy(AofSyncPolicy.fromString(fsync));
        }
        config.setAofRewritePercentage(intValue(props, "auto-aof-rewrite-percentage",
                config.getAofRewritePercentage()));
        config.setAofRewriteMinSize(sizeValue(props, "auto-aof-rewrite-min-size", config.getAofRewriteMinSize()));
        config.setAofUseRdbPreamble(booleanValue(props, "aof-use-rdb-preamble", config.isAofUseRdbPreamble()));
        config.setRdbEnabled(booleanValue(props, "rdb-enabled", config.isRdbEnabled()));
        config.setRdbFileName(props.getProperty("dbfilename", config.getRdbFileName()));
        config.setSaveIntervalSeconds(intValue(props, "save-interval-seconds",
                (int) config.getSaveIntervalSeconds()));

        config.setWorkerThreadCount(intValue(props, "io-threads", config.getWorkerThreadCount()));
        config.setCommandExecutorThreadCount(intValue(props, "command-threads",
                config.getCommandExecutorThreadCount()));
        config.setHz(intValue(props, "hz", config.getHz()));
        config.setShutdownTimeoutSeconds(intValue(props, "shutdown-timeout", config.getShutdownTimeoutSeconds()));
        return config;
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        final String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 " + key + " 不是整数: " + value, e);
        }
    }

    private static boolean booleanValue(Properties props, String key, boolean defaultValue) {
        final String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "yes":
            case "true":
                return true;
            case "no":
            case "false":
                return false;
            default:
                throw new IllegalArgumentException("配置项 " + key + " 只能是 yes 或 no: " + value);
        }
    }

    /**
     * 解析 64mb、512kb、1gb 这类大小，单位按 1024 计算，不带单位时为字节。
     */
    static long parseSize(String value) {
        final String text = value.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1;
        String digits = text;
        if (text.endsWith("kb")) {
            multiplier = 1024L;
            digits = text.substring(0, text.length() - 2);
        } else if (text.endsWith("mb")) {
            multiplier = 1024L * 1024;
            digits = text.substring(0, text.length() - 2);
        } else if (text.endsWith("gb")) {
            multiplier = 1024L * 1024 * 1024;
            digits = text.substring(0, text.length() - 2);
        } else if (text.endsWith("b")) {
            digits = text.substring(0, text.length() - 1);
        }
        try {
            return Math.multiplyExact(Long.parseLong(digits.trim()), multiplier);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("无效的大小: " + value, e);
        }
    }

    private static long sizeValue(Properties props, String key, long defaultValue) {
        final String value = props.getProperty(key);
        return value == null ? defaultValue : parseSize(value);
    }

    public void validate() {
        // 0 表示由系统分配
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }
        if (backlogSize <= 0) {
            throw new IllegalArgumentException("连接队列大小必须大于0");
        }
        if (workerThreadCount < 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量配置无效");
        }
        if (hz <= 0 || hz > 500) {
            throw new IllegalArgumentException("hz必须在1-500范围内");
        }
        if (timeoutSeconds < 0 || shutdownTimeoutSeconds < 0 || pubsubOutputLimit < 0
                || saveIntervalSeconds < 0 || aofRewritePercentage < 0) {
            throw new IllegalArgumentException("时间和数量类配置不能为负数");
        }
        if (maxBulkLen <= 0) {
            throw new IllegalArgumentException("proto-max-bulk-len必须大于0");
        }
        if (aofEnabled && (aofFileName == null || aofFileName.trim().isEmpty())) {
            throw new IllegalArgumentException("启用AOF时必须指定AOF文件名");
        }
        if (rdbEnabled && (rdbFileName == null || rdbFileName.trim().isEmpty())) {
            throw new IllegalArgumentException("启用RDB时必须指定RDB文件名");
        }
    }

    public PersistenceOptions toPersistenceOptions() {
        return PersistenceOptions.builder()
                .dir(new File(dir))
                .aofEnabled(aofEnabled)
                .aofFileName(aofFileName)
                .syncPolicy(syncPolicy)
                .rewriteMinSize(aofRewriteMinSize)
                .rewritePercentage(aofRewritePercentage)
                .aofUseRdbPreamble(aofUseRdbPreamble)
                .rdbEnabled(rdbEnabled)
                .rdbFileName(rdbFileName)
                .saveIntervalSeconds(saveIntervalSeconds)
                .maxBulkLen(maxBulkLen)
                .build();
    }
}
