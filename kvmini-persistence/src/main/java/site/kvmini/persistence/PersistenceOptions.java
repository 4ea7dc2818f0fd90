package site.kvmini.persistence;

import lombok.Builder;
import lombok.Getter;
import site.kvmini.aof.writer.AofSyncPolicy;
import site.kvmini.protocol.Resp;

import java.io.File;

/**
 * 持久化配置。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
@Builder
public class PersistenceOptions {

    @Builder.Default
    private final File dir = new File(".");

    @Builder.Default
    private final boolean aofEnabled = true;

    @Builder.Default
    private final String aofFileName = "appendonly.aof";

    @Builder.Default
    private final AofSyncPolicy syncPolicy = AofSyncPolicy.EVERYSEC;

    @Builder.Default
    private final long rewriteMinSize = 64L * 1024 * 1024;

    /** 相对上次重写的增长百分比，0 表示关闭自动重写 */
    @Builder.Default
    private final int rewritePercentage = 100;

    /** AOF 重写时以 RDB 快照作为文件开头，关闭时重写为命令序列 */
    @Builder.Default
    private final boolean aofUseRdbPreamble = true;

    @Builder.Default
    private final boolean rdbEnabled = true;

    @Builder.Default
    private final String rdbFileName = "dump.rdb";

    /** 有写入时定期快照的间隔，0 表示关闭 */
    @Builder.Default
    private final long saveIntervalSeconds = 300;

    @Builder.Default
    private final long maxBulkLen = Resp.DEFAULT_MAX_BULK_LEN;

    public File aofFile() {
        return new File(dir, aofFileName);
    }

    public File rdbFile() {
        return new File(dir, rdbFileName);
    }
}
