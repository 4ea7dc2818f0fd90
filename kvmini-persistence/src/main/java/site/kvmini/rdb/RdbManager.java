package site.kvmini.rdb;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.kvmini.database.Keyspace;

import java.io.File;
import java.io.IOException;

/**
 * RDB 持久化管理器，把写入器和加载器绑定到一个快照文件和键空间上。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RdbManager {

    private final File rdbFile;

    private final Keyspace keyspace;

    private final RdbWriter writer;

    private final RdbLoader loader;

    public RdbManager(final Keyspace keyspace, final File rdbFile) {
        this.keyspace = keyspace;
        this.rdbFile = rdbFile;
        this.writer = new RdbWriter();
        this.loader = new RdbLoader(keyspace::now);
    }

    /**
     * 加载快照并整体替换键空间的内容。
     *
     * @return 文件存在并加载成功时返回 true
     * @throws CorruptSnapshotException 文件损坏，键空间不变
     */
    public boolean load() throws IOException {
        final RdbLoader.Snapshot snapshot = loader.load(rdbFile);
        if (snapshot == null) {
            return false;
        }
        keyspace.replaceAll(snapshot.getData(), snapshot.getExpires());
        return true;
    }

    /**
     * 在键空间锁内序列化，调用方可以在同一次加锁里做其他需要对齐的操作。
     */
    public byte[] capture() {
        return writer.serialize(keyspace);
    }

    public void write(byte[] content) throws IOException {
        writer.writeFile(content, rdbFile);
    }

    /**
     * 同步保存：序列化后立即写文件。
     */
    public void save() throws IOException {
        write(capture());
    }
}
