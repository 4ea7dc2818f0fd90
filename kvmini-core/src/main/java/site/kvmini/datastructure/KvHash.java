package site.kvmini.datastructure;

import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 哈希值，保持字段的插入顺序。
 *
 * @author hnfy258
 * @since 1.0
 */
public class KvHash implements KvData {

    private static final BulkString HSET = BulkString.fromString("HSET");

    private static final int REWRITE_BATCH = 64;

    private final Map<KvBytes, KvBytes> hash = new LinkedHashMap<>();

    /**
     * @return 字段是新增的返回 true，覆盖已有字段返回 false
     */
    public boolean put(KvBytes field, KvBytes value) {
        return hash.put(field, value) == null;
    }

    public KvBytes get(KvBytes field) {
        return hash.get(field);
    }

    public boolean delete(KvBytes field) {
        return hash.remove(field) != null;
    }

    public boolean contains(KvBytes field) {
        return hash.containsKey(field);
    }

    public int size() {
        return hash.size();
    }

    public boolean isEmpty() {
        return hash.isEmpty();
    }

    public Map<KvBytes, KvBytes> getAll() {
        return Collections.unmodifiableMap(hash);
    }

    @Override
    public DataType type() {
        return DataType.HASH;
    }

    @Override
    public List<RespArray> toCommands(KvBytes key) {
        final List<RespArray> commands = new ArrayList<>();
        final Iterator<Map.Entry<KvBytes, KvBytes>> iterator = hash.entrySet().iterator();
        while (iterator.hasNext()) {
            final List<Resp> parts = new ArrayList<>(REWRITE_BATCH * 2 + 2);
            parts.add(HSET);
            parts.add(BulkString.create(key));
            for (int i = 0; i < REWRITE_BATCH && iterator.hasNext(); i++) {
                final Map.Entry<KvBytes, KvBytes> entry = iterator.next();
                parts.add(BulkString.create(entry.getKey()));
                parts.add(BulkString.create(entry.getValue()));
            }
            commands.add(RespArray.valueOf(parts));
        }
        return commands;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KvHash && hash.equals(((KvHash) o).hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "KvHash" + hash;
    }
}
