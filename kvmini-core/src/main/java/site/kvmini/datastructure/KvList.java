package site.kvmini.datastructure;

import site.kvmini.protocol.BulkString;
import site.kvmini.protocol.Resp;
import site.kvmini.protocol.RespArray;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

/**
 * 列表值，两端插入删除为 O(1)。
 *
 * @author hnfy258
 * @since 1.0
 */
public class KvList implements KvData {

    private static final BulkString RPUSH = BulkString.fromString("RPUSH");

    /** 重写时每条 RPUSH 命令携带的最大元素数 */
    private static final int REWRITE_BATCH = 64;

    private final LinkedList<KvBytes> list = new LinkedList<>();

    public int lpush(KvBytes... values) {
        for (KvBytes value : values) {
            list.addFirst(value);
        }
        return list.size();
    }

    public int rpush(KvBytes... values) {
        for (KvBytes value : values) {
            list.addLast(value);
        }
        return list.size();
    }

    public KvBytes lpop() {
        return list.pollFirst();
    }

    public KvBytes rpop() {
        return list.pollLast();
    }

    public int size() {
        return list.size();
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    /**
     * 按下标取元素，负数从尾部计数。
     *
     * @return 元素，越界返回 null
     */
    public KvBytes index(long index) {
        final int size = list.size();
        if (index < 0) {
            index += size;
        }
        if (index < 0 || index >= size) {
            return null;
        }
        return list.get((int) index);
    }

    /**
     * 闭区间 [start, stop] 内的元素，负数下标从尾部计数，越界部分被截断。
     */
    public List<KvBytes> range(long start, long stop) {
        final int size = list.size();
        if (start < 0) {
            start = Math.max(0, start + size);
        }
        if (stop < 0) {
            stop += size;
        }
        if (stop >= size) {
            stop = size - 1;
        }
        final List<KvBytes> result = new ArrayList<>();
        if (start > stop || start >= size) {
            return result;
        }
        final Iterator<KvBytes> iterator = list.listIterator((int) start);
        for (long i = start; i <= stop && iterator.hasNext(); i++) {
            result.add(iterator.next());
        }
        return result;
    }

    /**
     * 替换指定下标的元素，负数从尾部计数。
     *
     * @return 下标越界返回 false
     */
    public boolean set(long index, KvBytes value) {
        final int size = list.size();
        if (index < 0) {
            index += size;
        }
        if (index < 0 || index >= size) {
            return false;
        }
        list.set((int) index, value);
        return true;
    }

    /**
     * 删除等于 value 的元素。count 大于 0 从头部开始删除最多 count 个，
     * 小于 0 从尾部开始删除最多 -count 个，等于 0 删除全部。
     *
     * @return 删除的个数
     */
    public int remove(long count, KvBytes value) {
        final long limit = count == 0 ? Long.MAX_VALUE : Math.abs(count);
        final Iterator<KvBytes> iterator = count < 0 ? list.descendingIterator() : list.iterator();
        int removed = 0;
        while (removed < limit && iterator.hasNext()) {
            if (iterator.next().equals(value)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * 只保留闭区间 [start, stop] 内的元素，下标规则与 {@link #range(long, long)} 相同。
     *
     * @return 删除的元素个数
     */
    public int trim(long start, long stop) {
        final int size = list.size();
        if (start < 0) {
            start = Math.max(0, start + size);
        }
        if (stop < 0) {
            stop += size;
        }
        if (stop >= size) {
            stop = size - 1;
        }
        if (start > stop || start >= size) {
            list.clear();
            return size;
        }
        for (long i = stop + 1; i < size; i++) {
            list.removeLast();
        }
        for (long i = 0; i < start; i++) {
            list.removeFirst();
        }
        return size - (int) (stop - start + 1);
    }

    public List<KvBytes> getAll() {
        return new ArrayList<>(list);
    }

    @Override
    public DataType type() {
        return DataType.LIST;
    }

    @Override
    public List<RespArray> toCommands(KvBytes key) {
        final List<RespArray> commands = new ArrayList<>();
        final Iterator<KvBytes> iterator = list.iterator();
        while (iterator.hasNext()) {
            final List<Resp> parts = new ArrayList<>(REWRITE_BATCH + 2);
            parts.add(RPUSH);
            parts.add(BulkString.create(key));
            while (iterator.hasNext() && parts.size() < REWRITE_BATCH + 2) {
                parts.add(BulkString.create(iterator.next()));
            }
            commands.add(RespArray.valueOf(parts));
        }
        return commands;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KvList && list.equals(((KvList) o).list);
    }

    @Override
    public int hashCode() {
        return list.hashCode();
    }

    @Override
    public String toString() {
        return "KvList" + list;
    }
}
