package site.kvmini.datastructure;

import site.kvmini.protocol.RespArray;

import java.util.List;

/**
 * 键空间中的值。
 *
 * <p>实现类是可变的，只能在键空间的锁内读写，不能把引用传到锁外。
 * 过期时间由键空间单独保存，不属于值本身。
 *
 * @author hnfy258
 * @since 1.0
 */
public interface KvData {

    DataType type();

    /**
     * 生成能够重建该值的最少命令，用于 AOF 重写。
     *
     * @param key 值所在的键
     * @return 命令列表，空值返回空列表
     */
    List<RespArray> toCommands(KvBytes key);
}
