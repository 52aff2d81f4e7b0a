package com.tmlang.compiler.cache;

import java.util.function.Function;

/**
 * 有界缓存接口
 *
 * <p>编译期各类去重表（修饰名、实例化结果）的统一抽象。</p>
 */
public interface BoundedCache<K, V> {

    /**
     * 获取缓存值
     *
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    /**
     * 如果不存在则计算并缓存
     *
     * @param mappingFunction 计算函数，相同 key 只调用一次
     * @return 缓存值（可能是新计算的）
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    /** 当前条目数（估算值） */
    long size();

    /** 清空缓存 */
    void clear();

    /** 命中统计 */
    CacheStats getStats();
}
