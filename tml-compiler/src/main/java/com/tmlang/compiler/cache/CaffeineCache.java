package com.tmlang.compiler.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.function.Function;

/**
 * 基于 Caffeine 的有界缓存
 *
 * <p>每个编译单元持有自己的实例；相同 key 的 computeIfAbsent 只计算一次，
 * 保证同一组类型实参总是得到同一个修饰名实例。</p>
 */
public final class CaffeineCache<K, V> implements BoundedCache<K, V> {

    private final Cache<K, V> cache;
    private final long maximumSize;

    /**
     * @param maximumSize 最大条目数
     */
    public CaffeineCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    @Override
    public V get(K key) {
        return cache.getIfPresent(key);
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        return cache.get(key, mappingFunction);
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(),
                cache.estimatedSize(), maximumSize);
    }
}
