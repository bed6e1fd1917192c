package cn.bafuka.cranlens.engine.impl;

import cn.bafuka.cranlens.core.CacheEngine;
import cn.bafuka.cranlens.core.CacheEntry;
import cn.bafuka.cranlens.core.CacheStats;
import cn.bafuka.cranlens.engine.SizeEstimator;
import cn.bafuka.cranlens.exception.CacheConfigurationException;
import cn.bafuka.cranlens.model.CacheOptions;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * 基于 Caffeine 的缓存引擎实现
 * 以估算字节数作为权重，每个条目使用各自的 TTL，命中后重新计时；
 * 淘汰顺序遵循 Caffeine 自身的 W-TinyLFU 策略，超过整体预算的单个值会被直接丢弃
 */
@Slf4j
public class CaffeineCacheEngine implements CacheEngine {

    private final Cache<String, CacheEntry> cache;

    private final SizeEstimator sizeEstimator;

    private final Ticker ticker;

    private final long defaultTtlMillis;

    private final long maxSize;

    private final LongAdder evictionCount = new LongAdder();

    private final LongAdder expiredCount = new LongAdder();

    /**
     * clear 时的统计快照，Caffeine 的统计无法重置，只能做差
     */
    private volatile com.github.benmanes.caffeine.cache.stats.CacheStats statsBaseline =
            com.github.benmanes.caffeine.cache.stats.CacheStats.empty();

    public CaffeineCacheEngine(CacheOptions options) {
        this(options, new JsonSizeEstimator(), Ticker.systemTicker());
    }

    public CaffeineCacheEngine(CacheOptions options, SizeEstimator sizeEstimator, Ticker ticker) {
        if (options.getTtlMillis() <= 0) {
            throw new CacheConfigurationException("ttlMillis", options.getTtlMillis());
        }
        if (options.getMaxSize() <= 0) {
            throw new CacheConfigurationException("maxSize", options.getMaxSize());
        }

        this.sizeEstimator = sizeEstimator;
        this.ticker = ticker;
        this.defaultTtlMillis = options.getTtlMillis();
        this.maxSize = options.getMaxSize();
        this.cache = buildCache();

        log.info("构建 Caffeine 缓存引擎，配置: ttlMillis={}, maxSize={}", defaultTtlMillis, maxSize);
    }

    /**
     * 根据配置构建 Caffeine Cache
     *
     * @return Caffeine Cache 实例
     */
    private Cache<String, CacheEntry> buildCache() {
        return Caffeine.newBuilder()
                .maximumWeight(maxSize)
                .weigher((String key, CacheEntry entry) -> (int) Math.min(entry.getSize(), Integer.MAX_VALUE))
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .scheduler(Scheduler.systemScheduler())
                .removalListener((String key, CacheEntry entry, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) {
                        expiredCount.increment();
                    } else if (cause == RemovalCause.SIZE) {
                        evictionCount.increment();
                        log.debug("Caffeine 容量淘汰: key={}", key);
                    }
                })
                .recordStats()
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <V> V get(String key) {
        if (key == null) {
            return null;
        }

        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            log.debug("缓存未命中: key={}", key);
            return null;
        }
        log.debug("缓存命中: key={}", key);
        return (V) entry.getValue();
    }

    @Override
    public void set(String key, Object value) {
        set(key, value, defaultTtlMillis);
    }

    @Override
    public void set(String key, Object value, long ttlMillis) {
        if (key == null || value == null) {
            log.warn("忽略空键或空值的写入: key={}", key);
            return;
        }

        long ttl = ttlMillis > 0 ? ttlMillis : defaultTtlMillis;
        long entrySize = sizeEstimator.estimate(key, value);
        if (entrySize > maxSize) {
            log.warn("缓存值超过整体预算，Caffeine 将直接丢弃: key={}, size={}, maxSize={}",
                    key, entrySize, maxSize);
        }

        cache.put(key, new CacheEntry(value, now(), ttl, entrySize));
        log.debug("缓存写入: key={}, ttlMillis={}, size={}", key, ttl, entrySize);
    }

    @Override
    public boolean has(String key) {
        return key != null && cache.asMap().containsKey(key);
    }

    @Override
    public boolean delete(String key) {
        if (key == null) {
            return false;
        }
        boolean removed = cache.asMap().remove(key) != null;
        if (removed) {
            log.debug("缓存删除: key={}", key);
        }
        return removed;
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
        resetStats();
        log.info("缓存已清空");
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public CacheStats getStats() {
        cache.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats().minus(statsBaseline);
        long memoryUsage = cache.policy().eviction()
                .map(eviction -> eviction.weightedSize().orElse(0L))
                .orElse(0L);

        return CacheStats.builder()
                .size(cache.estimatedSize())
                .memoryUsage(memoryUsage)
                .maxSize(maxSize)
                .hitCount(stats.hitCount())
                .missCount(stats.missCount())
                .evictionCount(evictionCount.sum())
                .expiredCount(expiredCount.sum())
                .build();
    }

    @Override
    public int cleanUp() {
        long before = expiredCount.sum();
        cache.cleanUp();
        return (int) (expiredCount.sum() - before);
    }

    @Override
    public void destroy() {
        cache.invalidateAll();
        cache.cleanUp();
        resetStats();
        log.info("Caffeine 缓存引擎已销毁");
    }

    private void resetStats() {
        statsBaseline = cache.stats();
        evictionCount.reset();
        expiredCount.reset();
    }

    private long now() {
        return TimeUnit.NANOSECONDS.toMillis(ticker.read());
    }

    /**
     * 每个条目使用写入时指定的 TTL，读取后重新计时
     */
    private static class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return TimeUnit.MILLISECONDS.toNanos(entry.getTtlMillis());
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return TimeUnit.MILLISECONDS.toNanos(entry.getTtlMillis());
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return TimeUnit.MILLISECONDS.toNanos(entry.getTtlMillis());
        }
    }
}
