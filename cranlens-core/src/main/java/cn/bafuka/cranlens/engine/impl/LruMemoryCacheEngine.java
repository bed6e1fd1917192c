package cn.bafuka.cranlens.engine.impl;

import cn.bafuka.cranlens.core.CacheEngine;
import cn.bafuka.cranlens.core.CacheEntry;
import cn.bafuka.cranlens.core.CacheStats;
import cn.bafuka.cranlens.engine.SizeEstimator;
import cn.bafuka.cranlens.exception.CacheConfigurationException;
import cn.bafuka.cranlens.model.CacheOptions;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.lang.ref.WeakReference;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 按字节预算限制的本地缓存引擎
 * <p>
 * 条目按最近访问顺序保存在 LinkedHashMap 中（表头最久未访问），容量不足时从表头淘汰；
 * 过期条目在访问时惰性清除、在每次写入时清除，并由后台任务定期清理。
 * 所有操作与后台清理共用一把锁。
 * <p>
 * 每个实例持有一个后台清理线程，用完后应调用 {@link #destroy()} 释放；
 * 清理任务只弱引用引擎，未销毁的实例被回收后线程随之退出。
 */
@Slf4j
public class LruMemoryCacheEngine implements CacheEngine {

    /**
     * 插入顺序的 LinkedHashMap，命中时重新放到表尾
     */
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    private final long defaultTtlMillis;

    private final long maxSize;

    private final SizeEstimator sizeEstimator;

    private final Ticker ticker;

    /**
     * 后台过期清理调度器
     */
    private final ScheduledExecutorService sweepScheduler;

    private final ScheduledFuture<?> sweepFuture;

    /**
     * 后台清理是否仍然有效，destroy 后置为 false
     */
    private boolean sweeping;

    private long usedBytes;
    private long hitCount;
    private long missCount;
    private long evictionCount;
    private long expiredCount;

    public LruMemoryCacheEngine() {
        this(CacheOptions.defaults());
    }

    public LruMemoryCacheEngine(CacheOptions options) {
        this(options, new JsonSizeEstimator(), Ticker.systemTicker());
    }

    public LruMemoryCacheEngine(CacheOptions options, SizeEstimator sizeEstimator, Ticker ticker) {
        requirePositive("ttlMillis", options.getTtlMillis());
        requirePositive("maxSize", options.getMaxSize());
        requirePositive("sweepIntervalMillis", options.getSweepIntervalMillis());

        this.defaultTtlMillis = options.getTtlMillis();
        this.maxSize = options.getMaxSize();
        this.sizeEstimator = sizeEstimator;
        this.ticker = ticker;

        this.sweepScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "cranlens-cache-sweep");
            thread.setDaemon(true);
            return thread;
        });
        this.sweeping = true;
        this.sweepFuture = sweepScheduler.scheduleWithFixedDelay(new SweepTask(this, sweepScheduler),
                options.getSweepIntervalMillis(), options.getSweepIntervalMillis(), TimeUnit.MILLISECONDS);

        log.info("构建本地缓存引擎，配置: ttlMillis={}, maxSize={}, sweepIntervalMillis={}",
                defaultTtlMillis, maxSize, options.getSweepIntervalMillis());
    }

    private static void requirePositive(String option, long value) {
        if (value <= 0) {
            throw new CacheConfigurationException(option, value);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <V> V get(String key) {
        if (key == null) {
            return null;
        }

        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                missCount++;
                log.debug("缓存未命中: key={}", key);
                return null;
            }

            long now = now();
            if (entry.isExpired(now)) {
                removeEntry(key, entry);
                expiredCount++;
                missCount++;
                log.debug("缓存已过期: key={}", key);
                return null;
            }

            // 移到表尾，成为最近访问的条目
            entry.touch(now);
            entries.remove(key);
            entries.put(key, entry);
            hitCount++;
            log.debug("缓存命中: key={}", key);
            return (V) entry.getValue();
        } finally {
            lock.unlock();
        }
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

        lock.lock();
        try {
            long now = now();
            removeExpired(now);

            CacheEntry previous = entries.remove(key);
            if (previous != null) {
                usedBytes -= previous.getSize();
            }

            while (usedBytes + entrySize > maxSize && !entries.isEmpty()) {
                evictEldest();
            }

            if (entrySize > maxSize) {
                log.warn("缓存值超过整体预算，已清空其它条目后写入: key={}, size={}, maxSize={}",
                        key, entrySize, maxSize);
            }

            entries.put(key, new CacheEntry(value, now, ttl, entrySize));
            usedBytes += entrySize;
            log.debug("缓存写入: key={}, ttlMillis={}, size={}", key, ttl, entrySize);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean has(String key) {
        if (key == null) {
            return false;
        }

        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            if (entry.isExpired(now())) {
                removeEntry(key, entry);
                expiredCount++;
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        if (key == null) {
            return false;
        }

        lock.lock();
        try {
            CacheEntry entry = entries.remove(key);
            if (entry == null) {
                return false;
            }
            usedBytes -= entry.getSize();
            log.debug("缓存删除: key={}", key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            resetState();
        } finally {
            lock.unlock();
        }
        log.info("缓存已清空");
    }

    @Override
    public long size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats getStats() {
        lock.lock();
        try {
            return CacheStats.builder()
                    .size(entries.size())
                    .memoryUsage(usedBytes)
                    .maxSize(maxSize)
                    .hitCount(hitCount)
                    .missCount(missCount)
                    .evictionCount(evictionCount)
                    .expiredCount(expiredCount)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int cleanUp() {
        lock.lock();
        try {
            return removeExpired(now());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void destroy() {
        lock.lock();
        try {
            if (sweeping) {
                sweeping = false;
                sweepFuture.cancel(false);
            }
            resetState();
        } finally {
            lock.unlock();
        }

        sweepScheduler.shutdownNow();
        log.info("缓存引擎已销毁");
    }

    /**
     * 后台清理任务，异常只记录日志，避免调度被终止
     */
    private void sweep() {
        lock.lock();
        try {
            if (!sweeping) {
                return;
            }
            removeExpired(now());
        } catch (RuntimeException e) {
            log.error("后台清理过期缓存失败", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 弱引用引擎的清理任务，引擎被回收后关闭调度器
     */
    private static final class SweepTask implements Runnable {

        private final WeakReference<LruMemoryCacheEngine> engineRef;

        private final ScheduledExecutorService scheduler;

        private SweepTask(LruMemoryCacheEngine engine, ScheduledExecutorService scheduler) {
            this.engineRef = new WeakReference<>(engine);
            this.scheduler = scheduler;
        }

        @Override
        public void run() {
            LruMemoryCacheEngine engine = engineRef.get();
            if (engine == null) {
                log.warn("缓存引擎未调用 destroy 即被回收，停止后台清理线程");
                scheduler.shutdown();
                return;
            }
            engine.sweep();
        }
    }

    /**
     * 调用方必须持有锁
     */
    private int removeExpired(long now) {
        int removed = 0;
        long freed = 0;

        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            CacheEntry entry = it.next().getValue();
            if (entry.isExpired(now)) {
                it.remove();
                usedBytes -= entry.getSize();
                freed += entry.getSize();
                removed++;
            }
        }

        if (removed > 0) {
            expiredCount += removed;
            log.debug("清理过期缓存: removed={}, freedBytes={}", removed, freed);
        }
        return removed;
    }

    /**
     * 淘汰表头（最久未访问）的条目，调用方必须持有锁
     */
    private void evictEldest() {
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        Map.Entry<String, CacheEntry> eldest = it.next();
        it.remove();
        usedBytes -= eldest.getValue().getSize();
        evictionCount++;
        log.debug("LRU 淘汰: key={}, freedBytes={}", eldest.getKey(), eldest.getValue().getSize());
    }

    private void removeEntry(String key, CacheEntry entry) {
        entries.remove(key);
        usedBytes -= entry.getSize();
    }

    private void resetState() {
        entries.clear();
        usedBytes = 0;
        hitCount = 0;
        missCount = 0;
        evictionCount = 0;
        expiredCount = 0;
    }

    private long now() {
        return TimeUnit.NANOSECONDS.toMillis(ticker.read());
    }
}
