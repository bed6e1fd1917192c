package cn.bafuka.cranlens.core;

/**
 * 缓存条目
 * 保存值、最近一次写入/命中的时间戳、TTL 以及写入时估算的大小
 */
public class CacheEntry {

    private final Object value;

    /**
     * 写入或最近一次命中的时间（毫秒，引擎时钟）
     */
    private long storedAt;

    private final long ttlMillis;

    /**
     * 写入时估算的字节数，之后的内存统计都以它为准
     */
    private final long size;

    public CacheEntry(Object value, long storedAt, long ttlMillis, long size) {
        this.value = value;
        this.storedAt = storedAt;
        this.ttlMillis = ttlMillis;
        this.size = size;
    }

    public Object getValue() {
        return value;
    }

    public long getStoredAt() {
        return storedAt;
    }

    public long getTtlMillis() {
        return ttlMillis;
    }

    public long getSize() {
        return size;
    }

    /**
     * 命中时刷新时间戳，过期窗口随之后移
     */
    public void touch(long now) {
        this.storedAt = now;
    }

    public boolean isExpired(long now) {
        return now - storedAt >= ttlMillis;
    }
}
