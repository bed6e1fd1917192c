package cn.bafuka.cranlens.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存统计信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    /**
     * 当前条目数
     */
    private long size;

    /**
     * 当前估算内存占用（字节）
     */
    private long memoryUsage;

    /**
     * 字节预算
     */
    private long maxSize;

    private long hitCount;
    private long missCount;

    /**
     * 因容量不足被 LRU 淘汰的条目数
     */
    private long evictionCount;

    /**
     * 因 TTL 到期被清除的条目数
     */
    private long expiredCount;

    /**
     * 计算命中率
     *
     * @return 命中率（0.0 ~ 1.0），没有请求时为 0
     */
    public double getHitRate() {
        long requestCount = hitCount + missCount;
        return requestCount == 0 ? 0.0 : (double) hitCount / requestCount;
    }
}
