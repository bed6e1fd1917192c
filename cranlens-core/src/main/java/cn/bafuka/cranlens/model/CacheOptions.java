package cn.bafuka.cranlens.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存引擎构建参数
 * 所有时间单位均为毫秒，容量单位为估算字节
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheOptions {

    /**
     * 默认 1 小时
     */
    public static final long DEFAULT_TTL_MILLIS = 3600 * 1000L;

    /**
     * 默认 100MB
     */
    public static final long DEFAULT_MAX_SIZE = 100 * 1024 * 1024L;

    /**
     * 默认 5 分钟清理一次
     */
    public static final long DEFAULT_SWEEP_INTERVAL_MILLIS = 5 * 60 * 1000L;

    /**
     * 默认过期时间（set 未指定 TTL 时使用）
     */
    @Builder.Default
    private long ttlMillis = DEFAULT_TTL_MILLIS;

    /**
     * 整个缓存的字节预算
     */
    @Builder.Default
    private long maxSize = DEFAULT_MAX_SIZE;

    /**
     * 过期条目后台清理间隔
     */
    @Builder.Default
    private long sweepIntervalMillis = DEFAULT_SWEEP_INTERVAL_MILLIS;

    /**
     * 使用全部默认值的配置
     */
    public static CacheOptions defaults() {
        return CacheOptions.builder().build();
    }
}
