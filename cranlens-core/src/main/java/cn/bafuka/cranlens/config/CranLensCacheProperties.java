package cn.bafuka.cranlens.config;

import cn.bafuka.cranlens.model.CacheOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * CranLens 缓存配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "cranlens.cache")
public class CranLensCacheProperties {

    /**
     * 是否启用缓存引擎
     */
    private boolean enabled = true;

    /**
     * 引擎类型
     */
    private EngineType engine = EngineType.MEMORY;

    /**
     * 默认过期时间（毫秒）
     */
    private long ttlMillis = CacheOptions.DEFAULT_TTL_MILLIS;

    /**
     * 字节预算
     */
    private long maxSize = CacheOptions.DEFAULT_MAX_SIZE;

    /**
     * 后台清理间隔（毫秒），仅 memory 引擎使用
     */
    private long sweepIntervalMillis = CacheOptions.DEFAULT_SWEEP_INTERVAL_MILLIS;

    public CacheOptions toOptions() {
        return CacheOptions.builder()
                .ttlMillis(ttlMillis)
                .maxSize(maxSize)
                .sweepIntervalMillis(sweepIntervalMillis)
                .build();
    }

    /**
     * 缓存引擎类型
     */
    public enum EngineType {
        /**
         * 按字节预算的 LRU 本地缓存
         */
        MEMORY,

        /**
         * Caffeine
         */
        CAFFEINE
    }
}
