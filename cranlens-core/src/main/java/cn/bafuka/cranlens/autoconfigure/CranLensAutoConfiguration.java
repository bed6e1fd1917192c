package cn.bafuka.cranlens.autoconfigure;

import cn.bafuka.cranlens.config.CranLensCacheProperties;
import cn.bafuka.cranlens.core.CacheEngine;
import cn.bafuka.cranlens.engine.SizeEstimator;
import cn.bafuka.cranlens.engine.impl.CaffeineCacheEngine;
import cn.bafuka.cranlens.engine.impl.JsonSizeEstimator;
import cn.bafuka.cranlens.engine.impl.LruMemoryCacheEngine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * CranLens 自动配置类
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CranLensCacheProperties.class)
@ConditionalOnProperty(prefix = "cranlens.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CranLensAutoConfiguration {

    public CranLensAutoConfiguration() {
        log.info("CranLens auto-configuration initializing...");
    }

    /**
     * 条目大小估算器
     */
    @Bean
    @ConditionalOnMissingBean
    public SizeEstimator sizeEstimator() {
        return new JsonSizeEstimator();
    }

    /**
     * 缓存引擎，容器关闭时停止后台清理
     */
    @Bean(destroyMethod = "destroy")
    @ConditionalOnMissingBean
    public CacheEngine cacheEngine(CranLensCacheProperties properties, SizeEstimator sizeEstimator) {
        log.info("创建缓存引擎: engine={}", properties.getEngine());
        if (properties.getEngine() == CranLensCacheProperties.EngineType.CAFFEINE) {
            return new CaffeineCacheEngine(properties.toOptions(), sizeEstimator, Ticker.systemTicker());
        }
        return new LruMemoryCacheEngine(properties.toOptions(), sizeEstimator, Ticker.systemTicker());
    }
}
