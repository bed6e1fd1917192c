package cn.bafuka.cranlens.autoconfigure;

import cn.bafuka.cranlens.core.CacheEngine;
import cn.bafuka.cranlens.engine.SizeEstimator;
import cn.bafuka.cranlens.engine.impl.CaffeineCacheEngine;
import cn.bafuka.cranlens.engine.impl.JsonSizeEstimator;
import cn.bafuka.cranlens.engine.impl.LruMemoryCacheEngine;
import cn.bafuka.cranlens.exception.CacheConfigurationException;
import cn.bafuka.cranlens.model.CacheOptions;
import org.junit.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.*;

/**
 * CranLensAutoConfiguration 单元测试
 */
public class CranLensAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CranLensAutoConfiguration.class));

    /**
     * 默认创建 memory 引擎
     */
    @Test
    public void testDefaultEngine() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(CacheEngine.class);
            assertThat(context).hasSingleBean(SizeEstimator.class);
            assertTrue(context.getBean(CacheEngine.class) instanceof LruMemoryCacheEngine);
            assertEquals(CacheOptions.DEFAULT_MAX_SIZE, context.getBean(CacheEngine.class).getStats().getMaxSize());
        });
    }

    /**
     * 配置项绑定到引擎
     */
    @Test
    public void testPropertiesBinding() {
        contextRunner
                .withPropertyValues("cranlens.cache.max-size=2048", "cranlens.cache.ttl-millis=500")
                .run(context -> {
                    CacheEngine engine = context.getBean(CacheEngine.class);
                    assertEquals(2048, engine.getStats().getMaxSize());
                });
    }

    /**
     * 选择 Caffeine 引擎
     */
    @Test
    public void testCaffeineEngine() {
        contextRunner
                .withPropertyValues("cranlens.cache.engine=caffeine")
                .run(context -> assertTrue(context.getBean(CacheEngine.class) instanceof CaffeineCacheEngine));
    }

    /**
     * 关闭后不创建引擎
     */
    @Test
    public void testDisabled() {
        contextRunner
                .withPropertyValues("cranlens.cache.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(CacheEngine.class));
    }

    /**
     * 非法预算导致启动失败
     */
    @Test
    public void testInvalidBudgetFailsStartup() {
        contextRunner
                .withPropertyValues("cranlens.cache.max-size=0")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(CacheConfigurationException.class);
                });
    }

    /**
     * 用户自定义的引擎优先
     */
    @Test
    public void testUserDefinedEngine() {
        contextRunner
                .withUserConfiguration(CustomEngineConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(CacheEngine.class);
                    assertEquals(4096, context.getBean(CacheEngine.class).getStats().getMaxSize());
                });
    }

    @Configuration
    static class CustomEngineConfiguration {

        @Bean(destroyMethod = "destroy")
        public CacheEngine customCacheEngine() {
            return new LruMemoryCacheEngine(CacheOptions.builder().maxSize(4096).build());
        }

        @Bean
        public SizeEstimator customSizeEstimator() {
            return new JsonSizeEstimator();
        }
    }
}
