package cn.bafuka.cranlens.example.config;

import cn.bafuka.cranlens.example.client.RegistryClient;
import cn.bafuka.cranlens.example.client.impl.HttpRegistryClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 注册中心客户端配置
 */
@Configuration
@EnableConfigurationProperties(LookupProperties.class)
public class RegistryClientConfiguration {

    @Bean
    public RestTemplate registryRestTemplate(RestTemplateBuilder builder, LookupProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMillis()))
                .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMillis()))
                .build();
    }

    @Bean
    public RegistryClient registryClient(RestTemplate registryRestTemplate, LookupProperties properties) {
        return new HttpRegistryClient(registryRestTemplate, properties);
    }
}
