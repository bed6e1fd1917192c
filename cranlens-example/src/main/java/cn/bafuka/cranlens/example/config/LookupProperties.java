package cn.bafuka.cranlens.example.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 包查询配置属性
 */
@Data
@ConfigurationProperties(prefix = "cranlens.lookup")
public class LookupProperties {

    /**
     * crandb 地址
     */
    private String crandbBaseUrl = "https://crandb.r-pkg.org";

    /**
     * CRAN GitHub 镜像的 raw 地址
     */
    private String readmeBaseUrl = "https://raw.githubusercontent.com/cran";

    /**
     * 包作者仓库的 raw 地址
     */
    private String githubRawBaseUrl = "https://raw.githubusercontent.com";

    private long connectTimeoutMillis = 5000;

    private long readTimeoutMillis = 30000;

    /**
     * 包信息缓存 30 分钟
     */
    private long packageInfoTtlMillis = 1800 * 1000L;

    /**
     * README 缓存 1 小时
     */
    private long readmeTtlMillis = 3600 * 1000L;

    /**
     * 搜索结果缓存 15 分钟
     */
    private long searchTtlMillis = 900 * 1000L;

    /**
     * 全量包索引缓存 1 小时
     */
    private long packageIndexTtlMillis = 3600 * 1000L;

    /**
     * 搜索默认返回条数
     */
    private int defaultSearchLimit = 20;

    /**
     * 搜索最大返回条数
     */
    private int maxSearchLimit = 100;
}
