package cn.bafuka.cranlens.example.service;

import cn.bafuka.cranlens.core.CacheEngine;
import cn.bafuka.cranlens.core.CacheKeys;
import cn.bafuka.cranlens.example.client.RegistryClient;
import cn.bafuka.cranlens.example.config.LookupProperties;
import cn.bafuka.cranlens.example.exception.RegistryLookupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * R 包查询服务
 * 包信息、README、搜索结果都先查缓存，未命中再回源注册中心
 */
@Slf4j
@Service
public class PackageLookupService {

    private static final Pattern GITHUB_REPOSITORY = Pattern.compile("github\\.com/([\\w.-]+)/([\\w.-]+)");

    private final CacheEngine cacheEngine;

    private final RegistryClient registryClient;

    private final LookupProperties properties;

    public PackageLookupService(CacheEngine cacheEngine, RegistryClient registryClient, LookupProperties properties) {
        this.cacheEngine = cacheEngine;
        this.registryClient = registryClient;
        this.properties = properties;
    }

    /**
     * 查询包的元数据
     *
     * @param packageName 包名
     * @return 元数据，不存在返回 null
     */
    public Map<String, Object> getPackageInfo(String packageName) {
        String name = requireText(packageName, "package_name");
        return cacheEngine.getOrLoad(CacheKeys.packageInfo(name), properties.getPackageInfoTtlMillis(), () -> {
            log.info("回源查询包信息: package={}", name);
            return registryClient.fetchPackage(name);
        });
    }

    /**
     * 查询包的 README
     *
     * @param packageName 包名
     * @param version     版本号，为空时取最新版本
     * @return README 原文；包存在但没有 README 时按元数据生成，包不存在返回 null
     */
    public String getPackageReadme(String packageName, String version) {
        String name = requireText(packageName, "package_name");
        String resolvedVersion = version == null || version.trim().isEmpty()
                ? CacheKeys.LATEST_VERSION
                : version.trim();

        return cacheEngine.getOrLoad(CacheKeys.packageReadme(name, resolvedVersion), properties.getReadmeTtlMillis(),
                () -> resolveReadme(name, resolvedVersion));
    }

    /**
     * 依次尝试 CRAN 镜像、包作者的 GitHub 仓库，都没有时按元数据生成；包不存在返回 null
     */
    private String resolveReadme(String name, String version) {
        log.info("回源查询 README: package={}, version={}", name, version);
        String readme = registryClient.fetchReadme(name, version);
        if (readme != null) {
            return readme;
        }

        Map<String, Object> info = getPackageInfo(name);
        if (info == null) {
            log.info("包不存在，无法获取 README: package={}", name);
            return null;
        }

        readme = fetchProjectReadme(stringValue(info.get("URL")));
        if (readme != null) {
            return readme;
        }

        log.info("未找到 README，根据元数据生成: package={}", name);
        return basicReadme(name, info);
    }

    /**
     * URL 字段可能包含多个逗号分隔的地址，取其中的 GitHub 仓库
     */
    private String fetchProjectReadme(String urls) {
        for (String url : urls.split(",")) {
            Matcher matcher = GITHUB_REPOSITORY.matcher(url.trim());
            if (!matcher.find()) {
                continue;
            }

            String owner = matcher.group(1);
            String repository = matcher.group(2).replaceAll("\\.git$", "");
            try {
                String readme = registryClient.fetchGithubReadme(owner, repository);
                if (readme != null) {
                    return readme;
                }
            } catch (RegistryLookupException e) {
                log.warn("获取项目 README 失败，继续尝试其它来源: url={}, reason={}", url.trim(), e.getReason());
            }
        }
        return null;
    }

    private static String basicReadme(String name, Map<String, Object> info) {
        return "# " + name + ": " + stringValue(info.get("Title")) + "\n\n"
                + stringValue(info.get("Description")) + "\n\n"
                + "## Installation\n\n"
                + "You can install the released version of " + name
                + " from [CRAN](https://CRAN.R-project.org) with:\n\n"
                + "```r\ninstall.packages(\"" + name + "\")\n```\n\n"
                + "## Usage\n\n"
                + "```r\nlibrary(" + name + ")\n```\n\n"
                + "## Version\n\n"
                + "Current version: " + stringValue(info.get("Version")) + "\n";
    }

    /**
     * 按包名或标题搜索
     *
     * @param query 搜索词
     * @param limit 返回条数，为空时使用默认值
     * @return 匹配的包，按匹配程度排序
     */
    public List<Map<String, Object>> searchPackages(String query, Integer limit) {
        String trimmed = requireText(query, "query").trim();
        int resolvedLimit = resolveLimit(limit);

        return cacheEngine.getOrLoad(CacheKeys.searchResults(trimmed, resolvedLimit), properties.getSearchTtlMillis(), () -> {
            List<Map<String, Object>> results = filterIndex(trimmed, resolvedLimit);
            log.info("搜索完成: query={}, limit={}, found={}", trimmed, resolvedLimit, results.size());
            return results;
        });
    }

    private Map<String, Object> loadPackageIndex() {
        Map<String, Object> index = cacheEngine.getOrLoad(CacheKeys.packageList(), properties.getPackageIndexTtlMillis(), () -> {
            log.info("回源加载全量包索引");
            return registryClient.fetchPackageIndex();
        });
        return index == null ? Collections.emptyMap() : index;
    }

    private List<Map<String, Object>> filterIndex(String query, int limit) {
        String needle = query.toLowerCase(Locale.ROOT);
        List<Match> matches = new ArrayList<>();

        for (Map.Entry<String, Object> entry : loadPackageIndex().entrySet()) {
            String name = entry.getKey();
            Map<?, ?> description = entry.getValue() instanceof Map ? (Map<?, ?>) entry.getValue() : Collections.emptyMap();
            String title = stringValue(description.get("title"));

            int rank = rank(name.toLowerCase(Locale.ROOT), title.toLowerCase(Locale.ROOT), needle);
            if (rank >= 0) {
                matches.add(new Match(rank, name, stringValue(description.get("version")), title));
            }
        }

        matches.sort(Comparator.comparingInt((Match m) -> m.rank).thenComparing(m -> m.name));

        List<Map<String, Object>> results = new ArrayList<>();
        for (Match match : matches.subList(0, Math.min(limit, matches.size()))) {
            results.add(match.toResult());
        }
        return results;
    }

    /**
     * 匹配等级：0 包名完全相同，1 包名前缀，2 包名包含，3 标题包含，-1 不匹配
     */
    private static int rank(String name, String title, String needle) {
        if (name.equals(needle)) {
            return 0;
        }
        if (name.startsWith(needle)) {
            return 1;
        }
        if (name.contains(needle)) {
            return 2;
        }
        if (title.contains(needle)) {
            return 3;
        }
        return -1;
    }

    private int resolveLimit(Integer limit) {
        if (limit == null) {
            return properties.getDefaultSearchLimit();
        }
        return Math.max(1, Math.min(limit, properties.getMaxSearchLimit()));
    }

    private static String requireText(String value, String parameter) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(parameter + " must not be blank");
        }
        return value.trim();
    }

    private static String stringValue(Object value) {
        return value == null ? "" : value.toString();
    }

    private static class Match {
        private final int rank;
        private final String name;
        private final String version;
        private final String title;

        Match(int rank, String name, String version, String title) {
            this.rank = rank;
            this.name = name;
            this.version = version;
            this.title = title;
        }

        Map<String, Object> toResult() {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("name", name);
            result.put("version", version);
            result.put("title", title);
            return result;
        }
    }
}
