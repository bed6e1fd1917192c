package cn.bafuka.cranlens.core;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * 缓存键构造工具
 * 每类查询使用固定前缀；可能包含分隔符的参数（搜索词）先做 Base64 编码
 */
public final class CacheKeys {

    public static final String LATEST_VERSION = "latest";

    private CacheKeys() {
    }

    public static String packageInfo(String packageName) {
        return "pkg_info:" + packageName;
    }

    public static String packageReadme(String packageName) {
        return packageReadme(packageName, LATEST_VERSION);
    }

    public static String packageReadme(String packageName, String version) {
        String resolved = version == null || version.isEmpty() ? LATEST_VERSION : version;
        return "pkg_readme:" + packageName + ":" + resolved;
    }

    public static String searchResults(String query, int limit) {
        String encoded = Base64.getEncoder().encodeToString(query.getBytes(StandardCharsets.UTF_8));
        return "search:" + encoded + ":" + limit;
    }

    public static String packageList() {
        return "pkg_list:all";
    }
}
