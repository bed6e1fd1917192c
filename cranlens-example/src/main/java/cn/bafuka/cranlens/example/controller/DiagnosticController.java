package cn.bafuka.cranlens.example.controller;

import cn.bafuka.cranlens.core.CacheEngine;
import cn.bafuka.cranlens.core.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 诊断控制器
 * 用于查看和重置缓存的运行状态
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
public class DiagnosticController {

    private final CacheEngine cacheEngine;

    public DiagnosticController(CacheEngine cacheEngine) {
        this.cacheEngine = cacheEngine;
    }

    /**
     * 查看缓存统计
     */
    @GetMapping("/cache")
    public Map<String, Object> getCacheStats() {
        CacheStats stats = cacheEngine.getStats();

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("engine", cacheEngine.getClass().getSimpleName());
        result.put("stats", stats);
        result.put("usagePercent", stats.getMaxSize() == 0 ? 0.0 : stats.getMemoryUsage() * 100.0 / stats.getMaxSize());
        return result;
    }

    /**
     * 清空缓存
     */
    @DeleteMapping("/cache")
    public Map<String, Object> clearCache() {
        long size = cacheEngine.size();
        cacheEngine.clear();
        log.info("通过诊断接口清空缓存: removed={}", size);

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("removed", size);
        result.put("message", "缓存已清空");
        return result;
    }
}
