package cn.bafuka.cranlens.example.controller;

import cn.bafuka.cranlens.core.CacheKeys;
import cn.bafuka.cranlens.example.service.PackageLookupService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * R 包查询控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/packages")
public class PackageController {

    private final PackageLookupService packageLookupService;

    public PackageController(PackageLookupService packageLookupService) {
        this.packageLookupService = packageLookupService;
    }

    /**
     * 搜索包
     */
    @GetMapping("/search")
    public Map<String, Object> searchPackages(@RequestParam("q") String query,
                                              @RequestParam(value = "limit", required = false) Integer limit) {
        List<Map<String, Object>> packages = packageLookupService.searchPackages(query, limit);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("query", query.trim());
        result.put("total", packages.size());
        result.put("data", packages);
        return result;
    }

    /**
     * 查询包信息
     */
    @GetMapping("/{name}")
    public Map<String, Object> getPackageInfo(@PathVariable String name) {
        Map<String, Object> info = packageLookupService.getPackageInfo(name);
        Map<String, Object> result = new HashMap<>();
        if (info == null) {
            result.put("success", false);
            result.put("message", "未找到包: " + name);
            return result;
        }

        result.put("success", true);
        result.put("data", info);
        return result;
    }

    /**
     * 查询包的 README
     */
    @GetMapping("/{name}/readme")
    public Map<String, Object> getPackageReadme(@PathVariable String name,
                                                @RequestParam(value = "version", required = false) String version) {
        String readme = packageLookupService.getPackageReadme(name, version);
        Map<String, Object> result = new HashMap<>();
        result.put("package", name);
        result.put("version", version == null || version.trim().isEmpty() ? CacheKeys.LATEST_VERSION : version.trim());
        if (readme == null) {
            result.put("success", false);
            result.put("message", "未找到包: " + name);
            return result;
        }

        result.put("success", true);
        result.put("data", readme);
        return result;
    }
}
