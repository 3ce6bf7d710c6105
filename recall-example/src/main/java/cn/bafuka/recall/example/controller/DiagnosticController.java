package cn.bafuka.recall.example.controller;

import cn.bafuka.recall.control.CacheRegistry;
import cn.bafuka.recall.core.CacheService;
import cn.bafuka.recall.core.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 诊断控制器
 * 用于查看各缓存实例的配置和统计
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
public class DiagnosticController {

    @Autowired
    private CacheRegistry cacheRegistry;

    /**
     * 查看所有缓存
     */
    @GetMapping("/caches")
    public Map<String, Object> getCaches() {
        List<Map<String, Object>> caches = cacheRegistry.getAllCaches().stream()
                .map(DiagnosticController::describe)
                .collect(Collectors.toList());

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("total", caches.size());
        result.put("caches", caches);
        return result;
    }

    /**
     * 查看单个缓存
     */
    @GetMapping("/cache")
    public Map<String, Object> getCache(String name) {
        Map<String, Object> result = new HashMap<>();
        CacheService cache = find(name, result);
        if (cache == null) {
            return result;
        }
        result.put("success", true);
        result.put("cache", describe(cache));
        return result;
    }

    /**
     * 清空单个缓存（统计保留）
     */
    @DeleteMapping("/cache")
    public Map<String, Object> resetCache(String name) {
        Map<String, Object> result = new HashMap<>();
        CacheService cache = find(name, result);
        if (cache == null) {
            return result;
        }
        cache.invalidateAll();
        log.info("通过诊断接口清空缓存: name={}", name);
        result.put("success", true);
        result.put("message", "缓存已清空: " + name);
        return result;
    }

    private CacheService find(String name, Map<String, Object> result) {
        if (name == null || name.isEmpty()) {
            result.put("success", false);
            result.put("message", "name 参数不能为空");
            return null;
        }
        CacheService cache = cacheRegistry.getCache(name);
        if (cache == null) {
            result.put("success", false);
            result.put("message", "未找到缓存: " + name);
        }
        return cache;
    }

    private static Map<String, Object> describe(CacheService cache) {
        CacheStats stats = cache.getStats();
        Map<String, Object> detail = new HashMap<>();
        detail.put("definition", cache.getDefinition());
        detail.put("size", cache.size());
        detail.put("hits", stats.getHits());
        detail.put("misses", stats.getMisses());
        detail.put("saves", stats.getSaves());
        detail.put("hitRate", String.format("%.2f%%", stats.hitRate() * 100));
        return detail;
    }
}
