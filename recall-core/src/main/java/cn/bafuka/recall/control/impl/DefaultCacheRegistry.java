package cn.bafuka.recall.control.impl;

import cn.bafuka.recall.control.CacheRegistry;
import cn.bafuka.recall.core.CacheService;
import cn.bafuka.recall.core.impl.DefaultCacheService;
import cn.bafuka.recall.exception.RecallConfigException;
import cn.bafuka.recall.model.CacheDefinition;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 缓存注册表默认实现
 */
@Slf4j
public class DefaultCacheRegistry implements CacheRegistry {

    /**
     * Key: 缓存名称
     * Value: 缓存实例
     */
    private final Map<String, CacheService> cacheMap = new ConcurrentHashMap<>();

    private final Clock clock;

    public DefaultCacheRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void loadDefinitions(List<CacheDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            log.warn("No cache definitions to load");
            return;
        }

        log.info("开始加载 {} 个缓存定义...", definitions.size());

        int successCount = 0;
        int failureCount = 0;

        for (CacheDefinition definition : definitions) {
            try {
                register(definition);
                successCount++;
            } catch (RecallConfigException e) {
                failureCount++;
                log.error("缓存定义验证失败，跳过: cache={}, reason={}, error={}",
                        e.getCacheName(), e.getReason().getDescription(), e.getMessage());
            }
        }

        log.info("缓存定义加载完成: 成功={}, 失败={}", successCount, failureCount);
    }

    @Override
    public CacheService register(CacheDefinition definition) {
        if (definition == null) {
            throw new RecallConfigException("Cache definition must not be null", null,
                    RecallConfigException.ConfigFailureReason.MISSING_NAME);
        }
        CacheService service = DefaultCacheService.create(definition, clock);
        CacheService previous = cacheMap.put(definition.getName(), service);
        if (previous != null) {
            log.info("替换缓存实例: name={}", definition.getName());
        }
        return service;
    }

    @Override
    public CacheService getCache(String name) {
        if (name == null) {
            return null;
        }
        return cacheMap.get(name);
    }

    @Override
    public List<CacheService> getAllCaches() {
        return new ArrayList<>(cacheMap.values());
    }

    @Override
    public void remove(String name) {
        CacheService removed = cacheMap.remove(name);
        if (removed == null) {
            log.warn("Cache not found: {}", name);
            return;
        }
        log.info("移除缓存实例: name={}", name);
    }
}
