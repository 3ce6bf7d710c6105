package cn.bafuka.recall.dataplane.impl;

import cn.bafuka.recall.core.CacheEntry;
import cn.bafuka.recall.dataplane.EvictionPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 按创建时间驱逐
 * 保留最新创建的 maxEntries 条，命中次数和访问时间不参与排序（不是 LRU）
 */
@Slf4j
public class RecencyEvictionPolicy implements EvictionPolicy {

    private static final Comparator<Map.Entry<String, CacheEntry>> NEWEST_FIRST =
            Comparator.comparingDouble((Map.Entry<String, CacheEntry> e) -> e.getValue().getCreatedAt()).reversed();

    @Override
    public Map<String, CacheEntry> evict(Map<String, CacheEntry> entries, int maxEntries) {
        if (entries.size() <= maxEntries) {
            return entries;
        }

        // List.sort 是稳定排序，createdAt 相同时保持原有顺序
        List<Map.Entry<String, CacheEntry>> sorted = new ArrayList<>(entries.entrySet());
        sorted.sort(NEWEST_FIRST);

        Set<String> retained = new HashSet<>();
        for (int i = 0; i < maxEntries; i++) {
            retained.add(sorted.get(i).getKey());
        }

        Map<String, CacheEntry> result = new LinkedHashMap<>();
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (retained.contains(e.getKey())) {
                result.put(e.getKey(), e.getValue());
            }
        }

        log.debug("驱逐条目: before={}, after={}, maxEntries={}", entries.size(), result.size(), maxEntries);
        return result;
    }
}
