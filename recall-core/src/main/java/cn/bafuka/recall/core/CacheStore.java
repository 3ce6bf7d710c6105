package cn.bafuka.recall.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 缓存快照
 * 对应磁盘上的一个 JSON 文件：{"entries": {...}, "stats": {...}}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheStore {

    /**
     * Key: 指纹
     * Value: 缓存条目
     */
    private Map<String, CacheEntry> entries = new LinkedHashMap<>();

    private CacheStats stats = new CacheStats();

    /**
     * 创建空快照（统计清零）
     */
    public static CacheStore empty() {
        return new CacheStore(new LinkedHashMap<>(), new CacheStats());
    }
}
