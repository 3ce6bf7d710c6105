package cn.bafuka.recall.dataplane;

import cn.bafuka.recall.core.CacheEntry;

import java.util.Map;

/**
 * 驱逐策略接口
 * 将条目数量限制在上限以内
 */
public interface EvictionPolicy {

    /**
     * 执行驱逐
     *
     * @param entries    当前条目（指纹 -> 条目）
     * @param maxEntries 最大条目数
     * @return 驱逐后的条目，未超限时原样返回
     */
    Map<String, CacheEntry> evict(Map<String, CacheEntry> entries, int maxEntries);
}
