package cn.bafuka.recall.dataplane.impl;

import cn.bafuka.recall.core.CacheEntry;
import cn.bafuka.recall.dataplane.TtlPolicy;

/**
 * 固定时间窗口过期策略
 * 条目有效当且仅当 now - createdAt < ttl
 */
public class FixedWindowTtlPolicy implements TtlPolicy {

    @Override
    public boolean isValid(CacheEntry entry, double nowSeconds, long ttlSeconds) {
        if (entry == null) {
            return false;
        }
        return entry.ageSeconds(nowSeconds) < ttlSeconds;
    }
}
