package cn.bafuka.recall.dataplane;

import cn.bafuka.recall.core.CacheEntry;

/**
 * 过期策略接口
 */
public interface TtlPolicy {

    /**
     * 判断条目在给定时间点是否仍然有效
     *
     * @param entry      缓存条目
     * @param nowSeconds 当前时间（Unix 秒）
     * @param ttlSeconds 存活时间（秒）
     * @return true 表示有效
     */
    boolean isValid(CacheEntry entry, double nowSeconds, long ttlSeconds);
}
