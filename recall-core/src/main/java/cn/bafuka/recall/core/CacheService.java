package cn.bafuka.recall.core;

import cn.bafuka.recall.model.CacheDefinition;

import java.util.Optional;

/**
 * 结果缓存核心接口
 * 每个实例对应一个独立的逻辑缓存（独立配置、独立快照文件），所有方法都不会因持久化失败而抛出异常
 */
public interface CacheService {

    /**
     * 查找缓存
     * 先精确匹配再模糊匹配，命中与否都会累加统计并写回快照
     *
     * @param query 查询文本
     * @param scope 作用域
     * @return 命中结果，未命中返回 empty
     */
    Optional<CacheMatch> lookup(String query, String scope);

    /**
     * 查找缓存，仅返回结果文本
     *
     * @param query 查询文本
     * @param scope 作用域
     * @return 缓存的结果文本
     */
    Optional<String> lookupResult(String query, String scope);

    /**
     * 写入缓存
     * 结果长度超过 maxContentSize 时直接忽略
     *
     * @param query  查询文本
     * @param scope  作用域
     * @param result 结果文本
     */
    void store(String query, String scope, String result);

    /**
     * 删除单个条目
     *
     * @param query 查询文本
     * @param scope 作用域
     */
    void invalidate(String query, String scope);

    /**
     * 清空所有条目，统计保留
     */
    void invalidateAll();

    /**
     * 获取统计信息
     *
     * @return 统计信息副本
     */
    CacheStats getStats();

    /**
     * 当前有效条目数
     */
    int size();

    /**
     * 获取缓存定义（副本，修改不影响当前实例）
     */
    CacheDefinition getDefinition();
}
