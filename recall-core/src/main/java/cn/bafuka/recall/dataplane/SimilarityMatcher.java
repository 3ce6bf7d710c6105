package cn.bafuka.recall.dataplane;

import cn.bafuka.recall.core.CacheMatch;
import cn.bafuka.recall.core.CacheStore;
import cn.bafuka.recall.model.CacheDefinition;

import java.util.Optional;

/**
 * 相似度匹配器接口
 * 先按指纹精确匹配，再在同一作用域内做近似匹配
 */
public interface SimilarityMatcher {

    /**
     * 查找最佳匹配
     *
     * @param query      查询文本
     * @param scope      作用域
     * @param store      当前快照
     * @param nowSeconds 当前时间（Unix 秒），用于过期判断
     * @param definition 缓存定义（提供 TTL、阈值、是否模糊匹配）
     * @return 命中结果，未命中返回 empty
     */
    Optional<CacheMatch> findMatch(String query, String scope, CacheStore store,
                                   double nowSeconds, CacheDefinition definition);
}
