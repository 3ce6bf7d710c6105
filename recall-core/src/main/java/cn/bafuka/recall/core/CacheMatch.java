package cn.bafuka.recall.core;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 一次查找的命中结果
 */
@Data
@AllArgsConstructor
public class CacheMatch {

    private CacheEntry entry;

    private MatchType matchType;

    /**
     * 相似度得分，精确命中时为 1.0
     */
    private double score;

    public static CacheMatch exact(CacheEntry entry) {
        return new CacheMatch(entry, MatchType.EXACT, 1.0);
    }

    public static CacheMatch fuzzy(CacheEntry entry, double score) {
        return new CacheMatch(entry, MatchType.FUZZY, score);
    }
}
