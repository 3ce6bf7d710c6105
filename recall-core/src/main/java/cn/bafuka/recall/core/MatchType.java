package cn.bafuka.recall.core;

/**
 * 命中方式
 */
public enum MatchType {

    /**
     * 指纹完全一致
     */
    EXACT,

    /**
     * 同作用域内的词集重叠匹配
     */
    FUZZY
}
