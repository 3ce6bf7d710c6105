package cn.bafuka.recall.dataplane.impl;

import cn.bafuka.recall.core.CacheEntry;
import cn.bafuka.recall.core.CacheMatch;
import cn.bafuka.recall.core.CacheStore;
import cn.bafuka.recall.dataplane.KeyHasher;
import cn.bafuka.recall.dataplane.SimilarityMatcher;
import cn.bafuka.recall.dataplane.TtlPolicy;
import cn.bafuka.recall.model.CacheDefinition;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 基于词集 Jaccard 系数的相似度匹配器
 *
 * <ol>
 *     <li>精确匹配：指纹存在、作用域一致且未过期</li>
 *     <li>模糊匹配：同作用域、未过期的候选中，|交集| / |并集| 最高且严格大于阈值者胜出，得分相同先出现者优先</li>
 * </ol>
 *
 * 分词结果用 Caffeine 做有界缓存，同一批候选在连续查找中不会重复分词
 */
@Slf4j
public class JaccardSimilarityMatcher implements SimilarityMatcher {

    private static final int TOKEN_CACHE_SIZE = 1024;

    /**
     * 任意 Unicode 空白，包括全角空格
     */
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final KeyHasher keyHasher;

    private final TtlPolicy ttlPolicy;

    /**
     * Key: 原始文本
     * Value: 小写后按空白切分的词集
     */
    private final LoadingCache<String, Set<String>> tokenCache;

    public JaccardSimilarityMatcher(KeyHasher keyHasher, TtlPolicy ttlPolicy) {
        this.keyHasher = keyHasher;
        this.ttlPolicy = ttlPolicy;
        this.tokenCache = Caffeine.newBuilder()
                .maximumSize(TOKEN_CACHE_SIZE)
                .build(JaccardSimilarityMatcher::tokenize);
    }

    @Override
    public Optional<CacheMatch> findMatch(String query, String scope, CacheStore store,
                                          double nowSeconds, CacheDefinition definition) {
        if (query == null || store == null || store.getEntries() == null) {
            return Optional.empty();
        }
        Map<String, CacheEntry> entries = store.getEntries();

        // 1. 精确匹配
        String key = keyHasher.fingerprint(query, scope);
        CacheEntry exact = entries.get(key);
        if (exact != null && isCandidate(exact, scope, nowSeconds, definition)) {
            log.debug("精确命中: cache={}, key={}", definition.getName(), key);
            return Optional.of(CacheMatch.exact(exact));
        }

        if (!definition.isFuzzyMatch()) {
            return Optional.empty();
        }

        // 2. 模糊匹配
        Set<String> queryTokens = tokensOf(query);
        if (queryTokens.isEmpty()) {
            return Optional.empty();
        }

        CacheEntry best = null;
        double bestScore = 0.0;
        for (CacheEntry candidate : candidates(entries, scope, nowSeconds, definition)) {
            double score = jaccard(queryTokens, tokensOf(candidate.getQuery()));
            if (score > definition.getSimilarityThreshold() && score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        log.debug("模糊命中: cache={}, key={}, score={}", definition.getName(), best.getKey(), bestScore);
        return Optional.of(CacheMatch.fuzzy(best, bestScore));
    }

    /**
     * 计算两个词集的 Jaccard 系数
     * 并集为空时没有定义，按 0 处理
     *
     * @param left  词集
     * @param right 词集
     * @return 0.0 ~ 1.0
     */
    public static double jaccard(Set<String> left, Set<String> right) {
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        return (double) intersection.size() / union.size();
    }

    /**
     * 小写后按 Unicode 空白切分
     *
     * @param text 文本
     * @return 不可变词集，空文本返回空集
     */
    public static Set<String> tokenize(String text) {
        if (text == null) {
            return Collections.emptySet();
        }
        String normalized = StringUtils.trimWhitespace(text.toLowerCase(Locale.ROOT));
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(normalized)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens.isEmpty() ? Collections.<String>emptySet() : Collections.unmodifiableSet(tokens);
    }

    private Set<String> tokensOf(String text) {
        if (text == null) {
            return Collections.emptySet();
        }
        return tokenCache.get(text);
    }

    private boolean isCandidate(CacheEntry entry, String scope, double nowSeconds, CacheDefinition definition) {
        return entry != null
                && scope != null
                && scope.equals(entry.getScope())
                && ttlPolicy.isValid(entry, nowSeconds, definition.getTtlSeconds());
    }

    /**
     * 收集同作用域、未过期的候选，保持快照中的顺序
     * 超过 maxFuzzyCandidates 时只保留最新创建的若干条
     */
    private List<CacheEntry> candidates(Map<String, CacheEntry> entries, String scope,
                                        double nowSeconds, CacheDefinition definition) {
        List<CacheEntry> candidates = new ArrayList<>();
        for (CacheEntry entry : entries.values()) {
            if (isCandidate(entry, scope, nowSeconds, definition)) {
                candidates.add(entry);
            }
        }

        int limit = definition.getMaxFuzzyCandidates();
        if (limit <= 0 || candidates.size() <= limit) {
            return candidates;
        }

        List<CacheEntry> newest = new ArrayList<>(candidates);
        newest.sort(Comparator.comparingDouble(CacheEntry::getCreatedAt).reversed());
        Set<CacheEntry> retained = Collections.newSetFromMap(new IdentityHashMap<>());
        retained.addAll(newest.subList(0, limit));

        List<CacheEntry> limited = new ArrayList<>(limit);
        for (CacheEntry candidate : candidates) {
            if (retained.contains(candidate)) {
                limited.add(candidate);
            }
        }
        return limited;
    }
}
