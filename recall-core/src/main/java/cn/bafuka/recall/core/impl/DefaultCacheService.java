package cn.bafuka.recall.core.impl;

import cn.bafuka.recall.core.CacheEntry;
import cn.bafuka.recall.core.CacheMatch;
import cn.bafuka.recall.core.CacheService;
import cn.bafuka.recall.core.CacheStats;
import cn.bafuka.recall.core.CacheStore;
import cn.bafuka.recall.dataplane.EntryStore;
import cn.bafuka.recall.dataplane.EvictionPolicy;
import cn.bafuka.recall.dataplane.KeyHasher;
import cn.bafuka.recall.dataplane.SimilarityMatcher;
import cn.bafuka.recall.dataplane.SnapshotLoadResult;
import cn.bafuka.recall.dataplane.SnapshotLock;
import cn.bafuka.recall.dataplane.TtlPolicy;
import cn.bafuka.recall.dataplane.impl.FixedWindowTtlPolicy;
import cn.bafuka.recall.dataplane.impl.JaccardSimilarityMatcher;
import cn.bafuka.recall.dataplane.impl.JsonFileEntryStore;
import cn.bafuka.recall.dataplane.impl.Md5KeyHasher;
import cn.bafuka.recall.dataplane.impl.RecencyEvictionPolicy;
import cn.bafuka.recall.model.CacheDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 结果缓存默认实现
 *
 * 每次调用都是一次完整的 load -> 修改 -> save 周期：
 * 进程内用 {@link ReentrantLock} 串行化，进程间用快照文件锁协作。
 * 过期与驱逐都在调用时同步、惰性地计算，没有后台线程。
 */
@Slf4j
public class DefaultCacheService implements CacheService {

    private final CacheDefinition definition;

    private final KeyHasher keyHasher;

    private final EntryStore entryStore;

    private final EvictionPolicy evictionPolicy;

    private final SimilarityMatcher similarityMatcher;

    private final Clock clock;

    private final ReentrantLock mutex = new ReentrantLock();

    public DefaultCacheService(CacheDefinition definition,
                               KeyHasher keyHasher,
                               EntryStore entryStore,
                               EvictionPolicy evictionPolicy,
                               SimilarityMatcher similarityMatcher,
                               Clock clock) {
        CacheDefinition fixed = definition.copy();
        fixed.validate();
        this.definition = fixed;
        this.keyHasher = keyHasher;
        this.entryStore = entryStore;
        this.evictionPolicy = evictionPolicy;
        this.similarityMatcher = similarityMatcher;
        this.clock = clock;
    }

    /**
     * 使用默认组件构建：MD5 指纹、JSON 文件快照、固定窗口过期、按创建时间驱逐、Jaccard 匹配
     *
     * @param source 缓存定义，构建时拷贝
     * @param clock  时钟
     * @return 缓存实例
     */
    public static DefaultCacheService create(CacheDefinition source, Clock clock) {
        CacheDefinition definition = source.copy();
        definition.validate();
        KeyHasher keyHasher = new Md5KeyHasher();
        TtlPolicy ttlPolicy = new FixedWindowTtlPolicy();
        EntryStore entryStore = new JsonFileEntryStore(
                definition.storageFile(),
                ttlPolicy,
                definition.getTtlSeconds(),
                definition.getLockTimeoutMs(),
                clock);

        log.info("构建缓存实例: name={}, ttlSeconds={}, maxEntries={}, fuzzyMatch={}, threshold={}, storagePath={}",
                definition.getName(), definition.getTtlSeconds(), definition.getMaxEntries(),
                definition.isFuzzyMatch(), definition.getSimilarityThreshold(), definition.getStoragePath());

        return new DefaultCacheService(
                definition,
                keyHasher,
                entryStore,
                new RecencyEvictionPolicy(),
                new JaccardSimilarityMatcher(keyHasher, ttlPolicy),
                clock);
    }

    @Override
    public Optional<CacheMatch> lookup(String query, String scope) {
        if (!StringUtils.hasText(query)) {
            return Optional.empty();
        }
        String normalizedScope = scopeOf(scope);

        return withSnapshot(store -> {
            Optional<CacheMatch> match = similarityMatcher.findMatch(
                    query, normalizedScope, store, nowSeconds(), definition);

            if (match.isPresent()) {
                match.get().getEntry().recordHit();
                store.getStats().recordHit();
                log.debug("缓存命中: cache={}, type={}, score={}, key={}", definition.getName(),
                        match.get().getMatchType(), match.get().getScore(), match.get().getEntry().getKey());
            } else {
                store.getStats().recordMiss();
                log.debug("缓存未命中: cache={}, scope={}", definition.getName(), normalizedScope);
            }

            // 未命中同样写回，统计在进程重启后保留
            entryStore.save(store);
            return match;
        });
    }

    @Override
    public Optional<String> lookupResult(String query, String scope) {
        return lookup(query, scope).map(match -> match.getEntry().getResult());
    }

    @Override
    public void store(String query, String scope, String result) {
        if (!StringUtils.hasText(query) || !StringUtils.hasLength(result)) {
            log.debug("跳过写入（查询或结果为空）: cache={}", definition.getName());
            return;
        }
        if (result.length() > definition.getMaxContentSize()) {
            log.debug("跳过写入（结果过大）: cache={}, size={}, maxContentSize={}",
                    definition.getName(), result.length(), definition.getMaxContentSize());
            return;
        }
        String normalizedScope = scopeOf(scope);

        withSnapshot(store -> {
            String key = keyHasher.fingerprint(query, normalizedScope);
            CacheEntry entry = CacheEntry.builder()
                    .key(key)
                    .query(truncate(query, definition.getMaxQueryLength(), ""))
                    .result(truncate(result, definition.getMaxResultLength(), definition.getTruncationSuffix()))
                    .scope(normalizedScope)
                    .createdAt(nowSeconds())
                    .hitCount(0)
                    .build();

            // 整体替换，不合并旧条目
            Map<String, CacheEntry> entries = store.getEntries();
            entries.remove(key);
            entries.put(key, entry);

            int before = entries.size();
            store.setEntries(evictionPolicy.evict(entries, definition.getMaxEntries()));
            int evicted = before - store.getEntries().size();

            store.getStats().recordSave();
            boolean saved = entryStore.save(store);
            log.debug("写入缓存: cache={}, key={}, evicted={}, persisted={}",
                    definition.getName(), key, evicted, saved);
            return null;
        });
    }

    @Override
    public void invalidate(String query, String scope) {
        if (query == null) {
            return;
        }
        String key = keyHasher.fingerprint(query, scopeOf(scope));
        withSnapshot(store -> {
            if (store.getEntries().remove(key) != null) {
                entryStore.save(store);
                log.debug("缓存失效: cache={}, key={}", definition.getName(), key);
            }
            return null;
        });
    }

    @Override
    public void invalidateAll() {
        withSnapshot(store -> {
            int removed = store.getEntries().size();
            store.getEntries().clear();
            entryStore.save(store);
            log.info("缓存全部失效: cache={}, removed={}", definition.getName(), removed);
            return null;
        });
    }

    @Override
    public CacheStats getStats() {
        return entryStore.load().getStore().getStats().copy();
    }

    @Override
    public int size() {
        return entryStore.load().getStore().getEntries().size();
    }

    @Override
    public CacheDefinition getDefinition() {
        return definition.copy();
    }

    /**
     * 在互斥区内加载快照并执行变更
     */
    private <T> T withSnapshot(Function<CacheStore, T> action) {
        mutex.lock();
        try (SnapshotLock ignored = entryStore.lock()) {
            SnapshotLoadResult loaded = entryStore.load();
            if (!loaded.isLoaded() && loaded.getStatus() != SnapshotLoadResult.Status.MISSING) {
                log.warn("快照不可用，按空缓存继续: cache={}, status={}", definition.getName(), loaded.getStatus());
            }
            return action.apply(loaded.getStore());
        } finally {
            mutex.unlock();
        }
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    private static String scopeOf(String scope) {
        return scope == null ? "" : scope;
    }

    private static String truncate(String text, int maxLength, String suffix) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + (suffix == null ? "" : suffix);
    }
}
