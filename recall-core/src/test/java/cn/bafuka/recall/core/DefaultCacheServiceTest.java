package cn.bafuka.recall.core;

import cn.bafuka.recall.core.impl.DefaultCacheService;
import cn.bafuka.recall.model.CacheDefinition;
import cn.bafuka.recall.support.MutableClock;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.Assert.*;

/**
 * DefaultCacheService 单元测试
 * 基于真实快照文件与可控时钟
 */
public class DefaultCacheServiceTest {

    private static final long START = 1_700_000_000L;

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private MutableClock clock;

    private Path storageFile;

    private CacheDefinition definition;

    private DefaultCacheService cacheService;

    @Before
    public void setUp() {
        clock = MutableClock.atEpochSeconds(START);
        storageFile = temporaryFolder.getRoot().toPath().resolve("explorations.json");
        definition = CacheDefinition.builder()
                .name("exploration")
                .ttlSeconds(3600)
                .maxEntries(10)
                .maxContentSize(1000)
                .similarityThreshold(0.6)
                .fuzzyMatch(true)
                .maxQueryLength(100)
                .maxResultLength(500)
                .truncationSuffix("...")
                .storagePath(storageFile.toString())
                .lockTimeoutMs(500)
                .build();
        cacheService = DefaultCacheService.create(definition, clock);
    }

    /**
     * 测试写入后精确命中
     */
    @Test
    public void testStoreAndLookup() {
        cacheService.store("find config files", "/p", "Found 5 files");

        Optional<CacheMatch> match = cacheService.lookup("Find Config Files ", "/p");

        assertTrue(match.isPresent());
        assertEquals(MatchType.EXACT, match.get().getMatchType());
        assertEquals("Found 5 files", match.get().getEntry().getResult());
        assertEquals(Optional.of("Found 5 files"), cacheService.lookupResult("find config files", "/p"));
    }

    /**
     * 测试 TTL 边界
     */
    @Test
    public void testTtlBoundary() {
        cacheService.store("find config files", "/p", "Found 5 files");

        clock.advanceSeconds(3600 - 1);
        assertTrue(cacheService.lookup("find config files", "/p").isPresent());

        clock.advanceSeconds(2);
        assertFalse(cacheService.lookup("find config files", "/p").isPresent());
    }

    /**
     * 测试作用域隔离
     */
    @Test
    public void testScopeIsolation() {
        cacheService.store("find configs", "/project-a", "result");

        assertFalse(cacheService.lookup("find configs", "/project-b").isPresent());
        assertTrue(cacheService.lookup("find configs", "/project-a").isPresent());
    }

    /**
     * 测试模糊匹配阈值
     */
    @Test
    public void testFuzzyThreshold() {
        cacheService.store("find config files", "/p", "Found 5 files");

        Optional<CacheMatch> hit = cacheService.lookup("find config files quickly", "/p");
        assertTrue(hit.isPresent());
        assertEquals(MatchType.FUZZY, hit.get().getMatchType());

        assertFalse(cacheService.lookup("completely unrelated text", "/p").isPresent());
    }

    /**
     * 测试驱逐上限：保留最新创建的 K 条
     */
    @Test
    public void testEvictionBound() {
        definition.setMaxEntries(3);
        cacheService = DefaultCacheService.create(definition, clock);

        for (int i = 0; i < 6; i++) {
            cacheService.store("query number " + i, "/p", "result " + i);
            clock.advanceSeconds(1);
        }

        assertEquals(3, cacheService.size());
        for (int i = 0; i < 3; i++) {
            assertFalse(cacheService.lookup("query number " + i, "/p").isPresent());
        }
        for (int i = 3; i < 6; i++) {
            assertEquals(Optional.of("result " + i), cacheService.lookupResult("query number " + i, "/p"));
        }
    }

    /**
     * 测试结果过大时不写入
     */
    @Test
    public void testOversizedStoreIsNoop() {
        cacheService.store("small", "/p", "ok");
        int before = cacheService.size();
        long savesBefore = cacheService.getStats().getSaves();

        cacheService.store("big", "/p", repeat('x', 1001));

        assertEquals(before, cacheService.size());
        assertEquals(savesBefore, cacheService.getStats().getSaves());
        assertFalse(cacheService.lookup("big", "/p").isPresent());
    }

    /**
     * 测试恰好等于上限的结果可以写入
     */
    @Test
    public void testStoreAtMaxContentSize() {
        cacheService.store("exact size", "/p", repeat('x', 1000));

        assertEquals(1, cacheService.size());
    }

    /**
     * 测试查询与结果按配置截断
     */
    @Test
    public void testTruncation() {
        String longQuery = repeat('q', 150);
        cacheService.store(longQuery, "/p", repeat('r', 600));

        CacheEntry entry = cacheService.lookup(longQuery, "/p").get().getEntry();

        assertEquals(100, entry.getQuery().length());
        assertEquals(503, entry.getResult().length());
        assertTrue(entry.getResult().endsWith("..."));
    }

    /**
     * 测试空查询、空结果被忽略
     */
    @Test
    public void testBlankInputsIgnored() {
        cacheService.store("", "/p", "result");
        cacheService.store("query", "/p", "");
        cacheService.store("query", "/p", null);

        assertEquals(0, cacheService.size());
        assertFalse(cacheService.lookup("  ", "/p").isPresent());
        assertEquals(0, cacheService.getStats().getMisses());
    }

    /**
     * 测试统计：命中、未命中、写入，且跨实例保留
     */
    @Test
    public void testStatsPersisted() {
        cacheService.store("find config files", "/p", "Found 5 files");
        cacheService.lookup("find config files", "/p");
        cacheService.lookup("find config files", "/p");
        cacheService.lookup("something else entirely", "/p");

        DefaultCacheService reloaded = DefaultCacheService.create(definition, clock);
        CacheStats stats = reloaded.getStats();

        assertEquals(2, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getSaves());
        assertEquals(2.0 / 3, stats.hitRate(), 1e-9);
    }

    /**
     * 测试命中次数递增并持久化
     */
    @Test
    public void testHitCountIncrements() {
        cacheService.store("find config files", "/p", "Found 5 files");
        cacheService.lookup("find config files", "/p");
        cacheService.lookup("find config files", "/p");

        assertEquals(3, cacheService.lookup("find config files", "/p").get().getEntry().getHitCount());
    }

    /**
     * 测试覆盖写入：替换而非合并，命中次数与创建时间重置
     */
    @Test
    public void testStoreOverwrites() {
        cacheService.store("find config files", "/p", "first");
        cacheService.lookup("find config files", "/p");
        clock.advanceSeconds(10);

        cacheService.store("find config files", "/p", "second");
        CacheEntry entry = cacheService.lookup("find config files", "/p").get().getEntry();

        assertEquals(1, cacheService.size());
        assertEquals("second", entry.getResult());
        assertEquals(1, entry.getHitCount());
        assertEquals(START + 10, entry.getCreatedAt(), 0.001);
    }

    /**
     * 测试单条失效与全部失效
     */
    @Test
    public void testInvalidate() {
        cacheService.store("find config files", "/p", "Found 5 files");
        cacheService.store("search for auth", "/p", "Found auth.py");

        cacheService.invalidate("FIND CONFIG FILES", "/p");
        assertEquals(1, cacheService.size());
        assertFalse(cacheService.lookup("find config files", "/p").isPresent());

        cacheService.invalidateAll();
        assertEquals(0, cacheService.size());
        assertEquals(2, cacheService.getStats().getSaves());
    }

    /**
     * 测试快照损坏时按空缓存处理，随后写入可恢复
     */
    @Test
    public void testCorruptSnapshotRecovers() throws IOException {
        Files.write(storageFile, "not json at all".getBytes(StandardCharsets.UTF_8));

        assertFalse(cacheService.lookup("find config files", "/p").isPresent());

        cacheService.store("find config files", "/p", "Found 5 files");
        assertTrue(cacheService.lookup("find config files", "/p").isPresent());
    }

    /**
     * 测试存储不可用时查找与写入都不抛异常
     */
    @Test
    public void testUnusableStorage() throws IOException {
        Path blocker = temporaryFolder.newFile("blocker").toPath();
        definition.setStoragePath(blocker.resolve("cache.json").toString());
        DefaultCacheService broken = DefaultCacheService.create(definition, clock);

        broken.store("find config files", "/p", "Found 5 files");
        assertFalse(broken.lookup("find config files", "/p").isPresent());
        assertEquals(0, broken.size());
    }

    /**
     * 端到端场景：上限 2 条，最早的条目被驱逐后模糊查询未命中
     */
    @Test
    public void testEndToEndScenario() {
        definition.setMaxEntries(2);
        cacheService = DefaultCacheService.create(definition, clock);

        cacheService.store("find config files", "/p", "Found 5 files");
        clock.advanceSeconds(1);
        cacheService.store("search for auth", "/p", "Found auth.py");
        clock.advanceSeconds(1);
        cacheService.store("list all files", "/p", "Listed 10 files");

        assertEquals(2, cacheService.size());
        assertFalse(cacheService.lookup("find config files", "/p").isPresent());
        assertFalse(cacheService.lookup("find configuration files", "/p").isPresent());
        assertTrue(cacheService.lookup("search for auth", "/p").isPresent());
    }

    /**
     * 测试默认配置下模糊匹配扫描全部未过期候选
     */
    @Test
    public void testFuzzyScansAllLiveCandidates() {
        definition.setMaxEntries(50);
        cacheService = DefaultCacheService.create(definition, clock);

        cacheService.store("find config files", "/p", "Found 5 files");
        for (int i = 0; i < 30; i++) {
            clock.advanceSeconds(1);
            cacheService.store("filler entry " + i, "/p", "filler " + i);
        }

        assertEquals(31, cacheService.size());
        Optional<CacheMatch> match = cacheService.lookup("find config files quickly", "/p");
        assertTrue(match.isPresent());
        assertEquals("Found 5 files", match.get().getEntry().getResult());
    }

    /**
     * 测试构建后修改定义不影响缓存实例
     */
    @Test
    public void testDefinitionFixedAtConstruction() {
        cacheService.store("find config files", "/p", "Found 5 files");
        cacheService.store("search for auth", "/p", "Found auth.py");

        cacheService.getDefinition().setMaxEntries(0);
        definition.setMaxEntries(1);
        definition.setTtlSeconds(1);
        cacheService.store("list all files", "/p", "Listed 10 files");

        assertEquals(3, cacheService.size());
        assertEquals(10, cacheService.getDefinition().getMaxEntries());
        assertEquals(3600, cacheService.getDefinition().getTtlSeconds());
        clock.advanceSeconds(10);
        assertTrue(cacheService.lookup("find config files", "/p").isPresent());
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
