package cn.bafuka.recall.control;

import cn.bafuka.recall.control.impl.DefaultCacheRegistry;
import cn.bafuka.recall.core.CacheService;
import cn.bafuka.recall.exception.RecallConfigException;
import cn.bafuka.recall.model.CacheDefinition;
import cn.bafuka.recall.support.MutableClock;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * DefaultCacheRegistry 单元测试
 */
public class DefaultCacheRegistryTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private DefaultCacheRegistry registry;

    private Path dir;

    @Before
    public void setUp() {
        dir = temporaryFolder.getRoot().toPath();
        registry = new DefaultCacheRegistry(MutableClock.atEpochSeconds(1_700_000_000L));
    }

    /**
     * 测试批量加载：不合法的定义被跳过，其余正常注册
     */
    @Test
    public void testLoadDefinitions_SkipsInvalid() {
        CacheDefinition invalid = CacheDefinition.builder()
                .name("broken")
                .ttlSeconds(-1)
                .storagePath(dir.resolve("broken.json").toString())
                .build();

        registry.loadDefinitions(Arrays.asList(
                CacheDefinition.exploration(dir), invalid, CacheDefinition.research(dir)));

        assertNotNull(registry.getCache(CacheDefinition.EXPLORATION));
        assertNotNull(registry.getCache(CacheDefinition.RESEARCH));
        assertNull(registry.getCache("broken"));
        assertEquals(2, registry.getAllCaches().size());
    }

    /**
     * 测试实例彼此隔离
     */
    @Test
    public void testCachesAreIndependent() {
        registry.loadDefinitions(Arrays.asList(CacheDefinition.exploration(dir), CacheDefinition.research(dir)));
        CacheService exploration = registry.getCache(CacheDefinition.EXPLORATION);
        CacheService research = registry.getCache(CacheDefinition.RESEARCH);

        exploration.store("find config files", "/p", "Found 5 files");

        assertTrue(exploration.lookup("find config files", "/p").isPresent());
        assertFalse(research.lookup("find config files", "/p").isPresent());
        assertEquals(0, research.size());
    }

    /**
     * 测试同名注册替换旧实例
     */
    @Test
    public void testRegister_Replaces() {
        CacheService first = registry.register(CacheDefinition.exploration(dir));
        CacheService second = registry.register(CacheDefinition.exploration(dir));

        assertNotSame(first, second);
        assertSame(second, registry.getCache(CacheDefinition.EXPLORATION));
        assertEquals(1, registry.getAllCaches().size());
    }

    @Test(expected = RecallConfigException.class)
    public void testRegister_Invalid() {
        registry.register(CacheDefinition.builder().name("no-path").build());
    }

    @Test
    public void testRemove() {
        registry.register(CacheDefinition.exploration(dir));

        registry.remove(CacheDefinition.EXPLORATION);
        registry.remove("missing");

        assertNull(registry.getCache(CacheDefinition.EXPLORATION));
        assertNull(registry.getCache(null));
    }
}
