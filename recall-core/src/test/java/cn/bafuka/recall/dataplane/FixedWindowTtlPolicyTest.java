package cn.bafuka.recall.dataplane;

import cn.bafuka.recall.core.CacheEntry;
import cn.bafuka.recall.dataplane.impl.FixedWindowTtlPolicy;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * FixedWindowTtlPolicy 单元测试
 */
public class FixedWindowTtlPolicyTest {

    private static final double NOW = 1_700_000_000.0;
    private static final long TTL = 3600;

    private final FixedWindowTtlPolicy ttlPolicy = new FixedWindowTtlPolicy();

    @Test
    public void testFreshEntryIsValid() {
        assertTrue(ttlPolicy.isValid(entryCreatedAt(NOW), NOW, TTL));
    }

    /**
     * 测试边界：年龄等于 TTL 即视为过期
     */
    @Test
    public void testBoundary() {
        assertTrue(ttlPolicy.isValid(entryCreatedAt(NOW - TTL + 1), NOW, TTL));
        assertFalse(ttlPolicy.isValid(entryCreatedAt(NOW - TTL), NOW, TTL));
        assertFalse(ttlPolicy.isValid(entryCreatedAt(NOW - TTL - 1), NOW, TTL));
    }

    @Test
    public void testNullEntry() {
        assertFalse(ttlPolicy.isValid(null, NOW, TTL));
    }

    private static CacheEntry entryCreatedAt(double createdAt) {
        return CacheEntry.builder().query("q").scope("/p").createdAt(createdAt).build();
    }
}
