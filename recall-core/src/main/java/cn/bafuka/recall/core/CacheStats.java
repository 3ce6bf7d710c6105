package cn.bafuka.recall.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存统计信息
 * 与条目一起持久化，进程重启后继续累加
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long hits;
    private long misses;
    private long saves;

    public void recordHit() {
        hits++;
    }

    public void recordMiss() {
        misses++;
    }

    public void recordSave() {
        saves++;
    }

    /**
     * 计算命中率
     *
     * @return 命中率（0.0 ~ 1.0），尚无请求时为 0.0
     */
    public double hitRate() {
        long requestCount = hits + misses;
        return requestCount == 0 ? 0.0 : (double) hits / requestCount;
    }

    /**
     * 拷贝当前计数，避免调用方修改内部状态
     */
    public CacheStats copy() {
        return new CacheStats(hits, misses, saves);
    }
}
