package cn.bafuka.recall.model;

import cn.bafuka.recall.exception.RecallConfigException;
import cn.bafuka.recall.exception.RecallConfigException.ConfigFailureReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 缓存实例定义
 * 每个逻辑缓存（探索结果、网页抓取结果等）对应一个独立定义，构建后不再修改
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheDefinition {

    public static final String EXPLORATION = "exploration";
    public static final String RESEARCH = "research";

    /**
     * 缓存名称（唯一标识）
     */
    private String name;

    /**
     * 存活时间（秒）
     */
    @Builder.Default
    private long ttlSeconds = 3600;

    /**
     * 最大条目数
     */
    @Builder.Default
    private int maxEntries = 30;

    /**
     * 可缓存结果的最大长度，超过则不缓存
     */
    @Builder.Default
    private int maxContentSize = 50000;

    /**
     * 模糊匹配阈值（严格大于才命中）
     */
    @Builder.Default
    private double similarityThreshold = 0.6;

    /**
     * 是否启用模糊匹配
     */
    @Builder.Default
    private boolean fuzzyMatch = true;

    /**
     * 查询文本保存长度
     */
    @Builder.Default
    private int maxQueryLength = 100;

    /**
     * 结果保存长度
     */
    @Builder.Default
    private int maxResultLength = 500;

    /**
     * 结果被截断时追加的后缀
     */
    @Builder.Default
    private String truncationSuffix = "";

    /**
     * 模糊匹配最多扫描的候选数（按创建时间取最新），0 表示不限
     */
    @Builder.Default
    private int maxFuzzyCandidates = 0;

    /**
     * 快照文件路径
     */
    private String storagePath;

    /**
     * 文件锁等待时间（毫秒）
     */
    @Builder.Default
    private long lockTimeoutMs = 2000;

    /**
     * 探索结果缓存：1 小时，模糊匹配，结果大小不设上限（截断后保存）
     *
     * @param storageDir 快照目录
     * @return 缓存定义
     */
    public static CacheDefinition exploration(Path storageDir) {
        return CacheDefinition.builder()
                .name(EXPLORATION)
                .ttlSeconds(3600)
                .maxEntries(30)
                .fuzzyMatch(true)
                .similarityThreshold(0.6)
                .maxFuzzyCandidates(30)
                .maxContentSize(Integer.MAX_VALUE)
                .maxQueryLength(100)
                .maxResultLength(500)
                .truncationSuffix("...")
                .storagePath(storageDir.resolve(EXPLORATION + ".json").toString())
                .build();
    }

    /**
     * 网页抓取结果缓存：24 小时，仅精确匹配
     *
     * @param storageDir 快照目录
     * @return 缓存定义
     */
    public static CacheDefinition research(Path storageDir) {
        return CacheDefinition.builder()
                .name(RESEARCH)
                .ttlSeconds(86400)
                .maxEntries(100)
                .fuzzyMatch(false)
                .maxContentSize(50000)
                .maxQueryLength(2000)
                .maxResultLength(2000)
                .storagePath(storageDir.resolve(RESEARCH + ".json").toString())
                .build();
    }

    /**
     * 拷贝一份定义，缓存实例持有的配置不受外部修改影响
     */
    public CacheDefinition copy() {
        return toBuilder().build();
    }

    public Path storageFile() {
        return Paths.get(storagePath);
    }

    /**
     * 校验定义，不合法时抛出 {@link RecallConfigException}
     */
    public void validate() {
        if (name == null || name.trim().isEmpty()) {
            throw new RecallConfigException("Cache name must not be blank", name, ConfigFailureReason.MISSING_NAME);
        }
        if (storagePath == null || storagePath.trim().isEmpty()) {
            throw new RecallConfigException("Storage path must not be blank: cache=" + name,
                    name, ConfigFailureReason.MISSING_STORAGE_PATH);
        }
        requirePositive(ttlSeconds, "ttlSeconds");
        requirePositive(maxEntries, "maxEntries");
        requirePositive(maxContentSize, "maxContentSize");
        requirePositive(maxQueryLength, "maxQueryLength");
        requirePositive(maxResultLength, "maxResultLength");
        if (maxFuzzyCandidates < 0) {
            throw outOfRange("maxFuzzyCandidates", maxFuzzyCandidates);
        }
        if (lockTimeoutMs < 0) {
            throw outOfRange("lockTimeoutMs", lockTimeoutMs);
        }
        if (Double.isNaN(similarityThreshold) || similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw outOfRange("similarityThreshold", similarityThreshold);
        }
    }

    private void requirePositive(long value, String field) {
        if (value <= 0) {
            throw outOfRange(field, value);
        }
    }

    private RecallConfigException outOfRange(String field, Object value) {
        return new RecallConfigException(
                String.format("Invalid %s=%s for cache %s", field, value, name),
                name, ConfigFailureReason.OUT_OF_RANGE);
    }
}
