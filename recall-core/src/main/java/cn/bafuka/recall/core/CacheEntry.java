package cn.bafuka.recall.core;

import com.alibaba.fastjson.annotation.JSONField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存条目
 * 快照中以指纹为键保存，指纹本身不写入条目内容
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    /**
     * 指纹（由 query + scope 计算），加载快照时回填
     */
    @JSONField(serialize = false, deserialize = false)
    private String key;

    /**
     * 原始查询文本（已截断）
     */
    @JSONField(name = "query", alternateNames = {"prompt"}, ordinal = 1)
    private String query;

    /**
     * 结果摘要（已截断）
     */
    @JSONField(name = "result", alternateNames = {"summary"}, ordinal = 2)
    private String result;

    /**
     * 作用域（工作目录、URL 等），精确字符串比较
     */
    @JSONField(name = "scope", alternateNames = {"cwd"}, ordinal = 3)
    private String scope;

    /**
     * 创建时间（Unix 秒，含小数部分）
     */
    @JSONField(name = "createdAt", alternateNames = {"timestamp"}, ordinal = 4)
    private double createdAt;

    /**
     * 命中次数，仅用于观测
     */
    @JSONField(ordinal = 5)
    private long hitCount;

    /**
     * 记录一次命中
     */
    public void recordHit() {
        hitCount++;
    }

    /**
     * 计算条目年龄
     *
     * @param nowSeconds 当前时间（Unix 秒）
     * @return 年龄（秒）
     */
    public double ageSeconds(double nowSeconds) {
        return nowSeconds - createdAt;
    }
}
