package cn.bafuka.recall.config;

import cn.bafuka.recall.model.CacheDefinition;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recall 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "recall")
public class RecallProperties {

    /**
     * 是否启用 Recall
     */
    private boolean enabled = true;

    /**
     * 快照目录，未显式指定 storagePath 的缓存写到 {@code <storageDir>/<name>.json}
     */
    private String storageDir = Paths.get(System.getProperty("user.home"), ".recall", "cache").toString();

    /**
     * 是否注册内置的 exploration / research 缓存
     */
    private boolean registerPresets = true;

    /**
     * 缓存定义列表，同名定义覆盖内置定义
     */
    private List<CacheDefinition> caches = new ArrayList<>();

    /**
     * 合并内置定义与配置定义，并补全快照路径
     *
     * @return 最终生效的定义列表
     */
    public List<CacheDefinition> resolveDefinitions() {
        Path dir = Paths.get(storageDir);
        Map<String, CacheDefinition> resolved = new LinkedHashMap<>();

        if (registerPresets) {
            resolved.put(CacheDefinition.EXPLORATION, CacheDefinition.exploration(dir));
            resolved.put(CacheDefinition.RESEARCH, CacheDefinition.research(dir));
        }

        if (caches != null) {
            for (CacheDefinition definition : caches) {
                if (definition == null) {
                    continue;
                }
                if (!StringUtils.hasText(definition.getStoragePath()) && StringUtils.hasText(definition.getName())) {
                    definition.setStoragePath(dir.resolve(definition.getName() + ".json").toString());
                }
                resolved.put(definition.getName(), definition);
            }
        }

        return new ArrayList<>(resolved.values());
    }
}
