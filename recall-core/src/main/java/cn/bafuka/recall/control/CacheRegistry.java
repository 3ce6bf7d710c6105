package cn.bafuka.recall.control;

import cn.bafuka.recall.core.CacheService;
import cn.bafuka.recall.model.CacheDefinition;

import java.util.List;

/**
 * 缓存注册表接口
 * 按名称持有相互独立的缓存实例，每个实例的配置和故障彼此隔离
 */
public interface CacheRegistry {

    /**
     * 批量加载缓存定义，不合法的定义会被跳过
     *
     * @param definitions 定义列表
     */
    void loadDefinitions(List<CacheDefinition> definitions);

    /**
     * 注册单个缓存，同名实例会被替换
     *
     * @param definition 缓存定义
     * @return 新建的缓存实例
     */
    CacheService register(CacheDefinition definition);

    /**
     * 根据名称获取缓存
     *
     * @param name 缓存名称
     * @return 缓存实例，不存在返回 null
     */
    CacheService getCache(String name);

    /**
     * 获取所有缓存实例
     */
    List<CacheService> getAllCaches();

    /**
     * 移除缓存实例（快照文件保留）
     *
     * @param name 缓存名称
     */
    void remove(String name);
}
