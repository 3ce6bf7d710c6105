package cn.bafuka.recall.autoconfigure;

import cn.bafuka.recall.aspect.RecallAspect;
import cn.bafuka.recall.aspect.RecallAspectHandler;
import cn.bafuka.recall.aspect.impl.DefaultRecallAspectHandler;
import cn.bafuka.recall.config.RecallProperties;
import cn.bafuka.recall.control.CacheRegistry;
import cn.bafuka.recall.control.impl.DefaultCacheRegistry;
import cn.bafuka.recall.spel.DefaultSpelExpressionParser;
import cn.bafuka.recall.spel.SpelExpressionParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.time.Clock;

/**
 * Recall 自动配置类
 */
@Slf4j
@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(RecallProperties.class)
@ConditionalOnProperty(prefix = "recall", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RecallAutoConfiguration {

    public RecallAutoConfiguration() {
        log.info("Recall auto-configuration initializing...");
    }

    /**
     * 时钟，测试中可替换
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock recallClock() {
        return Clock.systemUTC();
    }

    /**
     * SpEL 表达式解析器
     */
    @Bean
    @ConditionalOnMissingBean
    public SpelExpressionParser recallSpelExpressionParser() {
        return new DefaultSpelExpressionParser();
    }

    /**
     * 缓存注册表，按配置构建每个缓存实例
     */
    @Bean
    @ConditionalOnMissingBean
    public CacheRegistry cacheRegistry(RecallProperties properties, Clock clock) {
        DefaultCacheRegistry registry = new DefaultCacheRegistry(clock);
        registry.loadDefinitions(properties.resolveDefinitions());
        log.info("Recall initialized: storageDir={}, caches={}",
                properties.getStorageDir(), registry.getAllCaches().size());
        return registry;
    }

    /**
     * 切面处理器
     */
    @Bean
    @ConditionalOnMissingBean
    public RecallAspectHandler recallAspectHandler(CacheRegistry cacheRegistry) {
        return new DefaultRecallAspectHandler(cacheRegistry);
    }

    /**
     * AOP 切面
     */
    @Bean
    @ConditionalOnMissingBean
    public RecallAspect recallAspect(SpelExpressionParser spelParser, RecallAspectHandler aspectHandler) {
        return new RecallAspect(spelParser, aspectHandler);
    }
}
