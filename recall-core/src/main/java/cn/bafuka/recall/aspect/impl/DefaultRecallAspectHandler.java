package cn.bafuka.recall.aspect.impl;

import cn.bafuka.recall.aspect.RecallAspectHandler;
import cn.bafuka.recall.control.CacheRegistry;
import cn.bafuka.recall.core.CacheService;
import cn.bafuka.recall.core.RecallContext;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;

import java.util.Optional;

/**
 * Recall 切面处理器默认实现
 * 缓存永远只是优化：找不到缓存实例或返回类型不兼容时直接执行原方法
 */
@Slf4j
public class DefaultRecallAspectHandler implements RecallAspectHandler {

    private final CacheRegistry cacheRegistry;

    public DefaultRecallAspectHandler(CacheRegistry cacheRegistry) {
        this.cacheRegistry = cacheRegistry;
    }

    @Override
    public Object handleCache(ProceedingJoinPoint joinPoint, RecallContext context) throws Throwable {
        CacheService cache = resolve(context);
        if (cache == null) {
            return joinPoint.proceed();
        }
        if (context.getReturnType() != null && !context.getReturnType().isAssignableFrom(String.class)) {
            log.warn("@RecallCache 仅支持返回 String 的方法，直接执行: method={}.{}, returnType={}",
                    simpleName(context), context.getMethodName(), context.getReturnType().getName());
            return joinPoint.proceed();
        }

        Optional<String> cached = cache.lookupResult(context.getQuery(), context.getScope());
        if (cached.isPresent()) {
            log.debug("缓存命中，跳过方法执行: cache={}, method={}.{}",
                    context.getCache(), simpleName(context), context.getMethodName());
            return cached.get();
        }

        long startTime = System.currentTimeMillis();
        Object result = joinPoint.proceed();
        log.debug("方法执行完成: cache={}, method={}.{}, duration={}ms",
                context.getCache(), simpleName(context), context.getMethodName(),
                System.currentTimeMillis() - startTime);

        if (result instanceof String) {
            cache.store(context.getQuery(), context.getScope(), (String) result);
        }
        return result;
    }

    @Override
    public Object handleEvict(ProceedingJoinPoint joinPoint, RecallContext context,
                              boolean allEntries, boolean beforeInvocation) throws Throwable {
        CacheService cache = resolve(context);
        if (cache == null) {
            return joinPoint.proceed();
        }

        log.info("处理失效: cache={}, allEntries={}, beforeInvocation={}",
                context.getCache(), allEntries, beforeInvocation);

        if (beforeInvocation) {
            evict(cache, context, allEntries);
            return joinPoint.proceed();
        }

        Object result = joinPoint.proceed();
        evict(cache, context, allEntries);
        return result;
    }

    private void evict(CacheService cache, RecallContext context, boolean allEntries) {
        if (allEntries) {
            cache.invalidateAll();
        } else {
            cache.invalidate(context.getQuery(), context.getScope());
        }
    }

    private CacheService resolve(RecallContext context) {
        if (context == null || context.getCache() == null) {
            return null;
        }
        CacheService cache = cacheRegistry.getCache(context.getCache());
        if (cache == null) {
            log.warn("缓存未找到，直接执行: cache={}", context.getCache());
        }
        return cache;
    }

    private static String simpleName(RecallContext context) {
        return context.getTargetClass() != null ? context.getTargetClass().getSimpleName() : "Unknown";
    }
}
