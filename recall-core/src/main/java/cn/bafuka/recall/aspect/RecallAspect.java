package cn.bafuka.recall.aspect;

import cn.bafuka.recall.annotation.RecallCache;
import cn.bafuka.recall.annotation.RecallEvict;
import cn.bafuka.recall.core.RecallContext;
import cn.bafuka.recall.spel.SpelExpressionParser;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;

/**
 * Recall AOP 切面
 * 拦截 @RecallCache 和 @RecallEvict 注解
 */
@Slf4j
@Aspect
public class RecallAspect {

    private final SpelExpressionParser spelParser;

    private final RecallAspectHandler aspectHandler;

    public RecallAspect(SpelExpressionParser spelParser, RecallAspectHandler aspectHandler) {
        this.spelParser = spelParser;
        this.aspectHandler = aspectHandler;
    }

    @Around("@annotation(recallCache)")
    public Object aroundCache(ProceedingJoinPoint joinPoint, RecallCache recallCache) throws Throwable {
        if (!recallCache.enabled()) {
            return joinPoint.proceed();
        }

        if (!spelParser.parseCondition(recallCache.condition(), joinPoint)) {
            log.debug("Condition not met, skipping cache: cache={}", recallCache.cache());
            return joinPoint.proceed();
        }

        String query = spelParser.parseText(recallCache.query(), joinPoint);
        if (query == null) {
            log.warn("Failed to parse query expression, skipping: cache={}", recallCache.cache());
            return joinPoint.proceed();
        }

        return aspectHandler.handleCache(joinPoint, buildContext(joinPoint, recallCache.cache(), query, recallCache.scope()));
    }

    @Around("@annotation(recallEvict)")
    public Object aroundEvict(ProceedingJoinPoint joinPoint, RecallEvict recallEvict) throws Throwable {
        String query = null;
        if (!recallEvict.allEntries()) {
            query = spelParser.parseText(recallEvict.query(), joinPoint);
            if (query == null) {
                log.warn("Failed to parse query expression for evict, skipping: cache={}", recallEvict.cache());
                return joinPoint.proceed();
            }
        }

        return aspectHandler.handleEvict(
                joinPoint,
                buildContext(joinPoint, recallEvict.cache(), query, recallEvict.scope()),
                recallEvict.allEntries(),
                recallEvict.beforeInvocation()
        );
    }

    private RecallContext buildContext(ProceedingJoinPoint joinPoint, String cache, String query, String scopeExpression) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String scope = spelParser.parseText(scopeExpression, joinPoint);

        return RecallContext.builder()
                .cache(cache)
                .query(query)
                .scope(scope == null ? "" : scope)
                .targetClass(joinPoint.getTarget().getClass())
                .methodName(signature.getName())
                .returnType(signature.getReturnType())
                .build();
    }
}
