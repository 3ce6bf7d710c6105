package cn.bafuka.recall.aspect;

import cn.bafuka.recall.core.RecallContext;
import org.aspectj.lang.ProceedingJoinPoint;

/**
 * Recall 切面处理器接口
 */
public interface RecallAspectHandler {

    /**
     * 处理 @RecallCache 注解的方法调用
     *
     * @param joinPoint 切点
     * @param context   上下文信息
     * @return 缓存结果或方法返回值
     * @throws Throwable 目标方法抛出的异常
     */
    Object handleCache(ProceedingJoinPoint joinPoint, RecallContext context) throws Throwable;

    /**
     * 处理 @RecallEvict 注解的方法调用
     *
     * @param joinPoint        切点
     * @param context          上下文信息
     * @param allEntries       是否清空整个缓存
     * @param beforeInvocation 是否在方法执行前失效
     * @return 方法返回值
     * @throws Throwable 目标方法抛出的异常
     */
    Object handleEvict(ProceedingJoinPoint joinPoint, RecallContext context,
                       boolean allEntries, boolean beforeInvocation) throws Throwable;
}
