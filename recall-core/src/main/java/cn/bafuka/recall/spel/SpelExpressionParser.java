package cn.bafuka.recall.spel;

import org.aspectj.lang.ProceedingJoinPoint;

/**
 * SpEL 表达式解析器接口
 * 用于解析注解中的 query / scope / condition 表达式
 */
public interface SpelExpressionParser {

    /**
     * 解析表达式并转为字符串
     *
     * @param expression SpEL 表达式
     * @param joinPoint  切点
     * @return 解析结果，表达式为空、求值失败或结果为 null 时返回 null
     */
    String parseText(String expression, ProceedingJoinPoint joinPoint);

    /**
     * 解析条件表达式
     *
     * @param expression SpEL 表达式
     * @param joinPoint  切点
     * @return true 表示条件满足；表达式为空视为满足
     */
    boolean parseCondition(String expression, ProceedingJoinPoint joinPoint);
}
