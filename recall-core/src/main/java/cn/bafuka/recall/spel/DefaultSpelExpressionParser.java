package cn.bafuka.recall.spel;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SpEL 表达式解析器默认实现
 * 使用只读的 {@link SimpleEvaluationContext}，表达式只能访问参数及其属性
 */
@Slf4j
public class DefaultSpelExpressionParser implements SpelExpressionParser {

    private final ExpressionParser parser = new org.springframework.expression.spel.standard.SpelExpressionParser();

    private final ParameterNameDiscoverer parameterNameDiscoverer = new DefaultParameterNameDiscoverer();

    /**
     * 已解析的表达式
     */
    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();

    @Override
    public String parseText(String expression, ProceedingJoinPoint joinPoint) {
        if (!StringUtils.hasText(expression)) {
            return null;
        }

        try {
            Object value = getExpression(expression).getValue(createEvaluationContext(joinPoint));
            return value == null ? null : String.valueOf(value);
        } catch (Exception e) {
            log.error("解析 SpEL 表达式失败: {}", expression, e);
            return null;
        }
    }

    @Override
    public boolean parseCondition(String expression, ProceedingJoinPoint joinPoint) {
        if (!StringUtils.hasText(expression)) {
            return true;
        }

        try {
            Boolean result = getExpression(expression).getValue(createEvaluationContext(joinPoint), Boolean.class);
            return result != null && result;
        } catch (Exception e) {
            log.error("解析 SpEL 条件表达式失败: {}", expression, e);
            return false;
        }
    }

    private Expression getExpression(String expression) {
        return expressionCache.computeIfAbsent(expression, parser::parseExpression);
    }

    /**
     * 创建求值上下文：参数名、p0/a0 别名
     */
    private EvaluationContext createEvaluationContext(ProceedingJoinPoint joinPoint) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        Object[] args = joinPoint.getArgs();

        SimpleEvaluationContext context = SimpleEvaluationContext
                .forReadOnlyDataBinding()
                .build();

        String[] parameterNames = parameterNameDiscoverer.getParameterNames(method);
        if (parameterNames != null) {
            for (int i = 0; i < parameterNames.length && i < args.length; i++) {
                context.setVariable(parameterNames[i], args[i]);
            }
        }

        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
            context.setVariable("a" + i, args[i]);
        }

        return context;
    }
}
