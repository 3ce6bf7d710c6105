package cn.bafuka.recall.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Recall 缓存注解
 * 标注在返回 String 的方法上：命中时直接返回缓存结果，未命中时执行方法并写入结果
 *
 * 使用示例：
 * <pre>
 * {@code
 * @RecallCache(cache = "exploration", query = "#prompt", scope = "#cwd")
 * public String explore(String prompt, String cwd) {
 *     return agent.run(prompt, cwd);
 * }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RecallCache {

    /**
     * 缓存名称（必填），对应注册表中的一个实例
     *
     * @return 缓存名称
     */
    String cache();

    /**
     * 查询文本表达式（支持 SpEL）
     *
     * @return SpEL 表达式
     */
    String query();

    /**
     * 作用域表达式（支持 SpEL），为空时作用域为空串
     *
     * @return SpEL 表达式
     */
    String scope() default "";

    /**
     * 条件表达式（可选），只有满足条件时才启用缓存
     *
     * @return SpEL 表达式，默认为空表示总是启用
     */
    String condition() default "";

    /**
     * 是否启用
     *
     * @return 默认 true
     */
    boolean enabled() default true;
}
