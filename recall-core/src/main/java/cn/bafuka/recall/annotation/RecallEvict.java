package cn.bafuka.recall.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Recall 缓存失效注解
 *
 * 使用示例：
 * <pre>
 * {@code
 * @RecallEvict(cache = "exploration", allEntries = true)
 * public void resetWorkspace() {
 *     ...
 * }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RecallEvict {

    /**
     * 缓存名称（必填）
     *
     * @return 缓存名称
     */
    String cache();

    /**
     * 查询文本表达式（支持 SpEL），allEntries 为 true 时忽略
     *
     * @return SpEL 表达式
     */
    String query() default "";

    /**
     * 作用域表达式（支持 SpEL）
     *
     * @return SpEL 表达式
     */
    String scope() default "";

    /**
     * 是否清空整个缓存
     *
     * @return 默认 false
     */
    boolean allEntries() default false;

    /**
     * 是否在方法执行前失效
     * true: 方法执行前失效
     * false: 方法执行成功后失效（默认）
     *
     * @return 默认 false
     */
    boolean beforeInvocation() default false;
}
