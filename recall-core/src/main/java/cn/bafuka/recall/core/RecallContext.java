package cn.bafuka.recall.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recall 调用上下文
 * 切面解析注解后，在处理链路中传递
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecallContext {

    /**
     * 缓存名称
     */
    private String cache;

    /**
     * 查询文本
     */
    private String query;

    /**
     * 作用域
     */
    private String scope;

    /**
     * 目标方法类
     */
    private Class<?> targetClass;

    /**
     * 目标方法名
     */
    private String methodName;

    /**
     * 目标方法返回类型
     */
    private Class<?> returnType;
}
