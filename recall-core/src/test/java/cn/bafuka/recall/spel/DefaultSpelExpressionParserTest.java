package cn.bafuka.recall.spel;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.lang.reflect.Method;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * DefaultSpelExpressionParser 单元测试
 * 主要测试查询/作用域表达式的解析和安全性
 */
public class DefaultSpelExpressionParserTest {

    private DefaultSpelExpressionParser parser;

    @Mock
    private ProceedingJoinPoint joinPoint;

    @Mock
    private MethodSignature methodSignature;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        parser = new DefaultSpelExpressionParser();
    }

    private void mockInvocation(String methodName, Class<?>[] parameterTypes, Object... args)
            throws NoSuchMethodException {
        Method method = TestService.class.getMethod(methodName, parameterTypes);
        when(joinPoint.getSignature()).thenReturn(methodSignature);
        when(methodSignature.getMethod()).thenReturn(method);
        when(joinPoint.getArgs()).thenReturn(args);
    }

    /**
     * 测试参数名表达式
     */
    @Test
    public void testParseText_ParameterName() throws NoSuchMethodException {
        mockInvocation("explore", new Class<?>[]{String.class, String.class}, "find config files", "/p");

        assertEquals("find config files", parser.parseText("#prompt", joinPoint));
        assertEquals("/p", parser.parseText("#cwd", joinPoint));
    }

    /**
     * 测试参数索引表达式 (p0, a1)
     */
    @Test
    public void testParseText_ParameterIndex() throws NoSuchMethodException {
        mockInvocation("explore", new Class<?>[]{String.class, String.class}, "search for auth", "/repo");

        assertEquals("search for auth", parser.parseText("#p0", joinPoint));
        assertEquals("/repo", parser.parseText("#a1", joinPoint));
    }

    /**
     * 测试对象属性访问
     */
    @Test
    public void testParseText_ObjectProperty() throws NoSuchMethodException {
        ToolRequest request = new ToolRequest();
        request.setUrl("https://example.com/docs");
        mockInvocation("fetch", new Class<?>[]{ToolRequest.class}, request);

        assertEquals("https://example.com/docs", parser.parseText("#request.url", joinPoint));
    }

    /**
     * 测试非字符串结果转为字符串
     */
    @Test
    public void testParseText_NonStringValue() throws NoSuchMethodException {
        mockInvocation("page", new Class<?>[]{String.class, Integer.class}, "docs", 3);

        assertEquals("docs:3", parser.parseText("#topic + ':' + #page", joinPoint));
        assertEquals("3", parser.parseText("#page", joinPoint));
    }

    /**
     * 测试空表达式与空值
     */
    @Test
    public void testParseText_EmptyExpression() throws NoSuchMethodException {
        mockInvocation("explore", new Class<?>[]{String.class, String.class}, "query", null);

        assertNull(parser.parseText("", joinPoint));
        assertNull(parser.parseText(null, joinPoint));
        assertNull(parser.parseText("#cwd", joinPoint));
    }

    /**
     * 测试条件表达式
     */
    @Test
    public void testParseCondition() throws NoSuchMethodException {
        mockInvocation("page", new Class<?>[]{String.class, Integer.class}, "docs", 3);

        assertTrue(parser.parseCondition("#page > 0", joinPoint));
        assertFalse(parser.parseCondition("#page > 10", joinPoint));
        assertTrue(parser.parseCondition("", joinPoint));
        assertTrue(parser.parseCondition(null, joinPoint));
    }

    /**
     * 测试条件表达式解析失败按不满足处理
     */
    @Test
    public void testParseCondition_Invalid() throws NoSuchMethodException {
        mockInvocation("page", new Class<?>[]{String.class, Integer.class}, "docs", 3);

        assertFalse(parser.parseCondition("#page >", joinPoint));
    }

    /**
     * 【安全测试】类型引用被拒绝
     */
    @Test
    public void testParseText_MaliciousExpression() throws NoSuchMethodException {
        mockInvocation("explore", new Class<?>[]{String.class, String.class}, "query", "/p");

        assertNull(parser.parseText("T(java.lang.Runtime).getRuntime().exec('ls')", joinPoint));
        assertNull(parser.parseText("T(java.lang.System).getProperty('user.home')", joinPoint));
        assertNull(parser.parseText("T(Class).forName('java.lang.Runtime')", joinPoint));
    }

    /**
     * 测试请求类
     */
    public static class ToolRequest {
        private String url;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }

    /**
     * 测试服务类
     */
    public static class TestService {
        public String explore(String prompt, String cwd) {
            return null;
        }

        public String fetch(ToolRequest request) {
            return null;
        }

        public String page(String topic, Integer page) {
            return null;
        }
    }
}
