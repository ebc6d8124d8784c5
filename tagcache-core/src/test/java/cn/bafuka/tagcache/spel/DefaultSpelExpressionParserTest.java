package cn.bafuka.tagcache.spel;

import cn.bafuka.tagcache.support.SampleUser;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * DefaultSpelExpressionParser 单元测试
 * 主要测试键、条件、标签表达式解析的正确性和安全性
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

    /**
     * 测试按参数名取值
     */
    @Test
    public void testParseKey_SimpleParameter() throws NoSuchMethodException {
        invoke(TestService.class.getMethod("getUserById", Long.class), 123L);

        assertEquals("123", parser.parseKey("#userId", joinPoint));
    }

    /**
     * 测试参数索引表达式 (p0, a0)
     */
    @Test
    public void testParseKey_ParameterIndex() throws NoSuchMethodException {
        invoke(TestService.class.getMethod("getUserById", Long.class), 456L);

        assertEquals("456", parser.parseKey("#p0", joinPoint));
        assertEquals("456", parser.parseKey("#a0", joinPoint));
    }

    /**
     * 测试对象属性访问和字符串拼接
     */
    @Test
    public void testParseKey_ObjectProperty() throws NoSuchMethodException {
        invoke(TestService.class.getMethod("updateUser", SampleUser.class), new SampleUser(789L, "Alice"));

        assertEquals("789", parser.parseKey("#user.id", joinPoint));
        assertEquals("user:789:Alice", parser.parseKey("'user:' + #user.id + ':' + #user.name", joinPoint));
    }

    /**
     * 测试空表达式
     */
    @Test
    public void testParseKey_EmptyExpression() {
        assertNull(parser.parseKey("", joinPoint));
        assertNull(parser.parseKey(null, joinPoint));
    }

    /**
     * 测试表达式结果为 null
     */
    @Test
    public void testParseKey_NullValue() throws NoSuchMethodException {
        invoke(TestService.class.getMethod("getUserById", Long.class), (Object) null);

        assertNull(parser.parseKey("#userId", joinPoint));
    }

    /**
     * 测试条件表达式
     */
    @Test
    public void testParseCondition() throws NoSuchMethodException {
        Method method = TestService.class.getMethod("getUserById", Long.class);

        invoke(method, 100L);
        assertTrue(parser.parseCondition("#userId > 0", joinPoint));

        invoke(method, -1L);
        assertFalse(parser.parseCondition("#userId > 0", joinPoint));
    }

    /**
     * 测试空条件表达式（默认为 true）
     */
    @Test
    public void testParseCondition_EmptyExpression() {
        assertTrue(parser.parseCondition("", joinPoint));
        assertTrue(parser.parseCondition(null, joinPoint));
    }

    /**
     * 测试标签：字面量与表达式混用
     */
    @Test
    public void testParseTags_LiteralAndExpression() throws NoSuchMethodException {
        invoke(TestService.class.getMethod("getUserByIdAndType", Long.class, String.class), 100L, "VIP");

        List<String> tags = parser.parseTags(new String[]{"users", "'user:' + #userId", "'type:' + #p1"}, joinPoint);

        assertEquals(Arrays.asList("users", "user:100", "type:VIP"), tags);
    }

    /**
     * 测试字面量标签不需要求值上下文
     */
    @Test
    public void testParseTags_LiteralOnly() {
        List<String> tags = parser.parseTags(new String[]{"users", " posts "}, joinPoint);

        assertEquals(Arrays.asList("users", "posts"), tags);
        verify(joinPoint, never()).getArgs();
    }

    /**
     * 测试标签表达式结果为空
     */
    @Test
    public void testParseTags_NullResult() throws NoSuchMethodException {
        invoke(TestService.class.getMethod("getUserById", Long.class), (Object) null);

        assertNull(parser.parseTags(new String[]{"users", "#userId"}, joinPoint));
        assertNull(parser.parseTags(new String[0], joinPoint));
    }

    /**
     * 【安全测试】测试恶意 SpEL 表达式 - 执行系统命令
     * 使用 SimpleEvaluationContext 后，应该求值失败
     */
    @Test
    public void testParseKey_MaliciousExpression_SystemCommand() throws NoSuchMethodException {
        invoke(TestService.class.getMethod("getUserById", Long.class), 100L);

        assertNull(parser.parseKey("T(java.lang.Runtime).getRuntime().exec('ls')", joinPoint));
    }

    /**
     * 【安全测试】测试恶意 SpEL 表达式 - 反射调用
     */
    @Test
    public void testParseKey_MaliciousExpression_Reflection() throws NoSuchMethodException {
        invoke(TestService.class.getMethod("getUserById", Long.class), 100L);

        assertNull(parser.parseKey("T(Class).forName('java.lang.Runtime')", joinPoint));
    }

    /**
     * 【安全测试】恶意标签表达式导致整组标签解析失败
     */
    @Test
    public void testParseTags_MaliciousExpression() throws NoSuchMethodException {
        invoke(TestService.class.getMethod("getUserById", Long.class), 100L);

        assertNull(parser.parseTags(new String[]{"users", "T(java.lang.System).getProperty('user.home') + #userId"},
                joinPoint));
    }

    private void invoke(Method method, Object... args) {
        when(joinPoint.getSignature()).thenReturn(methodSignature);
        when(methodSignature.getMethod()).thenReturn(method);
        when(joinPoint.getArgs()).thenReturn(args);
    }

    /**
     * 测试服务类
     */
    public static class TestService {
        public SampleUser getUserById(Long userId) {
            return null;
        }

        public void updateUser(SampleUser user) {
        }

        public SampleUser getUserByIdAndType(Long userId, String type) {
            return null;
        }
    }
}
