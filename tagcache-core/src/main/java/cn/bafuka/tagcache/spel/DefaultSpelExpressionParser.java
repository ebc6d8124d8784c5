package cn.bafuka.tagcache.spel;

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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SpEL 表达式解析器默认实现
 * 基于 Spring Expression Language，解析结果按表达式文本缓存
 */
@Slf4j
public class DefaultSpelExpressionParser implements SpelExpressionParser {

    /**
     * SpEL 表达式解析器
     */
    private final ExpressionParser parser = new org.springframework.expression.spel.standard.SpelExpressionParser();

    /**
     * 参数名发现器
     */
    private final ParameterNameDiscoverer parameterNameDiscoverer = new DefaultParameterNameDiscoverer();

    /**
     * 已编译的表达式
     */
    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();

    @Override
    public String parseKey(String expression, ProceedingJoinPoint joinPoint) {
        if (!StringUtils.hasText(expression)) {
            return null;
        }

        try {
            Object value = evaluate(expression, createEvaluationContext(joinPoint), Object.class);
            return value == null ? null : String.valueOf(value);
        } catch (Exception e) {
            log.error("解析 SpEL 键表达式失败: expression={}", expression, e);
            return null;
        }
    }

    @Override
    public boolean parseCondition(String expression, ProceedingJoinPoint joinPoint) {
        // 空表达式视为条件成立
        if (!StringUtils.hasText(expression)) {
            return true;
        }

        try {
            Boolean result = evaluate(expression, createEvaluationContext(joinPoint), Boolean.class);
            return result != null && result;
        } catch (Exception e) {
            log.error("解析 SpEL 条件表达式失败: expression={}", expression, e);
            return false;
        }
    }

    @Override
    public List<String> parseTags(String[] expressions, ProceedingJoinPoint joinPoint) {
        if (expressions == null || expressions.length == 0) {
            return null;
        }

        List<String> tags = new ArrayList<>(expressions.length);
        EvaluationContext context = null;
        for (String expression : expressions) {
            if (!StringUtils.hasText(expression)) {
                log.error("标签表达式为空");
                return null;
            }

            if (expression.indexOf('#') < 0) {
                tags.add(expression.trim());
                continue;
            }

            try {
                if (context == null) {
                    context = createEvaluationContext(joinPoint);
                }
                Object value = evaluate(expression, context, Object.class);
                if (value == null || !StringUtils.hasText(value.toString())) {
                    log.error("标签表达式结果为空: expression={}", expression);
                    return null;
                }
                tags.add(value.toString().trim());
            } catch (Exception e) {
                log.error("解析 SpEL 标签表达式失败: expression={}", expression, e);
                return null;
            }
        }
        return tags;
    }

    private <T> T evaluate(String expression, EvaluationContext context, Class<T> resultType) {
        Expression exp = expressionCache.computeIfAbsent(expression, parser::parseExpression);
        return exp.getValue(context, resultType);
    }

    /**
     * 创建 SpEL 求值上下文
     *
     * 使用 SimpleEvaluationContext 的只读数据绑定模式：
     * 只能访问属性，不能调用构造器、静态方法或类型引用
     *
     * @param joinPoint 切点
     * @return 求值上下文
     */
    private EvaluationContext createEvaluationContext(ProceedingJoinPoint joinPoint) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        Object[] args = joinPoint.getArgs();

        SimpleEvaluationContext context = SimpleEvaluationContext
                .forReadOnlyDataBinding()
                .build();

        // 设置参数名称
        String[] parameterNames = parameterNameDiscoverer.getParameterNames(method);
        if (parameterNames != null) {
            for (int i = 0; i < parameterNames.length && i < args.length; i++) {
                context.setVariable(parameterNames[i], args[i]);
            }
        }

        // 设置 p0, p1, p2... 参数别名
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
            context.setVariable("a" + i, args[i]);
        }

        return context;
    }
}
