package cn.bafuka.tagcache.spel;

import org.aspectj.lang.ProceedingJoinPoint;

import java.util.List;

/**
 * SpEL 表达式解析器接口
 * 用于解析注解中的键、条件和标签表达式
 */
public interface SpelExpressionParser {

    /**
     * 解析表达式，获取缓存键
     *
     * @param expression SpEL 表达式
     * @param joinPoint  切点
     * @return 解析后的键，表达式为空或求值失败返回 null
     */
    String parseKey(String expression, ProceedingJoinPoint joinPoint);

    /**
     * 解析条件表达式
     *
     * @param expression SpEL 表达式
     * @param joinPoint  切点
     * @return true 表示条件满足，false 表示不满足
     */
    boolean parseCondition(String expression, ProceedingJoinPoint joinPoint);

    /**
     * 解析标签
     * 不含 # 的标签按字面量返回，含 # 的标签按 SpEL 求值
     *
     * @param expressions 标签或标签表达式
     * @param joinPoint   切点
     * @return 标签列表，任一表达式求值失败或结果为空返回 null
     */
    List<String> parseTags(String[] expressions, ProceedingJoinPoint joinPoint);
}
