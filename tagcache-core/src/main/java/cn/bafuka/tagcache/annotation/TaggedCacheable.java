package cn.bafuka.tagcache.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标签缓存注解
 * 标注在方法上，方法返回值按标签缓存，标签失效后自动回源
 *
 * 使用示例：
 * <pre>
 * {@code
 * @TaggedCacheable(tags = {"users", "'user:' + #userId"}, key = "'detail:' + #userId", ttlSeconds = 600)
 * public User getUserById(Long userId) {
 *     return userRepository.findById(userId);
 * }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TaggedCacheable {

    /**
     * 标签（必填）
     * 不含 # 的标签按字面量处理，含 # 的标签按 SpEL 表达式求值
     *
     * @return 标签
     */
    String[] tags();

    /**
     * 缓存键表达式（支持 SpEL）
     * 例如：#userId, #user.id, #p0
     *
     * @return SpEL 表达式
     */
    String key();

    /**
     * 存活时间（秒）
     * 负数表示使用默认 TTL，0 表示永不过期
     *
     * @return 默认 -1
     */
    long ttlSeconds() default -1;

    /**
     * 条件表达式（可选）
     * 只有满足条件时才走缓存
     *
     * @return SpEL 表达式，默认为空表示总是启用
     */
    String condition() default "";

    /**
     * 未命中时是否在防击穿守卫内回源
     *
     * @return 默认 false
     */
    boolean sync() default false;
}
