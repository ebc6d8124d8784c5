package cn.bafuka.tagcache.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标签失效注解
 * 标注在更新方法上，方法执行后（或执行前）失效指定标签
 *
 * 使用示例：
 * <pre>
 * {@code
 * @TagCacheFlush(tags = {"users", "'user:' + #user.id"})
 * public void updateUser(User user) {
 *     userRepository.save(user);
 * }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TagCacheFlush {

    /**
     * 要失效的标签，规则同 {@link TaggedCacheable#tags()}
     *
     * @return 标签
     */
    String[] tags();

    /**
     * 是否在方法执行前失效
     * true: 方法执行前失效
     * false: 方法成功返回后失效（默认），方法抛出异常时不失效
     *
     * @return 默认 false
     */
    boolean beforeInvocation() default false;
}
