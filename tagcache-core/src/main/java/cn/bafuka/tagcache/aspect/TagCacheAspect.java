package cn.bafuka.tagcache.aspect;

import cn.bafuka.tagcache.annotation.TagCacheFlush;
import cn.bafuka.tagcache.annotation.TaggedCacheable;
import cn.bafuka.tagcache.core.TagCacheContext;
import cn.bafuka.tagcache.spel.SpelExpressionParser;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.List;

/**
 * TagCache AOP 切面
 * 拦截 @TaggedCacheable 和 @TagCacheFlush 注解
 */
@Slf4j
@Aspect
public class TagCacheAspect {

    /**
     * SpEL 表达式解析器
     */
    private final SpelExpressionParser spelParser;

    /**
     * 切面处理器
     */
    private final TagCacheAspectHandler aspectHandler;

    public TagCacheAspect(SpelExpressionParser spelParser, TagCacheAspectHandler aspectHandler) {
        this.spelParser = spelParser;
        this.aspectHandler = aspectHandler;
    }

    /**
     * 拦截 @TaggedCacheable 注解
     */
    @Around("@annotation(taggedCacheable)")
    public Object aroundCacheable(ProceedingJoinPoint joinPoint, TaggedCacheable taggedCacheable) throws Throwable {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        if (method.getReturnType() == void.class) {
            log.warn("void 方法无需缓存: method={}", method.getName());
            return joinPoint.proceed();
        }

        // 解析条件表达式
        if (!spelParser.parseCondition(taggedCacheable.condition(), joinPoint)) {
            log.debug("Condition not met, skipping cache: method={}", method.getName());
            return joinPoint.proceed();
        }

        String key = spelParser.parseKey(taggedCacheable.key(), joinPoint);
        List<String> tags = spelParser.parseTags(taggedCacheable.tags(), joinPoint);
        if (key == null || tags == null) {
            log.warn("Failed to parse cache key or tags, skipping: method={}", method.getName());
            return joinPoint.proceed();
        }

        // 构建上下文
        TagCacheContext context = TagCacheContext.builder()
                .tags(tags)
                .key(key)
                .ttl(taggedCacheable.ttlSeconds() < 0 ? null : Duration.ofSeconds(taggedCacheable.ttlSeconds()))
                .returnType(resolveReturnType(method))
                .sync(taggedCacheable.sync())
                .targetClass(joinPoint.getTarget() != null ? joinPoint.getTarget().getClass() : method.getDeclaringClass())
                .methodName(method.getName())
                .build();

        // 委托给处理器
        return aspectHandler.handleCacheable(joinPoint, context);
    }

    /**
     * 拦截 @TagCacheFlush 注解
     */
    @Around("@annotation(tagCacheFlush)")
    public Object aroundFlush(ProceedingJoinPoint joinPoint, TagCacheFlush tagCacheFlush) throws Throwable {
        List<String> tags = spelParser.parseTags(tagCacheFlush.tags(), joinPoint);
        if (tags == null) {
            log.warn("Failed to parse tags for flush, skipping: method={}", joinPoint.getSignature().getName());
            return joinPoint.proceed();
        }

        // 委托给处理器
        return aspectHandler.handleFlush(joinPoint, tags, tagCacheFlush.beforeInvocation());
    }

    /**
     * 方法的泛型返回类型，基本类型转为包装类型
     */
    private Type resolveReturnType(Method method) {
        if (method.getReturnType().isPrimitive()) {
            return ClassUtils.resolvePrimitiveIfNecessary(method.getReturnType());
        }
        return method.getGenericReturnType();
    }
}
