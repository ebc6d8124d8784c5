package cn.bafuka.tagcache.aspect.impl;

import cn.bafuka.tagcache.aspect.TagCacheAspectHandler;
import cn.bafuka.tagcache.core.TagCacheContext;
import cn.bafuka.tagcache.core.TaggedCache;
import cn.bafuka.tagcache.exception.TagCacheException;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;

import java.util.List;
import java.util.function.Supplier;

/**
 * TagCache 切面处理器默认实现
 * 缓存读写委托给 {@link TaggedCache}
 */
@Slf4j
public class DefaultTagCacheAspectHandler implements TagCacheAspectHandler {

    /**
     * 标签缓存
     */
    private final TaggedCache taggedCache;

    public DefaultTagCacheAspectHandler(TaggedCache taggedCache) {
        this.taggedCache = taggedCache;
    }

    @Override
    public Object handleCacheable(ProceedingJoinPoint joinPoint, TagCacheContext context) throws Throwable {
        if (context == null || context.getTags() == null || context.getTags().isEmpty()) {
            // 无效的上下文，直接执行原方法
            return joinPoint.proceed();
        }

        log.debug("处理缓存: tags={}, key={}", context.getTags(), context.getKey());

        Supplier<Object> loader = () -> loadFromSource(joinPoint, context);
        try {
            if (context.isSync()) {
                return taggedCache.rememberWithLock(context.getTags(), context.getKey(),
                        context.getTtl(), context.getReturnType(), loader);
            }
            return taggedCache.remember(context.getTags(), context.getKey(),
                    context.getTtl(), context.getReturnType(), loader);
        } catch (TagCacheException e) {
            // 还原被拦截方法的原始异常
            if (e.getReason() == TagCacheException.FailureReason.LOAD_FAILURE && e.getCause() != null) {
                throw e.getCause();
            }
            throw e;
        }
    }

    @Override
    public Object handleFlush(ProceedingJoinPoint joinPoint, List<String> tags, boolean beforeInvocation) throws Throwable {
        if (tags == null || tags.isEmpty()) {
            return joinPoint.proceed();
        }

        log.debug("处理标签失效: tags={}, beforeInvocation={}", tags, beforeInvocation);

        if (beforeInvocation) {
            flush(tags);
            return joinPoint.proceed();
        }

        Object result = joinPoint.proceed();
        flush(tags);
        return result;
    }

    /**
     * 调用原方法回源；受检异常包装成 LOAD_FAILURE 穿过 Supplier
     */
    private Object loadFromSource(ProceedingJoinPoint joinPoint, TagCacheContext context) {
        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            log.debug("回源成功: tags={}, key={}, duration={}ms",
                    context.getTags(), context.getKey(), System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException | Error e) {
            logLoadFailure(context, e);
            throw e;
        } catch (Throwable e) {
            logLoadFailure(context, e);
            throw new TagCacheException(
                    String.format("Failed to load from source: key=%s", context.getKey()),
                    e, context.getKey(), TagCacheException.FailureReason.LOAD_FAILURE);
        }
    }

    private void logLoadFailure(TagCacheContext context, Throwable e) {
        log.error("回源失败: tags={}, key={}, method={}.{}, error={}",
                context.getTags(),
                context.getKey(),
                context.getTargetClass() != null ? context.getTargetClass().getSimpleName() : "Unknown",
                context.getMethodName() != null ? context.getMethodName() : "unknown",
                e.getMessage(),
                e);
    }

    private void flush(List<String> tags) {
        if (!taggedCache.flush(tags)) {
            log.warn("标签失效未完全成功: tags={}", tags);
        }
    }
}
