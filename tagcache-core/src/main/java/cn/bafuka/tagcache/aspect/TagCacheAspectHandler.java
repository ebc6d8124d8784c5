package cn.bafuka.tagcache.aspect;

import cn.bafuka.tagcache.core.TagCacheContext;
import org.aspectj.lang.ProceedingJoinPoint;

import java.util.List;

/**
 * TagCache 切面处理器接口
 * 负责拦截注解方法，执行缓存逻辑
 */
public interface TagCacheAspectHandler {

    /**
     * 处理 @TaggedCacheable 注解的方法调用
     *
     * @param joinPoint 切点
     * @param context   上下文信息
     * @return 方法返回值
     * @throws Throwable 被拦截方法抛出的原始异常
     */
    Object handleCacheable(ProceedingJoinPoint joinPoint, TagCacheContext context) throws Throwable;

    /**
     * 处理 @TagCacheFlush 注解的方法调用
     *
     * @param joinPoint        切点
     * @param tags             要失效的标签
     * @param beforeInvocation 是否在方法执行前失效
     * @return 方法返回值
     * @throws Throwable 被拦截方法抛出的原始异常
     */
    Object handleFlush(ProceedingJoinPoint joinPoint, List<String> tags, boolean beforeInvocation) throws Throwable;
}
