package cn.bafuka.tagcache.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.List;

/**
 * 一次被拦截的缓存调用的上下文
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagCacheContext {

    /**
     * 解析后的标签
     */
    private List<String> tags;

    /**
     * 解析后的缓存键
     */
    private String key;

    /**
     * 存活时间，null 表示使用默认 TTL
     */
    private Duration ttl;

    /**
     * 方法返回值类型（含泛型信息）
     */
    private Type returnType;

    /**
     * 是否在防击穿守卫内回源
     */
    private boolean sync;

    /**
     * 目标方法类
     */
    private Class<?> targetClass;

    /**
     * 目标方法名
     */
    private String methodName;
}
