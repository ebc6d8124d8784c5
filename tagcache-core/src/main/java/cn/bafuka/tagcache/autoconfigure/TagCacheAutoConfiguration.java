package cn.bafuka.tagcache.autoconfigure;

import cn.bafuka.tagcache.aspect.TagCacheAspect;
import cn.bafuka.tagcache.aspect.TagCacheAspectHandler;
import cn.bafuka.tagcache.aspect.impl.DefaultTagCacheAspectHandler;
import cn.bafuka.tagcache.config.TagCacheProperties;
import cn.bafuka.tagcache.core.CacheManager;
import cn.bafuka.tagcache.core.TaggedCache;
import cn.bafuka.tagcache.core.impl.DefaultCacheManager;
import cn.bafuka.tagcache.core.impl.VersionedTaggedCache;
import cn.bafuka.tagcache.exception.TagCacheException;
import cn.bafuka.tagcache.guard.StampedeGuard;
import cn.bafuka.tagcache.guard.impl.LocalStampedeGuard;
import cn.bafuka.tagcache.guard.impl.RedissonStampedeGuard;
import cn.bafuka.tagcache.serializer.ValueSerializer;
import cn.bafuka.tagcache.serializer.impl.FastjsonValueSerializer;
import cn.bafuka.tagcache.spel.DefaultSpelExpressionParser;
import cn.bafuka.tagcache.spel.SpelExpressionParser;
import cn.bafuka.tagcache.store.StoreFactory;
import cn.bafuka.tagcache.store.StoreRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * TagCache 自动配置类
 */
@Slf4j
@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(TagCacheProperties.class)
@ConditionalOnProperty(prefix = "tagcache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TagCacheAutoConfiguration {

    public TagCacheAutoConfiguration() {
        log.info("TagCache auto-configuration initializing...");
    }

    /**
     * 过期判断使用的时钟
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock tagCacheClock() {
        return Clock.systemUTC();
    }

    /**
     * Store 工厂（Redis 和 JDBC 为可选依赖）
     */
    @Bean
    @ConditionalOnMissingBean
    public StoreFactory tagCacheStoreFactory(TagCacheProperties properties,
                                             Clock tagCacheClock,
                                             ObjectProvider<RedisConnectionFactory> redisConnectionFactory,
                                             ObjectProvider<JdbcTemplate> jdbcTemplate) {
        RedisConnectionFactory connectionFactory = redisConnectionFactory.getIfAvailable();
        RedisTemplate<String, byte[]> redisTemplate = connectionFactory == null
                ? null
                : createRedisTemplate(connectionFactory);
        return new StoreFactory(properties, tagCacheClock, redisTemplate, jdbcTemplate.getIfAvailable());
    }

    /**
     * Store 注册表，配置错误在这里暴露
     */
    @Bean
    @ConditionalOnMissingBean
    public StoreRegistry tagCacheStoreRegistry(StoreFactory storeFactory, TagCacheProperties properties) {
        StoreRegistry registry = new StoreRegistry(storeFactory, properties.getBackend());
        log.info("TagCache 主 Store: {}", registry.primary().getName());
        return registry;
    }

    /**
     * 值序列化器
     */
    @Bean
    @ConditionalOnMissingBean
    public ValueSerializer tagCacheValueSerializer() {
        return new FastjsonValueSerializer();
    }

    /**
     * 防击穿守卫
     */
    @Bean
    @ConditionalOnMissingBean
    public StampedeGuard tagCacheStampedeGuard(TagCacheProperties properties,
                                               ObjectProvider<RedissonClient> redissonClient) {
        TagCacheProperties.Lock lock = properties.getLock();
        if (lock.getType() == TagCacheProperties.LockType.REDISSON) {
            RedissonClient client = redissonClient.getIfAvailable();
            if (client == null) {
                throw TagCacheException.configurationError(
                        "tagcache.lock.type 为 redisson，但未找到 RedissonClient");
            }
            return new RedissonStampedeGuard(client, lock.getWaitTime(), lock.getLeaseTime());
        }
        return new LocalStampedeGuard();
    }

    /**
     * 缓存管理器
     */
    @Bean
    @ConditionalOnMissingBean
    public CacheManager tagCacheManager(StoreRegistry storeRegistry,
                                        ValueSerializer valueSerializer,
                                        StampedeGuard stampedeGuard,
                                        TagCacheProperties properties) {
        return new DefaultCacheManager(
                storeRegistry.primary(),
                valueSerializer,
                stampedeGuard,
                properties.getKeyPrefix(),
                properties.getDefaultTtl()
        );
    }

    /**
     * 标签缓存
     */
    @Bean
    @ConditionalOnMissingBean
    public TaggedCache taggedCache(CacheManager cacheManager, StampedeGuard stampedeGuard) {
        return new VersionedTaggedCache(cacheManager, stampedeGuard);
    }

    /**
     * SpEL 表达式解析器
     */
    @Bean
    @ConditionalOnMissingBean
    public SpelExpressionParser tagCacheSpelExpressionParser() {
        return new DefaultSpelExpressionParser();
    }

    /**
     * 切面处理器
     */
    @Bean
    @ConditionalOnMissingBean
    public TagCacheAspectHandler tagCacheAspectHandler(TaggedCache taggedCache) {
        return new DefaultTagCacheAspectHandler(taggedCache);
    }

    /**
     * AOP 切面
     */
    @Bean
    @ConditionalOnMissingBean
    public TagCacheAspect tagCacheAspect(SpelExpressionParser spelParser,
                                         TagCacheAspectHandler aspectHandler) {
        return new TagCacheAspect(spelParser, aspectHandler);
    }

    private RedisTemplate<String, byte[]> createRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(StringRedisSerializer.UTF_8);
        template.setValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();
        return template;
    }
}
