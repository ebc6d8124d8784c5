package cn.bafuka.tagcache.autoconfigure;

import cn.bafuka.tagcache.annotation.TagCacheFlush;
import cn.bafuka.tagcache.annotation.TaggedCacheable;
import cn.bafuka.tagcache.core.CacheManager;
import cn.bafuka.tagcache.core.TaggedCache;
import cn.bafuka.tagcache.exception.TagCacheException;
import cn.bafuka.tagcache.guard.StampedeGuard;
import cn.bafuka.tagcache.guard.impl.LocalStampedeGuard;
import cn.bafuka.tagcache.store.StoreRegistry;
import cn.bafuka.tagcache.store.impl.CaffeineMemoryStore;
import org.junit.After;
import org.junit.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.MapPropertySource;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * TagCacheAutoConfiguration 集成测试
 * 启动真实的 Spring 容器，验证 Bean 装配和注解拦截
 */
public class TagCacheAutoConfigurationTest {

    private AnnotationConfigApplicationContext context;

    @After
    public void tearDown() {
        if (context != null) {
            context.close();
        }
    }

    /**
     * 测试默认装配
     */
    @Test
    public void testDefaultBeans() {
        load(new HashMap<>());

        CacheManager cacheManager = context.getBean(CacheManager.class);
        assertTrue(cacheManager.getStore() instanceof CaffeineMemoryStore);
        assertEquals(Duration.ofHours(1), cacheManager.getDefaultTtl());
        assertEquals("tagcache:k", cacheManager.prefixedKey("k"));
        assertTrue(context.getBean(StampedeGuard.class) instanceof LocalStampedeGuard);
        assertNotNull(context.getBean(TaggedCache.class));
        assertNotNull(context.getBean(StoreRegistry.class));
    }

    /**
     * 测试配置属性绑定
     */
    @Test
    public void testPropertyBinding() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("tagcache.key-prefix", "demo");
        properties.put("tagcache.default-ttl", "30m");
        load(properties);

        CacheManager cacheManager = context.getBean(CacheManager.class);
        assertEquals(Duration.ofMinutes(30), cacheManager.getDefaultTtl());
        assertEquals("demo:k", cacheManager.prefixedKey("k"));
    }

    /**
     * 测试关闭开关
     */
    @Test
    public void testDisabled() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("tagcache.enabled", "false");
        load(properties);

        assertTrue(context.getBeansOfType(CacheManager.class).isEmpty());
    }

    /**
     * 测试缺少 Redis 连接时启动失败
     */
    @Test
    public void testNetworkBackendWithoutRedis() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("tagcache.backend", "network");

        try {
            load(properties);
            fail("应该启动失败");
        } catch (BeanCreationException e) {
            assertTrue(e.getMostSpecificCause() instanceof TagCacheException);
            assertEquals(TagCacheException.FailureReason.CONFIGURATION_ERROR,
                    ((TagCacheException) e.getMostSpecificCause()).getReason());
        }
    }

    /**
     * 测试 redisson 锁缺少客户端时启动失败
     */
    @Test
    public void testRedissonLockWithoutClient() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("tagcache.lock.type", "redisson");

        try {
            load(properties);
            fail("应该启动失败");
        } catch (BeanCreationException e) {
            assertTrue(e.getMostSpecificCause() instanceof TagCacheException);
        }
    }

    /**
     * 测试 @TaggedCacheable 和 @TagCacheFlush 注解拦截
     */
    @Test
    public void testAnnotations() {
        load(new HashMap<>());
        SampleUserService service = context.getBean(SampleUserService.class);

        // 首次回源，之后命中
        assertEquals("user-1", service.findName(1L));
        assertEquals("user-1", service.findName(1L));
        assertEquals("user-2", service.findName(2L));
        assertEquals(2, service.getLoads());

        // 只失效 user:1
        service.rename(1L);
        assertEquals("user-1", service.findName(1L));
        assertEquals("user-2", service.findName(2L));
        assertEquals(3, service.getLoads());

        // 失效公共标签
        service.renameAll();
        service.findName(1L);
        service.findName(2L);
        assertEquals(5, service.getLoads());
    }

    /**
     * 测试条件表达式和基本类型返回值
     */
    @Test
    public void testConditionAndPrimitive() {
        load(new HashMap<>());
        SampleUserService service = context.getBean(SampleUserService.class);

        service.findNameIfPositive(-1L);
        service.findNameIfPositive(-1L);
        assertEquals(2, service.getLoads());

        int first = service.nextSequence();
        int second = service.nextSequence();
        assertEquals(first, second);
    }

    private void load(Map<String, Object> properties) {
        context = new AnnotationConfigApplicationContext();
        context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", properties));
        context.register(TagCacheAutoConfiguration.class, SampleConfiguration.class);
        context.refresh();
    }

    @Configuration
    static class SampleConfiguration {

        @Bean
        public SampleUserService sampleUserService() {
            return new SampleUserService();
        }
    }

    /**
     * 带注解的示例服务
     */
    public static class SampleUserService {

        private final AtomicInteger loads = new AtomicInteger();

        @TaggedCacheable(tags = {"users", "'user:' + #id"}, key = "'name:' + #id", ttlSeconds = 600)
        public String findName(Long id) {
            loads.incrementAndGet();
            return "user-" + id;
        }

        @TaggedCacheable(tags = "users", key = "'positive:' + #p0", condition = "#p0 > 0")
        public String findNameIfPositive(Long id) {
            loads.incrementAndGet();
            return "user-" + id;
        }

        @TaggedCacheable(tags = "sequence", key = "'next'", sync = true)
        public int nextSequence() {
            return loads.incrementAndGet();
        }

        @TagCacheFlush(tags = "'user:' + #id")
        public void rename(Long id) {
        }

        @TagCacheFlush(tags = "users")
        public void renameAll() {
        }

        public int getLoads() {
            return loads.get();
        }
    }
}
