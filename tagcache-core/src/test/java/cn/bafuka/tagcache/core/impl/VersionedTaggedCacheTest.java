package cn.bafuka.tagcache.core.impl;

import cn.bafuka.tagcache.core.CacheStats;
import cn.bafuka.tagcache.core.TagScope;
import cn.bafuka.tagcache.exception.TagCacheException;
import cn.bafuka.tagcache.store.Store;
import cn.bafuka.tagcache.store.impl.CaffeineMemoryStore;
import cn.bafuka.tagcache.support.MutableClock;
import cn.bafuka.tagcache.support.SampleUser;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * VersionedTaggedCache 单元测试
 * 验证版本令牌失效机制
 */
public class VersionedTaggedCacheTest {

    private static final List<String> USERS = Collections.singletonList("users");

    private MutableClock clock;

    private CaffeineMemoryStore store;

    private DefaultCacheManager cacheManager;

    private VersionedTaggedCache taggedCache;

    @Mock
    private Store brokenStore;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        clock = new MutableClock();
        store = new CaffeineMemoryStore(clock);
        cacheManager = new DefaultCacheManager(store, "app", Duration.ofHours(1));
        taggedCache = new VersionedTaggedCache(cacheManager);
    }

    /**
     * 测试写入后读取
     */
    @Test
    public void testSetAndGet() {
        SampleUser alice = new SampleUser(1L, "Alice");

        assertTrue(taggedCache.set(USERS, "user:1", alice, Duration.ofSeconds(60)));

        assertEquals(alice, taggedCache.get(USERS, "user:1", SampleUser.class));
    }

    /**
     * 测试标签失效后条目不可见
     */
    @Test
    public void testFlush_Invalidates() {
        taggedCache.set(USERS, "user:1", "Alice", null);
        taggedCache.set(USERS, "user:2", "Bob", null);

        assertTrue(taggedCache.flush("users"));

        assertNull(taggedCache.get(USERS, "user:1", String.class));
        assertNull(taggedCache.get(USERS, "user:2", String.class));
    }

    /**
     * 测试失效后重新写入可见
     */
    @Test
    public void testFlush_ThenRewrite() {
        taggedCache.set(USERS, "user:1", "Alice", null);
        taggedCache.flush("users");

        taggedCache.set(USERS, "user:1", "Alice v2", null);

        assertEquals("Alice v2", taggedCache.get(USERS, "user:1", String.class));
    }

    /**
     * 测试标签之间互不影响
     */
    @Test
    public void testTagIndependence() {
        taggedCache.set(USERS, "user:1", "Alice", null);
        taggedCache.set(Collections.singletonList("posts"), "post:1", "Hello", null);

        taggedCache.flush("posts");

        assertEquals("Alice", taggedCache.get(USERS, "user:1", String.class));
        assertNull(taggedCache.get(Collections.singletonList("posts"), "post:1", String.class));
    }

    /**
     * 测试多标签条目：失效任一标签即不可见
     */
    @Test
    public void testMultiTag() {
        List<String> tags = Arrays.asList("users", "user:1");
        taggedCache.set(tags, "profile", "Alice", null);

        assertEquals("Alice", taggedCache.get(tags, "profile", String.class));

        taggedCache.flush("user:1");

        assertNull(taggedCache.get(tags, "profile", String.class));
    }

    /**
     * 测试标签顺序、重复和空白不影响寻址
     */
    @Test
    public void testTagNormalization() {
        taggedCache.set(Arrays.asList("b", "a"), "k", "v", null);

        assertEquals("v", taggedCache.get(Arrays.asList("a", " b ", "a"), "k", String.class));
    }

    /**
     * 测试不同标签组合下同名键互不可见
     */
    @Test
    public void testSameKeyDifferentTags() {
        taggedCache.set(Collections.singletonList("a"), "k", "under-a", null);
        taggedCache.set(Arrays.asList("a", "b"), "k", "under-ab", null);

        assertEquals("under-a", taggedCache.get(Collections.singletonList("a"), "k", String.class));
        assertEquals("under-ab", taggedCache.get(Arrays.asList("a", "b"), "k", String.class));
    }

    /**
     * 测试重复失效无副作用
     */
    @Test
    public void testFlush_Idempotent() {
        taggedCache.set(USERS, "user:1", "Alice", null);

        assertTrue(taggedCache.flush("users"));
        assertTrue(taggedCache.flush("users"));

        assertNull(taggedCache.get(USERS, "user:1", String.class));
        taggedCache.set(USERS, "user:1", "Alice", null);
        assertEquals("Alice", taggedCache.get(USERS, "user:1", String.class));
    }

    /**
     * 测试从未写入的标签：直接未命中且不创建令牌
     */
    @Test
    public void testGet_UnknownTag() {
        assertNull(taggedCache.get(USERS, "user:1", String.class));

        assertNull(store.get("app:tagversion:users"));
        assertEquals(1, cacheManager.getStats().getMissCount());
    }

    /**
     * 测试令牌读写不计入统计
     */
    @Test
    public void testTokens_NotCounted() {
        taggedCache.set(USERS, "user:1", "Alice", null);
        taggedCache.get(USERS, "user:1", String.class);
        taggedCache.flush("users");

        CacheStats stats = cacheManager.getStats();
        assertEquals(1, stats.getHitCount());
        assertEquals(0, stats.getMissCount());
        assertEquals(1, stats.getSetCount());
        assertNotNull(store.get("app:tagversion:users"));
    }

    /**
     * 测试条目按 TTL 过期
     */
    @Test
    public void testEntryExpiry() {
        taggedCache.set(USERS, "user:1", "Alice", Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(60));

        assertNull(taggedCache.get(USERS, "user:1", String.class));
    }

    /**
     * 测试空标签是编程错误
     */
    @Test
    public void testEmptyTags() {
        try {
            taggedCache.get(Collections.emptyList(), "k", String.class);
            fail("应该抛出异常");
        } catch (IllegalArgumentException e) {
            // 预期
        }

        try {
            taggedCache.flush(" ");
            fail("应该抛出异常");
        } catch (IllegalArgumentException e) {
            // 预期
        }
    }

    /**
     * 测试令牌无法写入时不写数据
     */
    @Test
    public void testSet_TokenWriteFailure() {
        when(brokenStore.getName()).thenReturn("broken");
        when(brokenStore.getMultiple(anyCollection())).thenReturn(new HashMap<>());
        when(brokenStore.set(anyString(), any(), any()))
                .thenThrow(TagCacheException.backendUnavailable("broken", null, null));
        DefaultCacheManager manager = new DefaultCacheManager(brokenStore, "app", Duration.ofHours(1));
        VersionedTaggedCache cache = new VersionedTaggedCache(manager);

        assertFalse(cache.set(USERS, "user:1", "Alice", null));

        verify(brokenStore, times(1)).set(eq("app:tagversion:users"), any(), eq(Duration.ZERO));
        assertEquals(1, manager.getStats().getErrorCount());
    }

    /**
     * 测试令牌读取失败按未命中处理
     */
    @Test
    public void testGet_TokenReadFailure() {
        when(brokenStore.getName()).thenReturn("broken");
        when(brokenStore.getMultiple(anyCollection()))
                .thenThrow(TagCacheException.backendUnavailable("broken", null, null));
        when(brokenStore.set(anyString(), any(), any()))
                .thenThrow(TagCacheException.backendUnavailable("broken", null, null));
        DefaultCacheManager manager = new DefaultCacheManager(brokenStore, "app", Duration.ofHours(1));
        VersionedTaggedCache cache = new VersionedTaggedCache(manager);

        assertNull(cache.get(USERS, "user:1", String.class));
        assertFalse(cache.flush(USERS));

        CacheStats stats = manager.getStats();
        assertEquals(1, stats.getMissCount());
        assertEquals(2, stats.getErrorCount());
    }

    /**
     * 测试 remember：失效后重新回源
     */
    @Test
    public void testRemember() {
        AtomicInteger calls = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            taggedCache.remember(USERS, "user:1", null, String.class, () -> "Alice#" + calls.incrementAndGet());
        }
        assertEquals(1, calls.get());

        taggedCache.flush("users");
        String reloaded = taggedCache.rememberWithLock(USERS, "user:1", null, String.class,
                () -> "Alice#" + calls.incrementAndGet());

        assertEquals("Alice#2", reloaded);
        assertEquals("Alice#2", taggedCache.get(USERS, "user:1", String.class));
    }

    /**
     * 测试 rememberWithLock：命中时不回源
     */
    @Test
    public void testRememberWithLock_Hit() {
        taggedCache.set(USERS, "user:1", "Alice", null);

        String value = taggedCache.rememberWithLock(USERS, "user:1", null, String.class, () -> {
            throw new AssertionError("不应回源");
        });

        assertEquals("Alice", value);
    }

    /**
     * 测试标签作用域
     */
    @Test
    public void testTagScope() {
        TagScope scope = taggedCache.tags("users", "user:1");

        assertTrue(scope.set("profile", "Alice", Duration.ofMinutes(5)));
        assertEquals("Alice", scope.get("profile", String.class));
        assertEquals("Alice", taggedCache.tags("user:1", "users").get("profile", String.class));

        assertTrue(scope.delete("profile"));
        assertNull(scope.get("profile", String.class));

        scope.set("profile", "Alice");
        assertTrue(taggedCache.tags("users").flush());
        assertNull(scope.get("profile", String.class));
    }

    /**
     * 测试物理键对拼接边界敏感
     */
    @Test
    public void testEntryKey_LengthPrefixed() {
        Map<String, String> tokens = new HashMap<>();
        tokens.put("ab", "t1");
        tokens.put("a", "t1");

        String first = taggedCache.entryKey(Collections.singletonList("ab"), tokens, "c");
        String second = taggedCache.entryKey(Collections.singletonList("a"), tokens, "bc");

        assertNotEquals(first, second);
        assertTrue(first.startsWith("tagged:"));
        assertEquals("tagged:".length() + 64, first.length());
    }
}
