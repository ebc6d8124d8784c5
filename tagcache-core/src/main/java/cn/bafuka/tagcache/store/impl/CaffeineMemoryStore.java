package cn.bafuka.tagcache.store.impl;

import cn.bafuka.tagcache.exception.TagCacheException;
import cn.bafuka.tagcache.store.CacheEntry;
import cn.bafuka.tagcache.store.IncrementableStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * 进程内存 Store
 * 基于 Caffeine，容量淘汰交给 Caffeine，TTL 在读取时惰性判断
 */
@Slf4j
public class CaffeineMemoryStore implements IncrementableStore {

    /**
     * 默认最大容量
     */
    public static final long DEFAULT_MAXIMUM_SIZE = 100_000;

    /**
     * 数据容器
     */
    private final Cache<String, CacheEntry> cache;

    /**
     * 时钟（测试时可替换）
     */
    private final Clock clock;

    public CaffeineMemoryStore(Clock clock) {
        this(DEFAULT_MAXIMUM_SIZE, clock);
    }

    public CaffeineMemoryStore(long maximumSize, Clock clock) {
        this.clock = clock;
        // 维护任务在调用线程执行，不引入后台线程
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(Runnable::run)
                .build();

        log.info("构建内存 Store，配置: maximumSize={}", maximumSize);
    }

    @Override
    public byte[] get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return null;
        }

        if (entry.isExpired(clock.millis())) {
            // 惰性删除，只删除读到的这一个版本
            cache.asMap().remove(key, entry);
            log.debug("内存 Store 条目已过期: key={}", key);
            return null;
        }
        return entry.getValue().clone();
    }

    @Override
    public boolean set(String key, byte[] value, Duration ttl) {
        cache.put(key, CacheEntry.of(value.clone(), ttl, clock));
        return true;
    }

    @Override
    public boolean delete(String key) {
        cache.invalidate(key);
        return true;
    }

    @Override
    public boolean clear() {
        cache.invalidateAll();
        log.info("内存 Store 已清空");
        return true;
    }

    @Override
    public boolean has(String key) {
        return get(key) != null;
    }

    @Override
    public long increment(String key, long delta) {
        CacheEntry updated = cache.asMap().compute(key, (k, current) -> {
            long base = 0;
            long expiresAt = CacheEntry.NEVER;
            if (current != null && !current.isExpired(clock.millis())) {
                base = parseCounter(k, current.getValue());
                expiresAt = current.getExpiresAt();
            }
            byte[] next = Long.toString(base + delta).getBytes(StandardCharsets.US_ASCII);
            return new CacheEntry(next, expiresAt);
        });
        return Long.parseLong(new String(updated.getValue(), StandardCharsets.US_ASCII));
    }

    @Override
    public String getName() {
        return "memory";
    }

    /**
     * 当前条目数（包含尚未惰性删除的过期条目）
     *
     * @return 条目数
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static long parseCounter(String key, byte[] raw) {
        try {
            return Long.parseLong(new String(raw, StandardCharsets.US_ASCII).trim());
        } catch (NumberFormatException e) {
            throw TagCacheException.corruptEntry(key, e);
        }
    }
}
