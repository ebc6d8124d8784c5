package cn.bafuka.tagcache.core.impl;

import cn.bafuka.tagcache.core.CacheManager;
import cn.bafuka.tagcache.core.CacheStatistics;
import cn.bafuka.tagcache.core.CacheStats;
import cn.bafuka.tagcache.guard.StampedeGuard;
import cn.bafuka.tagcache.guard.impl.LocalStampedeGuard;
import cn.bafuka.tagcache.serializer.ValueSerializer;
import cn.bafuka.tagcache.serializer.impl.FastjsonValueSerializer;
import cn.bafuka.tagcache.store.IncrementableStore;
import cn.bafuka.tagcache.store.Store;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 缓存管理器默认实现
 * 所有 Store 异常在这里被吸收：读降级为未命中，写降级为 false
 */
@Slf4j
public class DefaultCacheManager implements CacheManager {

    /**
     * 底层 Store
     */
    private final Store store;

    /**
     * 值序列化器
     */
    private final ValueSerializer serializer;

    /**
     * 防击穿守卫
     */
    private final StampedeGuard stampedeGuard;

    /**
     * 键前缀
     */
    private final String keyPrefix;

    /**
     * 默认存活时间
     */
    private final Duration defaultTtl;

    /**
     * 计数器
     */
    private final CacheStatistics statistics = new CacheStatistics();

    public DefaultCacheManager(Store store, String keyPrefix, Duration defaultTtl) {
        this(store, new FastjsonValueSerializer(), new LocalStampedeGuard(), keyPrefix, defaultTtl);
    }

    public DefaultCacheManager(Store store,
                               ValueSerializer serializer,
                               StampedeGuard stampedeGuard,
                               String keyPrefix,
                               Duration defaultTtl) {
        this.store = store;
        this.serializer = serializer;
        this.stampedeGuard = stampedeGuard;
        this.keyPrefix = keyPrefix;
        this.defaultTtl = defaultTtl;
    }

    @Override
    public <T> T get(String key, Type type) {
        return get(key, type, null);
    }

    @Override
    public <T> T get(String key, Type type, T defaultValue) {
        T value = lookup(key, type);
        if (value == null) {
            statistics.recordMiss();
            log.debug("缓存未命中: key={}", key);
            return defaultValue;
        }

        statistics.recordHit();
        log.debug("缓存命中: key={}", key);
        return value;
    }

    @Override
    public <T> T peek(String key, Type type) {
        return lookup(key, type);
    }

    @Override
    public boolean set(String key, Object value) {
        return set(key, value, null);
    }

    @Override
    public boolean set(String key, Object value, Duration ttl) {
        if (value == null) {
            log.warn("忽略空值写入: key={}", key);
            return false;
        }

        Duration effectiveTtl = resolveTtl(ttl);
        if (effectiveTtl.isNegative()) {
            return delete(key);
        }

        String prefixed = prefixedKey(key);
        try {
            byte[] data = serializer.serialize(value);
            boolean success = store.set(prefixed, data, effectiveTtl);
            if (success) {
                statistics.recordSet();
                log.debug("缓存写入: key={}, ttl={}", key, effectiveTtl);
            }
            return success;
        } catch (RuntimeException e) {
            onStoreFailure("写入", prefixed, e);
            return false;
        }
    }

    @Override
    public boolean delete(String key) {
        String prefixed = prefixedKey(key);
        try {
            boolean success = store.delete(prefixed);
            if (success) {
                statistics.recordDelete();
                log.debug("缓存删除: key={}", key);
            }
            return success;
        } catch (RuntimeException e) {
            onStoreFailure("删除", prefixed, e);
            return false;
        }
    }

    @Override
    public boolean has(String key) {
        String prefixed = prefixedKey(key);
        try {
            return store.has(prefixed);
        } catch (RuntimeException e) {
            onStoreFailure("判断存在", prefixed, e);
            return false;
        }
    }

    @Override
    public boolean clear() {
        try {
            return store.clear();
        } catch (RuntimeException e) {
            onStoreFailure("清空", null, e);
            return false;
        }
    }

    @Override
    public <T> Map<String, T> getMultiple(Collection<String> keys, Type type, T defaultValue) {
        Map<String, T> result = new LinkedHashMap<>();
        if (keys == null || keys.isEmpty()) {
            return result;
        }

        List<String> prefixedKeys = new ArrayList<>(keys.size());
        for (String key : keys) {
            prefixedKeys.add(prefixedKey(key));
        }

        Map<String, byte[]> found;
        try {
            found = store.getMultiple(prefixedKeys);
        } catch (RuntimeException e) {
            onStoreFailure("批量读取", String.join(",", prefixedKeys), e);
            found = new LinkedHashMap<>();
        }

        for (String key : keys) {
            String prefixed = prefixedKey(key);
            byte[] raw = found.get(prefixed);
            T value = raw == null ? null : decode(prefixed, raw, type);
            if (value == null) {
                statistics.recordMiss();
                result.put(key, defaultValue);
            } else {
                statistics.recordHit();
                result.put(key, value);
            }
        }
        return result;
    }

    @Override
    public boolean setMultiple(Map<String, ?> values, Duration ttl) {
        if (values == null || values.isEmpty()) {
            return true;
        }

        Duration effectiveTtl = resolveTtl(ttl);
        if (effectiveTtl.isNegative()) {
            return deleteMultiple(values.keySet());
        }

        Map<String, byte[]> encoded = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                if (entry.getValue() == null) {
                    log.warn("忽略空值写入: key={}", entry.getKey());
                    continue;
                }
                encoded.put(prefixedKey(entry.getKey()), serializer.serialize(entry.getValue()));
            }
            boolean success = store.setMultiple(encoded, effectiveTtl);
            if (success) {
                encoded.keySet().forEach(k -> statistics.recordSet());
            }
            return success && encoded.size() == values.size();
        } catch (RuntimeException e) {
            onStoreFailure("批量写入", String.join(",", encoded.keySet()), e);
            return false;
        }
    }

    @Override
    public boolean deleteMultiple(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return true;
        }

        List<String> prefixedKeys = new ArrayList<>(keys.size());
        for (String key : keys) {
            prefixedKeys.add(prefixedKey(key));
        }
        try {
            boolean success = store.deleteMultiple(prefixedKeys);
            if (success) {
                prefixedKeys.forEach(k -> statistics.recordDelete());
            }
            return success;
        } catch (RuntimeException e) {
            onStoreFailure("批量删除", String.join(",", prefixedKeys), e);
            return false;
        }
    }

    @Override
    public <T> T remember(String key, Duration ttl, Type type, Supplier<T> producer) {
        T cached = get(key, type);
        if (cached != null) {
            return cached;
        }
        return produceAndStore(key, ttl, producer);
    }

    @Override
    public <T> T rememberWithLock(String key, Duration ttl, Type type, Supplier<T> producer) {
        T cached = get(key, type);
        if (cached != null) {
            return cached;
        }

        return stampedeGuard.execute(prefixedKey(key), () -> {
            // 获取到锁后二次检查，其他线程可能已经写入
            T loaded = lookup(key, type);
            if (loaded != null) {
                log.debug("二次检查命中: key={}", key);
                return loaded;
            }
            return produceAndStore(key, ttl, producer);
        });
    }

    @Override
    public Long increment(String key, long delta) {
        String prefixed = prefixedKey(key);

        if (store instanceof IncrementableStore) {
            try {
                return ((IncrementableStore) store).increment(prefixed, delta);
            } catch (RuntimeException e) {
                onStoreFailure("自增", prefixed, e);
                return null;
            }
        }

        // 模拟路径：读-加-写，非原子
        try {
            byte[] raw = store.get(prefixed);
            Long current = raw == null ? null : decode(prefixed, raw, Long.class);
            long next = (current == null ? 0L : current) + delta;
            if (!store.set(prefixed, serializer.serialize(next), Duration.ZERO)) {
                return null;
            }
            statistics.recordSet();
            return next;
        } catch (RuntimeException e) {
            onStoreFailure("自增", prefixed, e);
            return null;
        }
    }

    @Override
    public Long decrement(String key, long delta) {
        return increment(key, -delta);
    }

    @Override
    public String prefixedKey(String key) {
        if (keyPrefix == null || keyPrefix.trim().isEmpty()) {
            return key;
        }
        return keyPrefix + ":" + key;
    }

    @Override
    public CacheStats getStats() {
        return statistics.snapshot();
    }

    @Override
    public void resetStats() {
        statistics.reset();
    }

    @Override
    public CacheStatistics getStatistics() {
        return statistics;
    }

    @Override
    public Store getStore() {
        return store;
    }

    @Override
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private <T> T produceAndStore(String key, Duration ttl, Supplier<T> producer) {
        T value = producer.get();
        if (value != null) {
            set(key, value, ttl);
        }
        return value;
    }

    /**
     * 读取并反序列化，不记录命中统计；Store 故障和数据损坏都返回 null
     */
    private <T> T lookup(String key, Type type) {
        String prefixed = prefixedKey(key);
        byte[] raw;
        try {
            raw = store.get(prefixed);
        } catch (RuntimeException e) {
            onStoreFailure("读取", prefixed, e);
            return null;
        }
        return raw == null ? null : decode(prefixed, raw, type);
    }

    /**
     * 反序列化失败时视为未命中，并尝试删除损坏的条目
     */
    private <T> T decode(String prefixed, byte[] raw, Type type) {
        try {
            return serializer.deserialize(prefixed, raw, type);
        } catch (RuntimeException e) {
            log.warn("缓存数据损坏，按未命中处理并删除: key={}, error={}", prefixed, e.getMessage());
            try {
                store.delete(prefixed);
            } catch (RuntimeException deleteFailure) {
                onStoreFailure("删除损坏条目", prefixed, deleteFailure);
            }
            return null;
        }
    }

    private Duration resolveTtl(Duration ttl) {
        if (ttl != null) {
            return ttl;
        }
        return defaultTtl == null ? Duration.ZERO : defaultTtl;
    }

    private void onStoreFailure(String operation, String key, RuntimeException e) {
        statistics.recordError();
        log.warn("Store {}失败，已降级: store={}, key={}, error={}",
                operation, store.getName(), key, e.getMessage());
    }
}
