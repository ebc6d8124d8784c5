package cn.bafuka.tagcache.store.impl;

import cn.bafuka.tagcache.exception.TagCacheException;
import cn.bafuka.tagcache.store.IncrementableStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Redis Store
 * TTL 使用 Redis 原生过期，自增使用 INCRBY
 *
 * <p>所有键都加上命名空间前缀，{@link #clear()} 只删除本命名空间下的键。
 */
@Slf4j
public class RedisStore implements IncrementableStore {

    /**
     * Redis 模板（值序列化器必须为字节数组）
     */
    private final RedisTemplate<String, byte[]> redisTemplate;

    /**
     * 命名空间前缀
     */
    private final String namespace;

    public RedisStore(RedisTemplate<String, byte[]> redisTemplate, String namespace) {
        if (!StringUtils.hasText(namespace)) {
            // 空命名空间会让 clear() 删除整个库
            throw TagCacheException.configurationError("Redis Store 命名空间不能为空");
        }
        this.redisTemplate = redisTemplate;
        this.namespace = namespace;
        log.info("构建 Redis Store，命名空间: {}", this.namespace);
    }

    @Override
    public byte[] get(String key) {
        try {
            return redisTemplate.opsForValue().get(redisKey(key));
        } catch (Exception e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        }
    }

    @Override
    public boolean set(String key, byte[] value, Duration ttl) {
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redisTemplate.opsForValue().set(redisKey(key), value);
            } else {
                redisTemplate.opsForValue().set(redisKey(key), value, ttl.toMillis(), TimeUnit.MILLISECONDS);
            }
            return true;
        } catch (Exception e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            redisTemplate.delete(redisKey(key));
            return true;
        } catch (Exception e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        }
    }

    @Override
    public boolean clear() {
        try {
            // KEYS 会阻塞 Redis，clear 只用于运维场景
            Set<String> keys = redisTemplate.keys(namespace + "*");
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
            }
            log.info("Redis Store 已清空: namespace={}, removed={}", namespace, keys == null ? 0 : keys.size());
            return true;
        } catch (Exception e) {
            throw TagCacheException.backendUnavailable(getName(), null, e);
        }
    }

    @Override
    public boolean has(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(redisKey(key)));
        } catch (Exception e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        }
    }

    @Override
    public Map<String, byte[]> getMultiple(Collection<String> keys) {
        List<String> logicalKeys = new ArrayList<>(keys);
        List<String> redisKeys = new ArrayList<>(logicalKeys.size());
        for (String key : logicalKeys) {
            redisKeys.add(redisKey(key));
        }

        List<byte[]> values;
        try {
            values = redisTemplate.opsForValue().multiGet(redisKeys);
        } catch (Exception e) {
            throw TagCacheException.backendUnavailable(getName(), String.join(",", logicalKeys), e);
        }

        Map<String, byte[]> result = new LinkedHashMap<>();
        if (values == null) {
            return result;
        }
        for (int i = 0; i < logicalKeys.size() && i < values.size(); i++) {
            if (values.get(i) != null) {
                result.put(logicalKeys.get(i), values.get(i));
            }
        }
        return result;
    }

    @Override
    public boolean deleteMultiple(Collection<String> keys) {
        List<String> redisKeys = new ArrayList<>(keys.size());
        for (String key : keys) {
            redisKeys.add(redisKey(key));
        }
        try {
            redisTemplate.delete(redisKeys);
            return true;
        } catch (Exception e) {
            throw TagCacheException.backendUnavailable(getName(), String.join(",", keys), e);
        }
    }

    @Override
    public long increment(String key, long delta) {
        Long value;
        try {
            value = redisTemplate.opsForValue().increment(redisKey(key), delta);
        } catch (Exception e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        }
        if (value == null) {
            // 事务或管道模式下返回 null
            throw TagCacheException.backendUnavailable(getName(), key, null);
        }
        return value;
    }

    @Override
    public String getName() {
        return "network";
    }

    String redisKey(String key) {
        return namespace + key;
    }
}
