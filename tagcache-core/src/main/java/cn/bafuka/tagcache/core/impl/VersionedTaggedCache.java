package cn.bafuka.tagcache.core.impl;

import cn.bafuka.tagcache.core.CacheManager;
import cn.bafuka.tagcache.core.TaggedCache;
import cn.bafuka.tagcache.guard.StampedeGuard;
import cn.bafuka.tagcache.guard.impl.LocalStampedeGuard;
import cn.bafuka.tagcache.store.Store;
import cn.bafuka.tagcache.support.KeyHasher;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 基于版本令牌的标签缓存
 *
 * <p>每个标签对应一个永不过期的随机令牌。条目的物理键由规整后的标签、
 * 各标签当前令牌和逻辑键共同摘要得到；失效标签只需替换令牌，
 * 旧条目因物理键不再可达而自然失效，最终由 TTL 或容量淘汰回收。
 */
@Slf4j
public class VersionedTaggedCache implements TaggedCache {

    /**
     * 标签令牌的逻辑键前缀
     */
    static final String TOKEN_KEY_PREFIX = "tagversion:";

    /**
     * 标签条目的逻辑键前缀
     */
    static final String ENTRY_KEY_PREFIX = "tagged:";

    private final CacheManager cacheManager;

    private final StampedeGuard stampedeGuard;

    public VersionedTaggedCache(CacheManager cacheManager) {
        this(cacheManager, new LocalStampedeGuard());
    }

    public VersionedTaggedCache(CacheManager cacheManager, StampedeGuard stampedeGuard) {
        this.cacheManager = cacheManager;
        this.stampedeGuard = stampedeGuard;
    }

    @Override
    public <T> T get(Collection<String> tags, String key, Type type) {
        List<String> normalized = normalize(tags);

        Map<String, String> tokens = fetchTokens(normalized);
        if (tokens == null || tokens.size() < normalized.size()) {
            // 令牌缺失说明从未写入过，不需要读取数据
            cacheManager.getStatistics().recordMiss();
            log.debug("标签令牌缺失，直接未命中: tags={}, key={}", normalized, key);
            return null;
        }
        return cacheManager.get(entryKey(normalized, tokens, key), type);
    }

    @Override
    public boolean set(Collection<String> tags, String key, Object value, Duration ttl) {
        List<String> normalized = normalize(tags);
        if (value == null) {
            log.warn("忽略空值写入: tags={}, key={}", normalized, key);
            return false;
        }

        Map<String, String> tokens = ensureTokens(normalized);
        if (tokens == null) {
            return false;
        }
        return cacheManager.set(entryKey(normalized, tokens, key), value, ttl);
    }

    @Override
    public boolean delete(Collection<String> tags, String key) {
        List<String> normalized = normalize(tags);

        Map<String, String> tokens = fetchTokens(normalized);
        if (tokens == null) {
            return false;
        }
        if (tokens.size() < normalized.size()) {
            // 当前版本下不可能存在该条目
            return true;
        }
        return cacheManager.delete(entryKey(normalized, tokens, key));
    }

    @Override
    public <T> T remember(Collection<String> tags, String key, Duration ttl, Type type, Supplier<T> producer) {
        List<String> normalized = normalize(tags);

        T cached = get(normalized, key, type);
        if (cached != null) {
            return cached;
        }

        T value = producer.get();
        if (value != null) {
            set(normalized, key, value, ttl);
        }
        return value;
    }

    @Override
    public <T> T rememberWithLock(Collection<String> tags, String key, Duration ttl, Type type, Supplier<T> producer) {
        List<String> normalized = normalize(tags);

        T cached = get(normalized, key, type);
        if (cached != null) {
            return cached;
        }

        String lockKey = cacheManager.prefixedKey(ENTRY_KEY_PREFIX + normalized + ":" + key);
        return stampedeGuard.execute(lockKey, () -> {
            Map<String, String> tokens = fetchTokens(normalized);
            if (tokens != null && tokens.size() == normalized.size()) {
                T loaded = cacheManager.peek(entryKey(normalized, tokens, key), type);
                if (loaded != null) {
                    log.debug("二次检查命中: tags={}, key={}", normalized, key);
                    return loaded;
                }
            }

            T value = producer.get();
            if (value != null) {
                set(normalized, key, value, ttl);
            }
            return value;
        });
    }

    @Override
    public boolean flush(Collection<String> tags) {
        List<String> normalized = normalize(tags);
        Store store = cacheManager.getStore();

        boolean allWritten = true;
        for (String tag : normalized) {
            String tokenKey = tokenKey(tag);
            try {
                if (!store.set(tokenKey, newToken(), Duration.ZERO)) {
                    allWritten = false;
                }
            } catch (RuntimeException e) {
                cacheManager.getStatistics().recordError();
                log.warn("写入标签令牌失败: tag={}, error={}", tag, e.getMessage());
                allWritten = false;
            }
        }

        log.info("标签已失效: tags={}, success={}", normalized, allWritten);
        return allWritten;
    }

    /**
     * 批量读取标签令牌
     *
     * @param tags 规整后的标签
     * @return 标签到令牌的映射（只包含已存在的令牌），Store 故障返回 null
     */
    private Map<String, String> fetchTokens(List<String> tags) {
        Map<String, String> tokenKeys = new LinkedHashMap<>();
        for (String tag : tags) {
            tokenKeys.put(tokenKey(tag), tag);
        }

        Map<String, byte[]> found;
        try {
            found = cacheManager.getStore().getMultiple(new ArrayList<>(tokenKeys.keySet()));
        } catch (RuntimeException e) {
            cacheManager.getStatistics().recordError();
            log.warn("读取标签令牌失败: tags={}, error={}", tags, e.getMessage());
            return null;
        }

        Map<String, String> tokens = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> entry : found.entrySet()) {
            String tag = tokenKeys.get(entry.getKey());
            if (tag != null && entry.getValue() != null) {
                tokens.put(tag, new String(entry.getValue(), StandardCharsets.UTF_8));
            }
        }
        return tokens;
    }

    /**
     * 读取令牌，缺失的令牌随机生成并持久化
     *
     * @param tags 规整后的标签
     * @return 完整的令牌映射，任一令牌无法读取或写入时返回 null
     */
    private Map<String, String> ensureTokens(List<String> tags) {
        Map<String, String> tokens = fetchTokens(tags);
        if (tokens == null) {
            return null;
        }

        Store store = cacheManager.getStore();
        for (String tag : tags) {
            if (tokens.containsKey(tag)) {
                continue;
            }
            byte[] token = newToken();
            try {
                if (!store.set(tokenKey(tag), token, Duration.ZERO)) {
                    log.warn("创建标签令牌失败: tag={}", tag);
                    return null;
                }
            } catch (RuntimeException e) {
                cacheManager.getStatistics().recordError();
                log.warn("创建标签令牌失败: tag={}, error={}", tag, e.getMessage());
                return null;
            }
            tokens.put(tag, new String(token, StandardCharsets.UTF_8));
            log.debug("创建标签令牌: tag={}", tag);
        }
        return tokens;
    }

    /**
     * 条目的逻辑键；每一段都带长度前缀，避免不同的标签组合拼接出相同的串
     */
    String entryKey(List<String> tags, Map<String, String> tokens, String key) {
        StringBuilder material = new StringBuilder();
        for (String tag : tags) {
            appendPart(material, tag);
        }
        for (String tag : tags) {
            appendPart(material, tokens.get(tag));
        }
        appendPart(material, key);
        return ENTRY_KEY_PREFIX + KeyHasher.sha256Hex(material.toString());
    }

    private String tokenKey(String tag) {
        return cacheManager.prefixedKey(TOKEN_KEY_PREFIX + tag);
    }

    private static void appendPart(StringBuilder material, String part) {
        material.append(part.length()).append(':').append(part);
    }

    private static byte[] newToken() {
        return UUID.randomUUID().toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 去空白、去重、排序
     */
    static List<String> normalize(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("tags must not be empty");
        }

        TreeSet<String> distinct = new TreeSet<>();
        for (String tag : tags) {
            if (tag == null || tag.trim().isEmpty()) {
                throw new IllegalArgumentException("tag must not be blank: " + tags);
            }
            distinct.add(tag.trim());
        }
        return new ArrayList<>(distinct);
    }
}
