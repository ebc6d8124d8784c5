package cn.bafuka.tagcache.store.impl;

import cn.bafuka.tagcache.exception.TagCacheException;
import cn.bafuka.tagcache.store.CompositePolicy;
import cn.bafuka.tagcache.store.Store;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * 组合 Store
 * FALLBACK：按顺序读取第一个命中，写入只落主 Store；
 * REPLICATE：写入所有 Store，副本失败时记日志并删除副本上的该键，读取取第一个正常响应。
 *
 * <p>不提供跨 Store 的一致性保证。
 */
@Slf4j
public class CompositeStore implements Store {

    /**
     * 成员 Store，第一个为主 Store
     */
    private final List<Store> stores;

    /**
     * 读写策略
     */
    private final CompositePolicy policy;

    public CompositeStore(List<Store> stores, CompositePolicy policy) {
        if (stores == null || stores.isEmpty()) {
            throw TagCacheException.configurationError("组合 Store 至少需要一个成员");
        }
        if (policy == null) {
            throw TagCacheException.configurationError("组合 Store 未指定策略");
        }
        for (Store store : stores) {
            if (store instanceof CompositeStore) {
                throw TagCacheException.configurationError("组合 Store 不能嵌套");
            }
        }

        this.stores = Collections.unmodifiableList(new ArrayList<>(stores));
        this.policy = policy;
        log.info("构建组合 Store: policy={}, stores={}", policy, getName());
    }

    @Override
    public byte[] get(String key) {
        if (policy == CompositePolicy.FALLBACK) {
            return firstHit(key, store -> store.get(key));
        }
        return firstAnswer(key, store -> store.get(key));
    }

    @Override
    public boolean has(String key) {
        if (policy == CompositePolicy.FALLBACK) {
            return Boolean.TRUE.equals(firstHit(key, store -> store.has(key) ? Boolean.TRUE : null));
        }
        return firstAnswer(key, store -> store.has(key));
    }

    @Override
    public boolean set(String key, byte[] value, Duration ttl) {
        return write(key, store -> store.set(key, value, ttl));
    }

    @Override
    public boolean delete(String key) {
        return write(key, store -> store.delete(key));
    }

    @Override
    public boolean clear() {
        return write(null, Store::clear);
    }

    @Override
    public String getName() {
        StringBuilder name = new StringBuilder("composite[");
        for (int i = 0; i < stores.size(); i++) {
            if (i > 0) {
                name.append(',');
            }
            name.append(stores.get(i).getName());
        }
        return name.append(']').toString();
    }

    public List<Store> getStores() {
        return stores;
    }

    public CompositePolicy getPolicy() {
        return policy;
    }

    /**
     * 按顺序查找第一个非空结果，失败的 Store 被跳过；全部失败时抛出最后一个异常
     */
    private <T> T firstHit(String key, Function<Store, T> read) {
        TagCacheException lastFailure = null;
        boolean answered = false;
        for (Store store : stores) {
            try {
                T value = read.apply(store);
                answered = true;
                if (value != null) {
                    return value;
                }
            } catch (TagCacheException e) {
                log.warn("组合 Store 成员读取失败，尝试下一个: store={}, key={}, error={}",
                        store.getName(), key, e.getMessage());
                lastFailure = e;
            }
        }
        if (!answered && lastFailure != null) {
            throw lastFailure;
        }
        return null;
    }

    /**
     * 返回第一个正常响应的 Store 的结果（即使是未命中）
     */
    private <T> T firstAnswer(String key, Function<Store, T> read) {
        TagCacheException lastFailure = null;
        for (Store store : stores) {
            try {
                return read.apply(store);
            } catch (TagCacheException e) {
                log.warn("组合 Store 成员读取失败，尝试下一个: store={}, key={}, error={}",
                        store.getName(), key, e.getMessage());
                lastFailure = e;
            }
        }
        throw lastFailure;
    }

    /**
     * FALLBACK 只写主 Store；REPLICATE 写全部，主 Store 的结果即调用结果
     *
     * <p>副本写入失败时尽力删除副本上的该键，避免主 Store 不可用时从副本读到旧值
     * （例如标签失效后残留的旧令牌）。
     */
    private boolean write(String key, Function<Store, Boolean> operation) {
        Store primary = stores.get(0);
        if (policy == CompositePolicy.FALLBACK) {
            return operation.apply(primary);
        }

        boolean result = operation.apply(primary);
        for (int i = 1; i < stores.size(); i++) {
            Store replica = stores.get(i);
            try {
                if (!operation.apply(replica)) {
                    log.warn("组合 Store 副本写入未成功: store={}, key={}", replica.getName(), key);
                    evictFromReplica(replica, key);
                }
            } catch (TagCacheException e) {
                log.warn("组合 Store 副本写入失败: store={}, key={}, error={}",
                        replica.getName(), key, e.getMessage());
                evictFromReplica(replica, key);
            }
        }
        return result;
    }

    /**
     * 删除副本上可能过期的数据；删除本身失败时只记日志
     */
    private void evictFromReplica(Store replica, String key) {
        if (key == null) {
            return;
        }
        try {
            replica.delete(key);
        } catch (TagCacheException e) {
            log.warn("组合 Store 副本清理失败，可能残留旧数据: store={}, key={}, error={}",
                    replica.getName(), key, e.getMessage());
        }
    }
}
