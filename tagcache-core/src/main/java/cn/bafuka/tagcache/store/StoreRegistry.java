package cn.bafuka.tagcache.store;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Store 注册表
 * 进程启动时构建一次，通过依赖注入传递给所有使用方；
 * 每种后端类型只创建一个共享实例，组合 Store 复用已注册的成员。
 */
@Slf4j
public class StoreRegistry {

    private final StoreFactory factory;

    /**
     * 主后端类型（CacheManager 使用）
     */
    private final StoreKind primaryKind;

    private final Map<StoreKind, Store> stores = new EnumMap<>(StoreKind.class);

    public StoreRegistry(StoreFactory factory, StoreKind primaryKind) {
        this.factory = factory;
        this.primaryKind = primaryKind;
    }

    /**
     * 获取（必要时创建）指定类型的 Store
     *
     * @param kind 后端类型
     * @return 共享的 Store 实例
     */
    public synchronized Store get(StoreKind kind) {
        Store store = stores.get(kind);
        if (store == null) {
            store = factory.create(kind, this::get);
            stores.put(kind, store);
        }
        return store;
    }

    /**
     * 主 Store
     *
     * @return 配置的后端
     */
    public Store primary() {
        return get(primaryKind);
    }

    /**
     * 注册外部构建的 Store（覆盖同类型实例）
     *
     * @param kind  后端类型
     * @param store Store 实例
     */
    public synchronized void register(StoreKind kind, Store store) {
        Store previous = stores.put(kind, store);
        if (previous != null) {
            log.info("替换已注册的 Store: kind={}, previous={}, current={}",
                    kind, previous.getName(), store.getName());
        }
    }

    public StoreKind getPrimaryKind() {
        return primaryKind;
    }

    public synchronized Map<StoreKind, Store> getAll() {
        return Collections.unmodifiableMap(new EnumMap<>(stores));
    }
}
