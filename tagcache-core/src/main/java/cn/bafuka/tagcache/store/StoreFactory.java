package cn.bafuka.tagcache.store;

import cn.bafuka.tagcache.config.TagCacheProperties;
import cn.bafuka.tagcache.exception.TagCacheException;
import cn.bafuka.tagcache.store.impl.CaffeineMemoryStore;
import cn.bafuka.tagcache.store.impl.CompositeStore;
import cn.bafuka.tagcache.store.impl.FileStore;
import cn.bafuka.tagcache.store.impl.JdbcTableStore;
import cn.bafuka.tagcache.store.impl.RedisStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Store 工厂
 * 根据 {@link StoreKind} 构建对应的 Store 实现，配置错误在启动时直接失败
 */
@Slf4j
public class StoreFactory {

    private final TagCacheProperties properties;

    private final Clock clock;

    /**
     * Redis 模板（可选）
     */
    private final RedisTemplate<String, byte[]> redisTemplate;

    /**
     * JDBC 模板（可选）
     */
    private final JdbcTemplate jdbcTemplate;

    public StoreFactory(TagCacheProperties properties,
                        Clock clock,
                        RedisTemplate<String, byte[]> redisTemplate,
                        JdbcTemplate jdbcTemplate) {
        this.properties = properties;
        this.clock = clock;
        this.redisTemplate = redisTemplate;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * 构建 Store，组合 Store 的成员各自新建
     *
     * @param kind 后端类型
     * @return Store 实例
     */
    public Store create(StoreKind kind) {
        return create(kind, this::create);
    }

    /**
     * 构建 Store
     *
     * @param kind           后端类型
     * @param memberResolver 组合 Store 成员的获取方式
     * @return Store 实例
     */
    public Store create(StoreKind kind, Function<StoreKind, Store> memberResolver) {
        if (kind == null) {
            throw TagCacheException.configurationError("未配置后端类型 tagcache.backend");
        }

        log.info("创建 Store: kind={}", kind);
        switch (kind) {
            case MEMORY:
                return new CaffeineMemoryStore(properties.getMemory().getMaximumSize(), clock);
            case FILE:
                return new FileStore(Paths.get(properties.getFile().getDirectory()), clock);
            case NETWORK:
                if (redisTemplate == null) {
                    throw TagCacheException.configurationError(
                            "后端类型为 network，但未找到 RedisConnectionFactory");
                }
                return new RedisStore(redisTemplate, properties.getNetwork().getNamespace());
            case TABLE:
                if (jdbcTemplate == null) {
                    throw TagCacheException.configurationError(
                            "后端类型为 table，但未找到 JdbcTemplate");
                }
                return new JdbcTableStore(jdbcTemplate,
                        properties.getTable().getTableName(),
                        properties.getTable().isCreateTable(),
                        clock);
            case COMPOSITE:
                return createComposite(memberResolver);
            default:
                throw TagCacheException.configurationError("未知的后端类型: " + kind);
        }
    }

    private Store createComposite(Function<StoreKind, Store> memberResolver) {
        List<StoreKind> memberKinds = properties.getCompositeStores();
        if (memberKinds == null || memberKinds.isEmpty()) {
            throw TagCacheException.configurationError("组合 Store 未配置成员 tagcache.composite-stores");
        }
        if (properties.getCompositePolicy() == null) {
            throw TagCacheException.configurationError("组合 Store 未配置策略 tagcache.composite-policy");
        }

        List<Store> members = new ArrayList<>(memberKinds.size());
        for (StoreKind memberKind : memberKinds) {
            if (memberKind == null || memberKind == StoreKind.COMPOSITE) {
                throw TagCacheException.configurationError("组合 Store 成员非法: " + memberKind);
            }
            members.add(memberResolver.apply(memberKind));
        }
        return new CompositeStore(members, properties.getCompositePolicy());
    }
}
