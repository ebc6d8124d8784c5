package cn.bafuka.tagcache.config;

import cn.bafuka.tagcache.store.CompositePolicy;
import cn.bafuka.tagcache.store.StoreKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * TagCache 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "tagcache")
public class TagCacheProperties {

    /**
     * 是否启用 TagCache
     */
    private boolean enabled = true;

    /**
     * 默认存活时间
     */
    private Duration defaultTtl = Duration.ofHours(1);

    /**
     * 键前缀（命名空间）
     */
    private String keyPrefix = "tagcache";

    /**
     * 后端类型
     */
    private StoreKind backend = StoreKind.MEMORY;

    /**
     * 组合 Store 策略
     */
    private CompositePolicy compositePolicy = CompositePolicy.FALLBACK;

    /**
     * 组合 Store 成员（按顺序，第一个为主 Store）
     */
    private List<StoreKind> compositeStores = new ArrayList<>(Arrays.asList(StoreKind.MEMORY, StoreKind.FILE));

    /**
     * 内存 Store 配置
     */
    private Memory memory = new Memory();

    /**
     * 文件 Store 配置
     */
    private File file = new File();

    /**
     * Redis Store 配置
     */
    private Network network = new Network();

    /**
     * 数据库表 Store 配置
     */
    private Table table = new Table();

    /**
     * 防击穿锁配置
     */
    private Lock lock = new Lock();

    @Data
    public static class Memory {
        /**
         * 最大容量
         */
        private long maximumSize = 100_000;
    }

    @Data
    public static class File {
        /**
         * 缓存目录
         */
        private String directory = System.getProperty("java.io.tmpdir") + java.io.File.separator + "tagcache";
    }

    @Data
    public static class Network {
        /**
         * Redis 键命名空间
         */
        private String namespace = "tagcache:";
    }

    @Data
    public static class Table {
        /**
         * 表名
         */
        private String tableName = "tagcache_entries";

        /**
         * 启动时是否自动建表
         */
        private boolean createTable = true;
    }

    @Data
    public static class Lock {
        /**
         * 锁类型
         */
        private LockType type = LockType.LOCAL;

        /**
         * 分布式锁等待时间
         */
        private Duration waitTime = Duration.ofSeconds(3);

        /**
         * 分布式锁租约时间
         */
        private Duration leaseTime = Duration.ofSeconds(5);
    }

    /**
     * 防击穿锁类型
     */
    public enum LockType {
        /**
         * 进程内锁
         */
        LOCAL,

        /**
         * Redisson 分布式锁
         */
        REDISSON
    }
}
