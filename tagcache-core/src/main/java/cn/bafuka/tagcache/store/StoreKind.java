package cn.bafuka.tagcache.store;

/**
 * 后端类型
 */
public enum StoreKind {

    /**
     * 进程内存（Caffeine）
     */
    MEMORY,

    /**
     * 本地文件
     */
    FILE,

    /**
     * Redis
     */
    NETWORK,

    /**
     * 关系型数据库表
     */
    TABLE,

    /**
     * 多个 Store 组合
     */
    COMPOSITE
}
