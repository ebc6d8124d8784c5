package cn.bafuka.tagcache.store;

/**
 * 组合 Store 的读写策略
 */
public enum CompositePolicy {

    /**
     * 读：按顺序尝试，返回第一个命中；写/删：只作用于主 Store
     */
    FALLBACK,

    /**
     * 写/删：作用于所有 Store（尽力而为）；读：返回第一个正常响应的 Store 的结果
     */
    REPLICATE
}
