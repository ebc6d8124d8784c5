package cn.bafuka.tagcache.store;

/**
 * 支持原子自增的 Store
 * 计数器以十进制 ASCII 文本存储，不存在的键按 0 处理
 */
public interface IncrementableStore extends Store {

    /**
     * 原子自增
     *
     * @param key   存储键
     * @param delta 增量（可为负数）
     * @return 自增后的值
     */
    long increment(String key, long delta);
}
