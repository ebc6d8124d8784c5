package cn.bafuka.tagcache.core;

import cn.bafuka.tagcache.store.Store;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 缓存管理器
 * 应用访问缓存的统一入口：键前缀、默认 TTL、get-or-compute、批量操作和计数器
 *
 * <p>Store 故障不会向调用方抛出：读操作返回默认值，写操作返回 false，并记录 WARN 日志。
 */
public interface CacheManager {

    /**
     * 读取缓存
     *
     * @param key  逻辑键
     * @param type 值类型（支持泛型）
     * @param <T>  值类型
     * @return 缓存值，未命中返回 null
     */
    <T> T get(String key, Type type);

    /**
     * 读取缓存
     *
     * @param key          逻辑键
     * @param type         值类型
     * @param defaultValue 未命中或 Store 故障时的默认值
     * @param <T>          值类型
     * @return 缓存值或默认值
     */
    <T> T get(String key, Type type, T defaultValue);

    /**
     * 读取缓存但不记录命中统计，用于加锁后的二次检查
     *
     * @param key  逻辑键
     * @param type 值类型
     * @param <T>  值类型
     * @return 缓存值，未命中或 Store 故障返回 null
     */
    <T> T peek(String key, Type type);

    /**
     * 使用默认 TTL 写入缓存
     *
     * @param key   逻辑键
     * @param value 值（不能为 null）
     * @return 是否写入成功
     */
    boolean set(String key, Object value);

    /**
     * 写入缓存
     *
     * @param key   逻辑键
     * @param value 值（不能为 null）
     * @param ttl   存活时间：null 使用默认 TTL，0 永不过期，负数等同删除
     * @return 是否写入成功
     */
    boolean set(String key, Object value, Duration ttl);

    /**
     * 删除缓存
     *
     * @param key 逻辑键
     * @return 是否成功
     */
    boolean delete(String key);

    /**
     * 判断缓存是否存在
     *
     * @param key 逻辑键
     * @return 是否存在
     */
    boolean has(String key);

    /**
     * 清空底层 Store
     *
     * @return 是否成功
     */
    boolean clear();

    /**
     * 批量读取
     *
     * @param keys         逻辑键集合
     * @param type         值类型
     * @param defaultValue 未命中的默认值
     * @param <T>          值类型
     * @return 按 keys 顺序的结果，未命中的键对应默认值
     */
    <T> Map<String, T> getMultiple(Collection<String> keys, Type type, T defaultValue);

    /**
     * 批量写入
     *
     * @param values 键值对
     * @param ttl    存活时间，null 使用默认 TTL
     * @return 全部成功返回 true
     */
    boolean setMultiple(Map<String, ?> values, Duration ttl);

    /**
     * 批量删除
     *
     * @param keys 逻辑键集合
     * @return 全部成功返回 true
     */
    boolean deleteMultiple(Collection<String> keys);

    /**
     * 读取缓存，未命中时调用 producer 计算并写入
     *
     * <p>命中时不会调用 producer；未命中时只调用一次。
     * 不提供跨请求互斥：并发未命中同一个键时 producer 可能被执行多次（缓存击穿），
     * 需要时使用 {@link #rememberWithLock}。producer 的异常原样抛出，返回 null 时不写缓存。
     *
     * @param key      逻辑键
     * @param ttl      存活时间，null 使用默认 TTL
     * @param type     值类型
     * @param producer 回源函数
     * @param <T>      值类型
     * @return 缓存值或新计算的值
     */
    <T> T remember(String key, Duration ttl, Type type, Supplier<T> producer);

    /**
     * 与 {@link #remember} 相同，但未命中时在 {@link cn.bafuka.tagcache.guard.StampedeGuard} 内二次检查并回源
     *
     * @param key      逻辑键
     * @param ttl      存活时间，null 使用默认 TTL
     * @param type     值类型
     * @param producer 回源函数
     * @param <T>      值类型
     * @return 缓存值或新计算的值
     */
    <T> T rememberWithLock(String key, Duration ttl, Type type, Supplier<T> producer);

    /**
     * 自增
     * Store 支持原子自增时直接委托；否则以"读-加-写"模拟，模拟路径在并发自增下不安全
     *
     * @param key   逻辑键
     * @param delta 增量
     * @return 自增后的值，失败返回 null
     */
    Long increment(String key, long delta);

    /**
     * 自减
     *
     * @param key   逻辑键
     * @param delta 减量
     * @return 自减后的值，失败返回 null
     */
    Long decrement(String key, long delta);

    /**
     * 加上命名空间前缀后的物理键
     *
     * @param key 逻辑键
     * @return 前缀键
     */
    String prefixedKey(String key);

    /**
     * 统计快照
     *
     * @return 统计信息
     */
    CacheStats getStats();

    /**
     * 清零统计
     */
    void resetStats();

    /**
     * 计数器（供 TaggedCache 记录未命中）
     *
     * @return 计数器
     */
    CacheStatistics getStatistics();

    /**
     * 底层 Store
     *
     * @return Store
     */
    Store getStore();

    /**
     * 默认 TTL
     *
     * @return 默认存活时间
     */
    Duration getDefaultTtl();
}
