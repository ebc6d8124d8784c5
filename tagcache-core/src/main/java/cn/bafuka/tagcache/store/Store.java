package cn.bafuka.tagcache.store;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 统一的二进制存储接口
 * 所有后端（内存、文件、Redis、数据库表）都实现该接口
 *
 * <p>实现类必须是线程安全的：同一个 Store 实例在进程生命周期内被所有调用方共享。
 * I/O 失败通过 {@link cn.bafuka.tagcache.exception.TagCacheException}
 * （原因 BACKEND_UNAVAILABLE）报告，由上层降级处理。
 */
public interface Store {

    /**
     * 读取数据
     *
     * @param key 存储键
     * @return 数据，不存在或已过期返回 null
     */
    byte[] get(String key);

    /**
     * 写入数据
     *
     * @param key   存储键
     * @param value 数据
     * @param ttl   存活时间，null 或 0 表示永不过期
     * @return 是否写入成功
     */
    boolean set(String key, byte[] value, Duration ttl);

    /**
     * 删除数据
     *
     * @param key 存储键
     * @return 是否删除成功（键不存在也视为成功）
     */
    boolean delete(String key);

    /**
     * 清空当前 Store 的全部数据
     *
     * @return 是否成功
     */
    boolean clear();

    /**
     * 判断键是否存在（未过期）
     *
     * @param key 存储键
     * @return 是否存在
     */
    boolean has(String key);

    /**
     * 批量读取
     *
     * @param keys 存储键集合
     * @return 命中的键值对，未命中的键不出现在结果中
     */
    default Map<String, byte[]> getMultiple(Collection<String> keys) {
        Map<String, byte[]> result = new LinkedHashMap<>();
        for (String key : keys) {
            byte[] value = get(key);
            if (value != null) {
                result.put(key, value);
            }
        }
        return result;
    }

    /**
     * 批量写入
     *
     * @param values 键值对
     * @param ttl    存活时间
     * @return 全部写入成功返回 true
     */
    default boolean setMultiple(Map<String, byte[]> values, Duration ttl) {
        boolean success = true;
        for (Map.Entry<String, byte[]> entry : values.entrySet()) {
            success &= set(entry.getKey(), entry.getValue(), ttl);
        }
        return success;
    }

    /**
     * 批量删除
     *
     * @param keys 存储键集合
     * @return 全部删除成功返回 true
     */
    default boolean deleteMultiple(Collection<String> keys) {
        boolean success = true;
        for (String key : keys) {
            success &= delete(key);
        }
        return success;
    }

    /**
     * Store 名称（用于日志）
     *
     * @return 名称
     */
    String getName();
}
