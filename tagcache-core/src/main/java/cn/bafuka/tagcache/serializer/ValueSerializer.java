package cn.bafuka.tagcache.serializer;

import java.lang.reflect.Type;

/**
 * 缓存值序列化器
 */
public interface ValueSerializer {

    /**
     * 序列化
     *
     * @param value 非空的值
     * @return 字节数组
     */
    byte[] serialize(Object value);

    /**
     * 反序列化
     *
     * @param key  缓存键（用于异常信息）
     * @param data 字节数组
     * @param type 目标类型，支持泛型
     * @param <T>  值类型
     * @return 值
     * @throws cn.bafuka.tagcache.exception.TagCacheException 数据损坏时（CORRUPT_ENTRY）
     */
    <T> T deserialize(String key, byte[] data, Type type);
}
