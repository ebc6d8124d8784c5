package cn.bafuka.tagcache.serializer.impl;

import cn.bafuka.tagcache.exception.TagCacheException;
import cn.bafuka.tagcache.serializer.ValueSerializer;
import com.alibaba.fastjson.JSON;

import java.lang.reflect.Type;

/**
 * 基于 fastjson 的序列化器
 * 数值以 JSON 数字（十进制文本）存储，与 Store 原生自增的格式一致
 */
public class FastjsonValueSerializer implements ValueSerializer {

    @Override
    public byte[] serialize(Object value) {
        return JSON.toJSONBytes(value);
    }

    @Override
    public <T> T deserialize(String key, byte[] data, Type type) {
        try {
            return JSON.parseObject(data, type);
        } catch (RuntimeException e) {
            throw TagCacheException.corruptEntry(key, e);
        }
    }
}
