package cn.bafuka.tagcache.core;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.function.Supplier;

/**
 * 标签缓存
 * 条目与一组标签绑定，失效某个标签后所有与之关联的条目都不再可见
 *
 * <p>标签集合会被规整（去空白、去重、排序），所以标签的书写顺序不影响寻址。
 * 空标签集合视为编程错误，抛出 {@link IllegalArgumentException}。
 */
public interface TaggedCache {

    /**
     * 绑定一组标签
     *
     * @param tags 标签
     * @return 标签作用域
     */
    default TagScope tags(String... tags) {
        return new TagScope(this, Arrays.asList(tags));
    }

    /**
     * 读取标签缓存；任一标签尚无版本令牌时直接视为未命中
     *
     * @param tags 标签集合
     * @param key  逻辑键
     * @param type 值类型
     * @param <T>  值类型
     * @return 缓存值，未命中返回 null
     */
    <T> T get(Collection<String> tags, String key, Type type);

    /**
     * 写入标签缓存，缺失的标签令牌会被创建
     *
     * @param tags  标签集合
     * @param key   逻辑键
     * @param value 值
     * @param ttl   存活时间，null 使用默认 TTL
     * @return 是否写入成功
     */
    boolean set(Collection<String> tags, String key, Object value, Duration ttl);

    /**
     * 删除当前标签版本下的条目
     *
     * @param tags 标签集合
     * @param key  逻辑键
     * @return 是否成功
     */
    boolean delete(Collection<String> tags, String key);

    /**
     * 读取标签缓存，未命中时回源并写入
     *
     * @param tags     标签集合
     * @param key      逻辑键
     * @param ttl      存活时间，null 使用默认 TTL
     * @param type     值类型
     * @param producer 回源函数
     * @param <T>      值类型
     * @return 缓存值或新计算的值
     */
    <T> T remember(Collection<String> tags, String key, Duration ttl, Type type, Supplier<T> producer);

    /**
     * 与 {@link #remember} 相同，但回源在防击穿守卫内执行
     *
     * @param tags     标签集合
     * @param key      逻辑键
     * @param ttl      存活时间，null 使用默认 TTL
     * @param type     值类型
     * @param producer 回源函数
     * @param <T>      值类型
     * @return 缓存值或新计算的值
     */
    <T> T rememberWithLock(Collection<String> tags, String key, Duration ttl, Type type, Supplier<T> producer);

    /**
     * 失效标签：为每个标签生成新的版本令牌
     *
     * @param tags 标签集合
     * @return 所有令牌都写入成功返回 true
     */
    boolean flush(Collection<String> tags);

    /**
     * 失效标签
     *
     * @param tags 标签
     * @return 所有令牌都写入成功返回 true
     */
    default boolean flush(String... tags) {
        return flush(Arrays.asList(tags));
    }
}
