package cn.bafuka.tagcache.guard;

import java.util.function.Supplier;

/**
 * 防击穿守卫
 * 同一个键的回源操作在守卫内串行执行
 */
public interface StampedeGuard {

    /**
     * 在键对应的锁内执行操作
     *
     * @param key    缓存键
     * @param action 回源操作（内部应先二次检查缓存）
     * @param <T>    返回值类型
     * @return 操作结果
     */
    <T> T execute(String key, Supplier<T> action);
}
