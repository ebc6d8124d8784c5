package cn.bafuka.tagcache.guard.impl;

import cn.bafuka.tagcache.guard.StampedeGuard;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 分布式防击穿守卫
 * 基于 Redisson 分布式锁；获取锁超时或被中断时降级为直接执行，缓存层不阻塞业务
 */
@Slf4j
public class RedissonStampedeGuard implements StampedeGuard {

    /**
     * Redisson 客户端
     */
    private final RedissonClient redissonClient;

    /**
     * 锁等待时间
     */
    private final Duration waitTime;

    /**
     * 锁租约时间
     */
    private final Duration leaseTime;

    public RedissonStampedeGuard(RedissonClient redissonClient, Duration waitTime, Duration leaseTime) {
        this.redissonClient = redissonClient;
        this.waitTime = waitTime;
        this.leaseTime = leaseTime;
    }

    @Override
    public <T> T execute(String key, Supplier<T> action) {
        RLock lock = redissonClient.getLock(getLockKey(key));

        boolean locked;
        try {
            locked = lock.tryLock(waitTime.toMillis(), leaseTime.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("获取防击穿锁被中断，直接回源: key={}", key);
            return action.get();
        } catch (RuntimeException e) {
            log.warn("获取防击穿锁失败，直接回源: key={}, error={}", key, e.getMessage());
            return action.get();
        }

        if (!locked) {
            log.warn("等待防击穿锁超时，直接回源: key={}, waitMs={}", key, waitTime.toMillis());
            return action.get();
        }

        try {
            return action.get();
        } finally {
            unlockQuietly(lock, key);
        }
    }

    /**
     * 获取分布式锁的键
     *
     * @param key 缓存键
     * @return 锁键
     */
    String getLockKey(String key) {
        return "lock:" + key;
    }

    private void unlockQuietly(RLock lock, String key) {
        try {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        } catch (RuntimeException e) {
            // 租约已过期时 unlock 会失败，锁已自动释放
            log.warn("释放防击穿锁失败: key={}, error={}", key, e.getMessage());
        }
    }
}
