package cn.bafuka.tagcache.guard.impl;

import cn.bafuka.tagcache.guard.StampedeGuard;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 进程内防击穿守卫
 * 基于分段锁，不同键可能共用一把锁
 */
public class LocalStampedeGuard implements StampedeGuard {

    private static final int DEFAULT_STRIPES = 256;

    private final ReentrantLock[] locks;

    public LocalStampedeGuard() {
        this(DEFAULT_STRIPES);
    }

    public LocalStampedeGuard(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be positive: " + stripes);
        }
        this.locks = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public <T> T execute(String key, Supplier<T> action) {
        ReentrantLock lock = locks[Math.floorMod(key.hashCode(), locks.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
