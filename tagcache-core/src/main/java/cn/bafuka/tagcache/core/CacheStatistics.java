package cn.bafuka.tagcache.core;

import java.util.concurrent.atomic.LongAdder;

/**
 * 缓存计数器
 * 只在进程内存中累计，不持久化
 */
public class CacheStatistics {

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder sets = new LongAdder();
    private final LongAdder deletes = new LongAdder();
    private final LongAdder errors = new LongAdder();

    public void recordHit() {
        hits.increment();
    }

    public void recordMiss() {
        misses.increment();
    }

    public void recordSet() {
        sets.increment();
    }

    public void recordDelete() {
        deletes.increment();
    }

    /**
     * Store 访问失败
     */
    public void recordError() {
        errors.increment();
    }

    public CacheStats snapshot() {
        return CacheStats.builder()
                .hitCount(hits.sum())
                .missCount(misses.sum())
                .setCount(sets.sum())
                .deleteCount(deletes.sum())
                .errorCount(errors.sum())
                .build();
    }

    public void reset() {
        hits.reset();
        misses.reset();
        sets.reset();
        deletes.reset();
        errors.reset();
    }
}
