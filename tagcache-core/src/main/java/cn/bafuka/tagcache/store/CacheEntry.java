package cn.bafuka.tagcache.store;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;

/**
 * 缓存条目
 * 只在 Store 实现内部使用，创建后不可修改；数据数组由 Store 在边界处复制
 */
@Getter
@AllArgsConstructor
public class CacheEntry {

    /**
     * 永不过期
     */
    public static final long NEVER = 0L;

    /**
     * 数据
     */
    private final byte[] value;

    /**
     * 过期时间（毫秒时间戳），0 表示永不过期
     */
    private final long expiresAt;

    public static CacheEntry of(byte[] value, Duration ttl, Clock clock) {
        return new CacheEntry(value, expiresAt(ttl, clock));
    }

    /**
     * 将相对 TTL 转换为绝对过期时间
     *
     * @param ttl   存活时间，null 或 0 表示永不过期
     * @param clock 时钟
     * @return 过期时间戳
     */
    public static long expiresAt(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return NEVER;
        }
        return clock.millis() + ttl.toMillis();
    }

    public boolean isExpired(long now) {
        return expiresAt != NEVER && expiresAt <= now;
    }
}
