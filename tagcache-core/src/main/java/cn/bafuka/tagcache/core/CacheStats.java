package cn.bafuka.tagcache.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存统计信息快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long hitCount;
    private long missCount;
    private long setCount;
    private long deleteCount;
    private long errorCount;

    /**
     * 计算命中率
     *
     * @return 命中率（0.0 ~ 1.0），尚无请求时为 0
     */
    public double hitRate() {
        long requestCount = hitCount + missCount;
        return requestCount == 0 ? 0.0 : (double) hitCount / requestCount;
    }
}
