package cn.bafuka.metricsieve.dataplane.impl;

import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Instant;

/**
 * 采样点过期策略
 * 存活时间从真实写入时间算起；写入时清扫时钟可能落后于真实时间，这里把落后量补上
 */
public class SampleExpiry implements Expiry<Instant, Double> {

    /**
     * 缓存能接受的最长存活时间
     */
    private static final long MAXIMUM_EXPIRY = Long.MAX_VALUE >> 1;

    private final long ttlNanos;

    private final SweepTicker ticker;

    public SampleExpiry(long ttlNanos, SweepTicker ticker) {
        this.ttlNanos = ttlNanos;
        this.ticker = ticker;
    }

    @Override
    public long expireAfterCreate(Instant key, Double value, long currentTime) {
        return saturatedAdd(ttlNanos, ticker.lag());
    }

    @Override
    public long expireAfterUpdate(Instant key, Double value, long currentTime, long currentDuration) {
        // 覆盖写重新计时
        return saturatedAdd(ttlNanos, ticker.lag());
    }

    @Override
    public long expireAfterRead(Instant key, Double value, long currentTime, long currentDuration) {
        return currentDuration;
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return (sum < 0 || sum > MAXIMUM_EXPIRY) ? MAXIMUM_EXPIRY : sum;
    }
}
