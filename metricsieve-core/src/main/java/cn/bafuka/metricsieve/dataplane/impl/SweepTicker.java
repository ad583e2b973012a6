package cn.bafuka.metricsieve.dataplane.impl;

import com.github.benmanes.caffeine.cache.Ticker;

/**
 * 清扫时钟
 * 只在清扫时向前推进，两次清扫之间缓存看到的时间保持不变，
 * 因此过期的采样点直到下一次清扫才会消失
 */
public class SweepTicker implements Ticker {

    private final Ticker source;

    private volatile long sweepTime;

    public SweepTicker(Ticker source) {
        this.source = source;
        this.sweepTime = source.read();
    }

    @Override
    public long read() {
        return sweepTime;
    }

    /**
     * 推进到真实时间
     *
     * @return 推进后的时间
     */
    public long advance() {
        sweepTime = source.read();
        return sweepTime;
    }

    /**
     * 真实时间领先清扫时钟的纳秒数
     */
    public long lag() {
        return Math.max(0L, source.read() - sweepTime);
    }
}
