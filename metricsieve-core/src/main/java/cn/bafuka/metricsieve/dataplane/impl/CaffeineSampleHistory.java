package cn.bafuka.metricsieve.dataplane.impl;

import cn.bafuka.metricsieve.core.Sample;
import cn.bafuka.metricsieve.dataplane.SampleHistory;
import cn.bafuka.metricsieve.exception.SieveConfigException;
import cn.bafuka.metricsieve.model.SieveRule;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 采样历史存储实现
 * 每个指标一个 Caffeine 缓存，采样点按存活时间过期；
 * 过期只在清扫时生效，读取不会自行过滤过期采样点
 */
@Slf4j
public class CaffeineSampleHistory implements SampleHistory {

    /**
     * 多指标缓存容器
     * Key: 指标标识
     * Value: 该指标的采样点缓存（时间戳 -> 值）
     */
    private final Map<String, Cache<Instant, Double>> internalCaches = new ConcurrentHashMap<>();

    /**
     * 阶段名称
     */
    private final String stage;

    /**
     * 历史配置
     */
    private final SieveRule.HistoryConfig config;

    /**
     * 清扫时钟，所有指标缓存共用
     */
    private final SweepTicker sweepTicker;

    /**
     * 采样点过期策略
     */
    private final SampleExpiry expiry;

    /**
     * 清扫调度器，initialize 时创建
     */
    private ScheduledExecutorService sweepScheduler;

    /**
     * 是否已初始化
     */
    private volatile boolean initialized = false;

    public CaffeineSampleHistory(String stage, SieveRule.HistoryConfig config) {
        this(stage, config, Ticker.systemTicker());
    }

    public CaffeineSampleHistory(String stage, SieveRule.HistoryConfig config, Ticker ticker) {
        validateConfig(stage, config);
        this.stage = stage;
        this.config = config.toBuilder().build();
        this.sweepTicker = new SweepTicker(ticker);
        this.expiry = new SampleExpiry(toNanos(this.config.getDataPointExpirationTime()), sweepTicker);
    }

    @Override
    public void register(String identity, Sample sample) {
        internalCaches.compute(identity, (key, cache) -> {
            if (cache == null) {
                cache = buildCache();
            }
            cache.put(sample.getTimestamp(), sample.getValue());
            return cache;
        });
    }

    @Override
    public NavigableMap<Instant, Double> list(String identity) {
        Cache<Instant, Double> cache = internalCaches.get(identity);
        if (cache == null) {
            return new TreeMap<>();
        }
        return new TreeMap<>(cache.asMap());
    }

    @Override
    public void cleanup() {
        int removed = 0;
        for (String identity : internalCaches.keySet()) {
            Cache<Instant, Double> remaining = internalCaches.computeIfPresent(identity,
                    (key, cache) -> cache.estimatedSize() == 0 ? null : cache);
            if (remaining == null) {
                removed++;
            }
        }

        log.debug("空指标清理完成: stage={}, removed={}, remaining={}", stage, removed, internalCaches.size());
    }

    @Override
    public void expireSamples() {
        sweepTicker.advance();
        for (Cache<Instant, Double> cache : internalCaches.values()) {
            cache.cleanUp();
        }

        log.debug("过期采样点清扫完成: stage={}, metrics={}", stage, internalCaches.size());
    }

    @Override
    public int size() {
        return internalCaches.size();
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            log.debug("SampleHistory already initialized, skipping: stage={}", stage);
            return;
        }

        sweepScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "metricsieve-sweep-" + stage);
            thread.setDaemon(true);
            return thread;
        });

        long dataPointInterval = toNanos(config.getDataPointCacheCleanupInterval());
        long metricInterval = toNanos(config.getMetricCacheCleanupInterval());
        sweepScheduler.scheduleWithFixedDelay(() -> runSweep("expireSamples", this::expireSamples),
                dataPointInterval, dataPointInterval, TimeUnit.NANOSECONDS);
        sweepScheduler.scheduleWithFixedDelay(() -> runSweep("cleanup", this::cleanup),
                metricInterval, metricInterval, TimeUnit.NANOSECONDS);

        initialized = true;
        log.info("采样历史清扫已启动: stage={}, dataPointExpirationTime={}, dataPointCacheCleanupInterval={}, metricCacheCleanupInterval={}",
                stage, config.getDataPointExpirationTime(), config.getDataPointCacheCleanupInterval(),
                config.getMetricCacheCleanupInterval());
    }

    @Override
    public synchronized void shutdown() {
        if (initialized) {
            sweepScheduler.shutdownNow();
            try {
                if (!sweepScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("清扫线程未在 5 秒内退出: stage={}", stage);
                }
            } catch (InterruptedException e) {
                log.warn("等待清扫线程退出时被中断: stage={}", stage);
                Thread.currentThread().interrupt();
            }
            initialized = false;
        }

        for (Cache<Instant, Double> cache : internalCaches.values()) {
            cache.invalidateAll();
            cache.cleanUp();
        }
        internalCaches.clear();
        log.info("采样历史已关闭: stage={}", stage);
    }

    /**
     * 构建单个指标的采样点缓存
     */
    private Cache<Instant, Double> buildCache() {
        return Caffeine.newBuilder()
                .ticker(sweepTicker)
                .executor(Runnable::run)
                .expireAfter(expiry)
                .build();
    }

    /**
     * 执行一次清扫，异常只记录日志，保证周期任务不被取消
     */
    private void runSweep(String name, Runnable sweep) {
        try {
            sweep.run();
        } catch (RuntimeException e) {
            log.error("清扫任务执行失败: stage={}, task={}", stage, name, e);
        }
    }

    /**
     * 验证历史配置
     *
     * @throws SieveConfigException 如果配置无效
     */
    private static void validateConfig(String stage, SieveRule.HistoryConfig config) {
        if (config == null) {
            throw new SieveConfigException(stage, "history", SieveConfigException.Reason.MISSING, null);
        }
        requirePositive(stage, "history.dataPointExpirationTime", config.getDataPointExpirationTime());
        requirePositive(stage, "history.dataPointCacheCleanupInterval", config.getDataPointCacheCleanupInterval());
        requirePositive(stage, "history.metricCacheCleanupInterval", config.getMetricCacheCleanupInterval());

        if (config.getDataPointCacheCleanupInterval().compareTo(config.getDataPointExpirationTime()) > 0) {
            log.warn("dataPointCacheCleanupInterval ({}) 大于 dataPointExpirationTime ({})，stage {} 的过期采样点可能滞留较久",
                    config.getDataPointCacheCleanupInterval(), config.getDataPointExpirationTime(), stage);
        }
    }

    private static void requirePositive(String stage, String field, Duration value) {
        if (value == null) {
            throw new SieveConfigException(stage, field, SieveConfigException.Reason.MISSING, null);
        }
        if (value.isNegative() || value.isZero()) {
            throw new SieveConfigException(stage, field, SieveConfigException.Reason.NOT_POSITIVE, value);
        }
    }

    private static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
