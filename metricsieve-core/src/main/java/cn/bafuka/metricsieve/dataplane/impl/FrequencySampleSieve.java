package cn.bafuka.metricsieve.dataplane.impl;

import cn.bafuka.metricsieve.core.Sample;
import cn.bafuka.metricsieve.core.SieveStats;
import cn.bafuka.metricsieve.dataplane.SampleHistory;
import cn.bafuka.metricsieve.dataplane.SampleSieve;
import cn.bafuka.metricsieve.dataplane.rule.SiftContext;
import cn.bafuka.metricsieve.dataplane.rule.SiftRule;
import cn.bafuka.metricsieve.dataplane.rule.SiftVerdict;
import cn.bafuka.metricsieve.exception.SieveConfigException;
import cn.bafuka.metricsieve.model.SieveRule;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 按上报频率筛选采样点
 * 指标分三类，各自有最低上报频率：
 * 1) 常量指标
 * 2) 低信息量指标，即没有 IQR 离群值且波动小
 * 3) 其他指标
 * 同一实例上的 sift 调用串行执行
 */
@Slf4j
public class FrequencySampleSieve implements SampleSieve {

    private static final SiftRule[] RULE_CHAIN = SiftRule.values();

    /**
     * 阶段名称
     */
    private final String stage;

    /**
     * 分类与限频配置（构造时复制，之后不可变）
     */
    private final SieveRule.ReportConfig config;

    /**
     * 采样历史
     */
    private final SampleHistory history;

    /**
     * 最近一次转发时间
     * Key: 指标标识
     * Value: 最近转发的采样点时间戳
     */
    private final Map<String, Instant> lastForwarded = new HashMap<>();

    private final AtomicLong keptCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong nanCount = new AtomicLong();
    private final Map<SiftRule, AtomicLong> decisions = new EnumMap<>(SiftRule.class);

    public FrequencySampleSieve(String stage, SieveRule.ReportConfig config, SampleHistory history) {
        validateConfig(stage, config);
        this.stage = stage;
        this.config = config.toBuilder().build();
        this.history = history;
        for (SiftRule rule : RULE_CHAIN) {
            decisions.put(rule, new AtomicLong());
        }

        log.info("构建采样点筛选器: stage={}, minPointAccumulationTime={}, constant={}, lowInfo={}, max={}, iqrAnomalyCoefficient={}, variationIqrThresholdCoefficient={}",
                stage, this.config.getMinPointAccumulationTime(), this.config.getConstantMetricsReportFrequency(),
                this.config.getLowInfoMetricsReportFrequency(), this.config.getMaxReportFrequency(),
                this.config.getIqrAnomalyCoefficient(), this.config.getVariationIqrThresholdCoefficient());
    }

    @Override
    public synchronized boolean sift(String identity, Sample sample) {
        NavigableMap<Instant, Double> snapshot;
        if (sample.isNaN()) {
            // NaN 不进入历史，避免污染统计
            nanCount.incrementAndGet();
            snapshot = new TreeMap<>();
        } else {
            snapshot = history.list(identity);
            history.register(identity, sample);
            snapshot.put(sample.getTimestamp(), sample.getValue());
        }

        SiftContext context = new SiftContext(identity, sample, snapshot, lastForwarded.get(identity), config);
        for (SiftRule rule : RULE_CHAIN) {
            SiftVerdict verdict = rule.evaluate(context);
            if (verdict == SiftVerdict.NEXT) {
                continue;
            }

            if (verdict.isMarkForwarded()) {
                lastForwarded.put(identity, sample.getTimestamp());
            }
            record(rule, verdict);

            log.debug("筛选结果: stage={}, metric={}, timestamp={}, value={}, rule={}({}), verdict={}",
                    stage, identity, sample.getTimestamp(), sample.getValue(), rule, rule.getDescription(), verdict);
            return verdict.isDrop();
        }

        throw new IllegalStateException("Sift rule chain ended without a verdict for metric " + identity);
    }

    @Override
    public SieveStats getStats() {
        Map<SiftRule, Long> snapshot = new EnumMap<>(SiftRule.class);
        decisions.forEach((rule, count) -> snapshot.put(rule, count.get()));
        return SieveStats.builder()
                .keptCount(keptCount.get())
                .droppedCount(droppedCount.get())
                .nanCount(nanCount.get())
                .decisions(snapshot)
                .build();
    }

    /**
     * 获取指标最近一次转发时间
     *
     * @param identity 指标标识
     * @return 最近转发时间，从未见过该指标时返回 null
     */
    public synchronized Instant getLastForwarded(String identity) {
        return lastForwarded.get(identity);
    }

    public SieveRule.ReportConfig getConfig() {
        return config.toBuilder().build();
    }

    private void record(SiftRule rule, SiftVerdict verdict) {
        decisions.get(rule).incrementAndGet();
        if (verdict.isDrop()) {
            droppedCount.incrementAndGet();
        } else {
            keptCount.incrementAndGet();
        }
    }

    /**
     * 验证分类与限频配置
     *
     * @throws SieveConfigException 如果配置无效
     */
    private static void validateConfig(String stage, SieveRule.ReportConfig config) {
        if (config == null) {
            throw new SieveConfigException(stage, "report", SieveConfigException.Reason.MISSING, null);
        }

        Duration accumulation = config.getMinPointAccumulationTime();
        if (accumulation == null) {
            throw new SieveConfigException(stage, "report.minPointAccumulationTime",
                    SieveConfigException.Reason.MISSING, null);
        }
        if (accumulation.isNegative()) {
            throw new SieveConfigException(stage, "report.minPointAccumulationTime",
                    SieveConfigException.Reason.NEGATIVE, accumulation);
        }

        requirePositive(stage, "report.constantMetricsReportFrequency", config.getConstantMetricsReportFrequency());
        requirePositive(stage, "report.lowInfoMetricsReportFrequency", config.getLowInfoMetricsReportFrequency());
        requirePositive(stage, "report.maxReportFrequency", config.getMaxReportFrequency());

        requireCoefficient(stage, "report.iqrAnomalyCoefficient", config.getIqrAnomalyCoefficient());
        requireCoefficient(stage, "report.variationIqrThresholdCoefficient", config.getVariationIqrThresholdCoefficient());

        if (config.getConstantMetricsReportFrequency().compareTo(config.getMaxReportFrequency()) < 0) {
            log.warn("constantMetricsReportFrequency ({}) 小于 maxReportFrequency ({})，stage {} 的常量指标会比普通指标上报得更频繁",
                    config.getConstantMetricsReportFrequency(), config.getMaxReportFrequency(), stage);
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

    private static void requireCoefficient(String stage, String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new SieveConfigException(stage, field, SieveConfigException.Reason.NOT_FINITE, value);
        }
        if (value < 0) {
            throw new SieveConfigException(stage, field, SieveConfigException.Reason.NEGATIVE, value);
        }
    }
}
