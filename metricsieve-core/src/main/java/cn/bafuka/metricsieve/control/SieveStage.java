package cn.bafuka.metricsieve.control;

import cn.bafuka.metricsieve.core.Sample;
import cn.bafuka.metricsieve.core.SieveStats;
import cn.bafuka.metricsieve.dataplane.SampleHistory;
import cn.bafuka.metricsieve.dataplane.SampleSieve;
import cn.bafuka.metricsieve.model.MetricBatch;
import cn.bafuka.metricsieve.model.SieveRule;
import cn.bafuka.metricsieve.pipeline.MetricsFrequencyProcessor;

/**
 * 筛选阶段
 * 一个阶段独占一份采样历史、一个采样点筛选器和一个批处理器，互不共享状态
 */
public class SieveStage {

    private final SieveRule rule;

    private final SampleHistory history;

    private final SampleSieve sampleSieve;

    private final MetricsFrequencyProcessor processor;

    public SieveStage(SieveRule rule,
                      SampleHistory history,
                      SampleSieve sampleSieve,
                      MetricsFrequencyProcessor processor) {
        this.rule = rule;
        this.history = history;
        this.sampleSieve = sampleSieve;
        this.processor = processor;
    }

    public String getName() {
        return rule.getStage();
    }

    public SieveRule getRule() {
        return rule;
    }

    /**
     * 筛选一批指标
     */
    public MetricBatch process(MetricBatch batch) {
        return processor.process(batch);
    }

    /**
     * 筛选单个采样点
     */
    public boolean sift(String identity, Sample sample) {
        return sampleSieve.sift(identity, sample);
    }

    public SieveStats getStats() {
        return sampleSieve.getStats();
    }

    /**
     * 当前跟踪的指标数量
     */
    public int getTrackedMetrics() {
        return history.size();
    }

    public void shutdown() {
        history.shutdown();
    }
}
