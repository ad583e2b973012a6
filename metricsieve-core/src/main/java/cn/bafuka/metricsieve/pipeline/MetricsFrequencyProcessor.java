package cn.bafuka.metricsieve.pipeline;

import cn.bafuka.metricsieve.model.Metric;
import cn.bafuka.metricsieve.model.MetricBatch;
import cn.bafuka.metricsieve.model.ResourceMetrics;
import cn.bafuka.metricsieve.model.ScopeMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * 指标批处理器
 * 遍历 resource -> scope -> metric，移除筛选器要求移除的指标，再逐层移除变空的容器；
 * 为 null 的子列表按空容器处理
 */
@Slf4j
public class MetricsFrequencyProcessor {

    private final MetricSieve sieve;

    public MetricsFrequencyProcessor(MetricSieve sieve) {
        this.sieve = sieve;
    }

    /**
     * 原地筛选一批指标
     *
     * @param batch 指标批次，可以为 null
     * @return 筛选后的批次（与入参是同一对象；入参为 null 时返回空批次）
     */
    public MetricBatch process(MetricBatch batch) {
        if (batch == null || batch.getResourceMetrics() == null) {
            return new MetricBatch();
        }

        int before = batch.dataPointCount();
        int removedMetrics = 0;

        List<ResourceMetrics> resources = batch.getResourceMetrics();
        resources.removeIf(Objects::isNull);
        for (ResourceMetrics resourceMetrics : resources) {
            List<ScopeMetrics> scopes = resourceMetrics.getScopeMetrics();
            if (scopes == null) {
                continue;
            }
            for (ScopeMetrics scopeMetrics : scopes) {
                List<Metric> metrics = scopeMetrics == null ? null : scopeMetrics.getMetrics();
                if (metrics == null) {
                    continue;
                }
                int size = metrics.size();
                metrics.removeIf(metric -> metric == null || sieve.sift(metric));
                removedMetrics += size - metrics.size();
            }
            scopes.removeIf(scopeMetrics -> scopeMetrics == null || isEmpty(scopeMetrics.getMetrics()));
        }
        resources.removeIf(resourceMetrics -> isEmpty(resourceMetrics.getScopeMetrics()));

        log.debug("指标批次筛选完成: dataPoints {} -> {}, removedMetrics={}",
                before, batch.dataPointCount(), removedMetrics);
        return batch;
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }
}
