package cn.bafuka.metricsieve.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一批指标数据
 * 层级结构：resource -> scope -> metric -> data point
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricBatch {

    @Builder.Default
    private List<ResourceMetrics> resourceMetrics = new ArrayList<>();

    /**
     * 统计整批数据中的数据点数量
     */
    public int dataPointCount() {
        if (resourceMetrics == null) {
            return 0;
        }
        int count = 0;
        for (ResourceMetrics rm : resourceMetrics) {
            if (rm == null || rm.getScopeMetrics() == null) {
                continue;
            }
            for (ScopeMetrics sm : rm.getScopeMetrics()) {
                if (sm == null || sm.getMetrics() == null) {
                    continue;
                }
                for (Metric metric : sm.getMetrics()) {
                    if (metric != null && metric.getDataPoints() != null) {
                        count += metric.getDataPoints().size();
                    }
                }
            }
        }
        return count;
    }
}
