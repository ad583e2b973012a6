package cn.bafuka.metricsieve.pipeline.impl;

import cn.bafuka.metricsieve.core.Sample;
import cn.bafuka.metricsieve.dataplane.SampleSieve;
import cn.bafuka.metricsieve.model.Metric;
import cn.bafuka.metricsieve.model.MetricType;
import cn.bafuka.metricsieve.model.NumberDataPoint;
import cn.bafuka.metricsieve.pipeline.MetricSieve;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 只筛选 GAUGE 指标，其余类型原样放行
 * 数据点按到达顺序逐个交给采样点筛选器；
 * 缺少时间戳的数据点无法参与统计，原样保留；null 数据点直接移除
 */
@Slf4j
public class GaugeMetricSieve implements MetricSieve {

    private final SampleSieve sampleSieve;

    public GaugeMetricSieve(SampleSieve sampleSieve) {
        this.sampleSieve = sampleSieve;
    }

    @Override
    public boolean sift(Metric metric) {
        if (metric.getType() != MetricType.GAUGE) {
            return false;
        }

        List<NumberDataPoint> dataPoints = metric.getDataPoints();
        if (dataPoints == null || dataPoints.isEmpty()) {
            return true;
        }

        String name = metric.getName();
        if (name == null) {
            log.warn("GAUGE 指标缺少名称，跳过筛选: dataPoints={}", dataPoints.size());
            return false;
        }

        dataPoints.removeIf(dataPoint -> dataPoint == null
                || (hasTimestamp(name, dataPoint)
                && sampleSieve.sift(name, Sample.of(dataPoint.getTimestamp(), dataPoint.asDouble()))));

        return dataPoints.isEmpty();
    }

    private static boolean hasTimestamp(String name, NumberDataPoint dataPoint) {
        if (dataPoint.getTimestamp() == null) {
            log.debug("数据点缺少时间戳，原样保留: metric={}", name);
            return false;
        }
        return true;
    }
}
