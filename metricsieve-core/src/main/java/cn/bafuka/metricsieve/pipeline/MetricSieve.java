package cn.bafuka.metricsieve.pipeline;

import cn.bafuka.metricsieve.model.Metric;

/**
 * 指标级筛选器接口
 */
public interface MetricSieve {

    /**
     * 筛选指标的数据点
     * 实现可以原地移除部分数据点
     *
     * @param metric 指标
     * @return true 表示整个指标应该被移除
     */
    boolean sift(Metric metric);
}
