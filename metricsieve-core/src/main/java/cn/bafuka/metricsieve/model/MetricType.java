package cn.bafuka.metricsieve.model;

/**
 * 指标类型
 * 只有 GAUGE 会被筛选，其余类型原样放行
 */
public enum MetricType {
    GAUGE,
    SUM,
    HISTOGRAM,
    SUMMARY
}
