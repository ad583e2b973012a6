package cn.bafuka.metricsieve.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 筛选阶段规则
 * 对应控制平面的核心配置模型，一条规则构建一个独立的筛选阶段
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SieveRule {

    /**
     * 阶段名称（唯一标识）
     */
    private String stage;

    /**
     * 分类与限频配置
     */
    @Builder.Default
    private ReportConfig report = new ReportConfig();

    /**
     * 采样历史配置
     */
    @Builder.Default
    private HistoryConfig history = new HistoryConfig();

    /**
     * 分类与限频配置
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReportConfig {
        /**
         * 预热时间：累积足够历史之前不做任何过滤
         */
        @Builder.Default
        private Duration minPointAccumulationTime = Duration.ofMinutes(15);

        /**
         * 常量指标的最低上报频率（心跳）
         */
        @Builder.Default
        private Duration constantMetricsReportFrequency = Duration.ofMinutes(5);

        /**
         * 低信息量指标的最低上报频率
         */
        @Builder.Default
        private Duration lowInfoMetricsReportFrequency = Duration.ofMinutes(2);

        /**
         * 其他指标的最低上报频率
         */
        @Builder.Default
        private Duration maxReportFrequency = Duration.ofSeconds(30);

        /**
         * IQR 异常系数，定义无离群值区间
         */
        @Builder.Default
        private double iqrAnomalyCoefficient = 1.5;

        /**
         * 波动 / IQR 阈值系数，定义"低振荡"
         */
        @Builder.Default
        private double variationIqrThresholdCoefficient = 4.0;
    }

    /**
     * 采样历史配置
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HistoryConfig {
        /**
         * 单个采样点的存活时间
         */
        @Builder.Default
        private Duration dataPointExpirationTime = Duration.ofHours(1);

        /**
         * 过期采样点的清扫周期
         */
        @Builder.Default
        private Duration dataPointCacheCleanupInterval = Duration.ofMinutes(10);

        /**
         * 空指标的清扫周期
         */
        @Builder.Default
        private Duration metricCacheCleanupInterval = Duration.ofHours(3);
    }
}
