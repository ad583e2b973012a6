package cn.bafuka.metricsieve.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 指标
 * 指标名称即筛选引擎中的指标标识
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Metric {

    private String name;

    private String description;

    private String unit;

    @Builder.Default
    private MetricType type = MetricType.GAUGE;

    /**
     * 数据点，按到达顺序排列
     */
    @Builder.Default
    private List<NumberDataPoint> dataPoints = new ArrayList<>();
}
