package cn.bafuka.metricsieve.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 数值型数据点
 * 值可以是整数或浮点数，筛选时统一按 double 处理
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NumberDataPoint {

    /**
     * 数据点时间戳
     */
    private Instant timestamp;

    /**
     * 值类型
     */
    @Builder.Default
    private ValueType valueType = ValueType.DOUBLE;

    private long intValue;

    private double doubleValue;

    public static NumberDataPoint ofDouble(Instant timestamp, double value) {
        return NumberDataPoint.builder()
                .timestamp(timestamp)
                .valueType(ValueType.DOUBLE)
                .doubleValue(value)
                .build();
    }

    public static NumberDataPoint ofInt(Instant timestamp, long value) {
        return NumberDataPoint.builder()
                .timestamp(timestamp)
                .valueType(ValueType.INT)
                .intValue(value)
                .build();
    }

    /**
     * 以 double 形式返回数据点的值
     */
    public double asDouble() {
        return valueType == ValueType.INT ? (double) intValue : doubleValue;
    }

    public enum ValueType {
        INT,
        DOUBLE
    }
}
