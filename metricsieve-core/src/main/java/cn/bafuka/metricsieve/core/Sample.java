package cn.bafuka.metricsieve.core;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * 单个指标采样点
 * 不可变值对象：时间戳 + 64 位浮点值，NaN 是合法值
 */
@Value
@AllArgsConstructor(staticName = "of")
public class Sample {

    /**
     * 采样时间（纳秒精度）
     */
    Instant timestamp;

    /**
     * 采样值
     */
    double value;

    public boolean isNaN() {
        return Double.isNaN(value);
    }
}
