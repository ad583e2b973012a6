package cn.bafuka.metricsieve.dataplane.rule;

import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * 采样窗口的统计计算
 * 常量判定、四分位数、波动量，都作用于单个指标的窗口快照
 */
public final class SampleStatistics {

    /**
     * 常量判定使用的绝对误差
     */
    public static final double FLOAT64_EQUALITY_THRESHOLD = 1e-9;

    private SampleStatistics() {
    }

    public static boolean almostEqual(double a, double b) {
        return Math.abs(a - b) <= FLOAT64_EQUALITY_THRESHOLD;
    }

    /**
     * 窗口内所有值是否都与给定值相等（绝对误差 1e-9 以内）
     */
    public static boolean isConstant(double value, Collection<Double> values) {
        for (double v : values) {
            if (!almostEqual(value, v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 计算第一、第三四分位数（最近秩：升序排序后取 n/4 与 3n/4 下标）
     *
     * @param values 非空的值集合
     * @return 四分位数
     */
    public static Quartiles quartiles(Collection<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute quartiles of an empty sample window");
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();
        return new Quartiles(sorted.get(n / 4), sorted.get(3 * n / 4));
    }

    /**
     * 计算波动量：按时间排序后相邻值差的绝对值之和
     *
     * @param points 按时间升序的采样点
     * @return 波动量
     */
    public static double variation(NavigableMap<Instant, Double> points) {
        double variation = 0.0;
        Double previous = null;
        for (Map.Entry<Instant, Double> entry : points.entrySet()) {
            double current = entry.getValue();
            if (previous != null) {
                variation += Math.abs(current - previous);
            }
            previous = current;
        }
        return variation;
    }

    public static boolean withinBounds(Collection<Double> values, double lowerBound, double upperBound) {
        for (double v : values) {
            if (v < lowerBound || v > upperBound) {
                return false;
            }
        }
        return true;
    }

    /**
     * 判断窗口是否为低信息量：
     * 1) 没有大的变化，即没有 IQR 离群值
     * 2) 振荡很小，即波动量低于 IQR 的一定倍数
     *
     * @param points            按时间升序的采样点，非空
     * @param iqrAnomalyCoef    IQR 异常系数
     * @param variationIqrCoef  波动 / IQR 阈值系数
     */
    public static boolean isLowInformation(NavigableMap<Instant, Double> points,
                                           double iqrAnomalyCoef,
                                           double variationIqrCoef) {
        Collection<Double> values = points.values();
        Quartiles quartiles = quartiles(values);
        double iqr = quartiles.iqr();

        boolean noAnomaly = withinBounds(values,
                quartiles.getQ1() - iqrAnomalyCoef * iqr,
                quartiles.getQ3() + iqrAnomalyCoef * iqr);

        return noAnomaly && variation(points) < variationIqrCoef * iqr;
    }

    /**
     * 第一、第三四分位数
     */
    @Value
    public static class Quartiles {
        double q1;
        double q3;

        public double iqr() {
            return q3 - q1;
        }
    }
}
