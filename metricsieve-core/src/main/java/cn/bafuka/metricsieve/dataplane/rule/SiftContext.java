package cn.bafuka.metricsieve.dataplane.rule;

import cn.bafuka.metricsieve.core.Sample;
import cn.bafuka.metricsieve.model.SieveRule;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.NavigableMap;

/**
 * 单次筛选的上下文
 * 在规则链中传递：当前采样点、含当前采样点的窗口快照、最近转发时间
 */
@Getter
@AllArgsConstructor
public class SiftContext {

    /**
     * 频率边界的安全余量，吸收调度与时钟抖动
     */
    public static final Duration SAFETY_INTERVAL = Duration.ofSeconds(1);

    private final String identity;

    private final Sample sample;

    /**
     * 窗口快照，已包含当前采样点；NaN 采样点不读历史，快照为空
     */
    private final NavigableMap<Instant, Double> snapshot;

    /**
     * 最近一次转发时间，首次观测时为 null
     */
    private final Instant lastForwarded;

    private final SieveRule.ReportConfig config;

    /**
     * 窗口中最早的时间戳
     */
    public Instant earliest() {
        return snapshot.firstKey();
    }

    /**
     * 距上次转发是否已超过给定频率（安全余量加在当前采样点一侧）
     */
    public boolean isDue(Duration frequency) {
        return sample.getTimestamp().plus(SAFETY_INTERVAL).isAfter(lastForwarded.plus(frequency));
    }
}
