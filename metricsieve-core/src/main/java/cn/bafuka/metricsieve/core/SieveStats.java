package cn.bafuka.metricsieve.core;

import cn.bafuka.metricsieve.dataplane.rule.SiftRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * 筛选统计信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SieveStats {

    private long keptCount;
    private long droppedCount;
    private long nanCount;

    /**
     * 每条规则做出的判定次数
     */
    @Builder.Default
    private Map<SiftRule, Long> decisions = new EnumMap<>(SiftRule.class);

    /**
     * 计算转发率
     *
     * @return 转发率（0.0 ~ 1.0）
     */
    public double keepRate() {
        long total = keptCount + droppedCount;
        return total == 0 ? 1.0 : (double) keptCount / total;
    }
}
