package cn.bafuka.metricsieve.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 同一埋点库（scope）产生的一组指标
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScopeMetrics {

    private String scopeName;

    private String scopeVersion;

    @Builder.Default
    private List<Metric> metrics = new ArrayList<>();
}
