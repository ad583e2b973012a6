package cn.bafuka.metricsieve.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 同一资源（主机、进程、容器等）上报的指标
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceMetrics {

    /**
     * 资源属性
     */
    @Builder.Default
    private Map<String, String> resource = new LinkedHashMap<>();

    @Builder.Default
    private List<ScopeMetrics> scopeMetrics = new ArrayList<>();
}
