package cn.bafuka.metricsieve.config;

import cn.bafuka.metricsieve.model.SieveRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * MetricSieve 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "metricsieve")
public class MetricSieveProperties {

    /**
     * 是否启用 MetricSieve
     */
    private boolean enabled = true;

    /**
     * 筛选规则列表，每条规则对应一个阶段
     */
    private List<SieveRule> rules = new ArrayList<>();
}
