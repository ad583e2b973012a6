package cn.bafuka.metricsieve.spi.impl;

import cn.bafuka.metricsieve.config.MetricSieveProperties;
import cn.bafuka.metricsieve.model.SieveRule;
import cn.bafuka.metricsieve.spi.ConfigSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 本地配置源
 * 从 metricsieve.rules 读取筛选规则，启动时推送一次
 */
@Slf4j
public class LocalYamlConfigSource implements ConfigSource {

    private final MetricSieveProperties properties;

    private Consumer<List<SieveRule>> listener;

    public LocalYamlConfigSource(MetricSieveProperties properties) {
        this.properties = properties;
    }

    @Override
    public void subscribe(Consumer<List<SieveRule>> listener) {
        this.listener = listener;

        List<SieveRule> rules = getCurrentRules();
        log.info("从本地配置读取到 {} 条筛选规则: stages={}", rules.size(), stageNames(rules));

        if (listener != null && !rules.isEmpty()) {
            listener.accept(rules);
        }
    }

    @Override
    public List<SieveRule> getCurrentRules() {
        if (properties == null || properties.getRules() == null) {
            return new ArrayList<>();
        }

        // 名称非法的规则照样交出去，由 SieveManager 校验并记录错误
        List<SieveRule> unnamed = new ArrayList<>();
        Map<String, SieveRule> byStage = new LinkedHashMap<>();
        for (SieveRule rule : properties.getRules()) {
            if (rule == null) {
                log.warn("跳过空的筛选规则");
                continue;
            }

            SieveRule normalized = normalize(rule);
            String stage = normalized.getStage();
            if (stage == null || stage.isEmpty()) {
                unnamed.add(normalized);
                continue;
            }

            if (byStage.containsKey(stage)) {
                log.warn("阶段名称重复，后定义的规则生效: stage={}", stage);
            }
            byStage.put(stage, normalized);
        }

        List<SieveRule> rules = new ArrayList<>(byStage.values());
        rules.addAll(unnamed);
        return rules;
    }

    @Override
    public void shutdown() {
        log.info("关闭 LocalYamlConfigSource");
        listener = null;
    }

    @Override
    public String getType() {
        return "local";
    }

    /**
     * 复制规则：阶段名称去掉首尾空白，缺省的配置段按默认值补全
     */
    private static SieveRule normalize(SieveRule rule) {
        String stage = rule.getStage() == null ? null : rule.getStage().trim();

        SieveRule.ReportConfig report;
        if (rule.getReport() == null) {
            log.info("筛选规则缺少 report 配置，使用默认值: stage={}", stage);
            report = new SieveRule.ReportConfig();
        } else {
            report = rule.getReport().toBuilder().build();
        }

        SieveRule.HistoryConfig history;
        if (rule.getHistory() == null) {
            log.info("筛选规则缺少 history 配置，使用默认值: stage={}", stage);
            history = new SieveRule.HistoryConfig();
        } else {
            history = rule.getHistory().toBuilder().build();
        }

        return rule.toBuilder()
                .stage(stage)
                .report(report)
                .history(history)
                .build();
    }

    private static List<String> stageNames(List<SieveRule> rules) {
        List<String> names = new ArrayList<>();
        for (SieveRule rule : rules) {
            names.add(rule.getStage());
        }
        return names;
    }
}
