package cn.bafuka.metricsieve.control.impl;

import cn.bafuka.metricsieve.control.SieveManager;
import cn.bafuka.metricsieve.control.SieveStage;
import cn.bafuka.metricsieve.dataplane.SampleHistory;
import cn.bafuka.metricsieve.dataplane.impl.CaffeineSampleHistory;
import cn.bafuka.metricsieve.dataplane.impl.FrequencySampleSieve;
import cn.bafuka.metricsieve.exception.SieveConfigException;
import cn.bafuka.metricsieve.model.SieveRule;
import cn.bafuka.metricsieve.pipeline.MetricsFrequencyProcessor;
import cn.bafuka.metricsieve.pipeline.impl.GaugeMetricSieve;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 筛选阶段管理器默认实现
 * 负责规则的验证、阶段的构建与销毁
 */
@Slf4j
public class DefaultSieveManager implements SieveManager {

    /**
     * 阶段名称最大长度
     */
    private static final int MAX_STAGE_NAME_LENGTH = 100;

    /**
     * 阶段缓存
     * Key: 阶段名称
     * Value: 阶段实例
     */
    private final Map<String, SieveStage> stageMap = new ConcurrentHashMap<>();

    /**
     * 是否已初始化
     */
    private volatile boolean initialized = false;

    @Override
    public void initialize() {
        if (initialized) {
            log.debug("SieveManager already initialized, skipping");
            return;
        }

        log.info("初始化 SieveManager...");
        initialized = true;
        log.info("SieveManager initialized successfully");
    }

    @Override
    public synchronized void loadRules(List<SieveRule> rules) {
        if (rules == null || rules.isEmpty()) {
            log.warn("No sieve rules to load");
            return;
        }

        log.info("开始加载 {} 条筛选规则...", rules.size());

        int successCount = 0;
        int failureCount = 0;

        for (SieveRule rule : rules) {
            try {
                validateRule(rule);

                SieveStage stage = buildStage(rule);
                SieveStage old = stageMap.put(rule.getStage(), stage);
                if (old != null) {
                    old.shutdown();
                    log.info("筛选阶段已重建: stage={}", rule.getStage());
                }

                successCount++;
                log.info("筛选规则加载成功: stage={}", rule.getStage());

            } catch (SieveConfigException e) {
                failureCount++;
                log.error("筛选规则验证失败，跳过: stage={}, field={}, reason={}, error={}",
                        e.getStage(), e.getField(), e.getReason(), e.getMessage());
            } catch (RuntimeException e) {
                failureCount++;
                log.error("筛选规则加载失败，跳过: stage={}",
                        rule != null ? rule.getStage() : "null", e);
            }
        }

        log.info("筛选规则加载完成: 成功={}, 失败={}", successCount, failureCount);
    }

    @Override
    public SieveStage getStage(String stage) {
        if (stage == null) {
            return null;
        }
        return stageMap.get(stage);
    }

    @Override
    public List<SieveStage> getAllStages() {
        return new ArrayList<>(stageMap.values());
    }

    @Override
    public synchronized void removeStage(String stage) {
        SieveStage removed = stage == null ? null : stageMap.remove(stage);
        if (removed == null) {
            log.warn("Sieve stage not found: {}", stage);
            return;
        }

        removed.shutdown();
        log.info("Sieve stage removed: {}", stage);
    }

    @Override
    public synchronized void clearAll() {
        log.info("Clearing all sieve stages...");

        for (String stage : new ArrayList<>(stageMap.keySet())) {
            removeStage(stage);
        }

        log.info("All sieve stages cleared");
    }

    @Override
    public void shutdown() {
        if (!initialized) {
            return;
        }

        log.info("关闭 SieveManager...");
        clearAll();
        initialized = false;
        log.info("SieveManager shutdown successfully");
    }

    /**
     * 按规则构建阶段：历史存储 -> 采样点筛选器 -> 指标筛选器 -> 批处理器
     */
    private SieveStage buildStage(SieveRule rule) {
        String name = rule.getStage();
        SampleHistory history = new CaffeineSampleHistory(name, rule.getHistory());
        FrequencySampleSieve sampleSieve = new FrequencySampleSieve(name, rule.getReport(), history);
        MetricsFrequencyProcessor processor = new MetricsFrequencyProcessor(new GaugeMetricSieve(sampleSieve));

        // 配置全部通过校验后才启动后台清扫
        history.initialize();
        return new SieveStage(rule, history, sampleSieve, processor);
    }

    /**
     * 验证规则
     * 各组件的具体配置在构建时由组件自身校验
     *
     * @param rule 规则
     * @throws SieveConfigException 如果规则无效
     */
    private void validateRule(SieveRule rule) {
        if (rule == null) {
            throw new SieveConfigException(null, "rule", SieveConfigException.Reason.MISSING, null);
        }

        String stage = rule.getStage();
        if (stage == null || stage.trim().isEmpty()) {
            throw new SieveConfigException(stage, "stage", SieveConfigException.Reason.INVALID_NAME, stage);
        }

        if (stage.length() > MAX_STAGE_NAME_LENGTH) {
            throw new SieveConfigException(stage, "stage", SieveConfigException.Reason.INVALID_NAME,
                    "length " + stage.length() + " > " + MAX_STAGE_NAME_LENGTH);
        }

        if (rule.getReport() != null && rule.getHistory() != null
                && rule.getHistory().getDataPointExpirationTime() != null
                && rule.getReport().getMinPointAccumulationTime() != null
                && rule.getHistory().getDataPointExpirationTime().compareTo(rule.getReport().getMinPointAccumulationTime()) < 0) {
            log.warn("dataPointExpirationTime ({}) 小于 minPointAccumulationTime ({})，stage {} 可能永远处于预热状态",
                    rule.getHistory().getDataPointExpirationTime(), rule.getReport().getMinPointAccumulationTime(), stage);
        }

        log.debug("筛选规则验证通过: stage={}", stage);
    }
}
