package cn.bafuka.metricsieve.autoconfigure;

import cn.bafuka.metricsieve.config.MetricSieveProperties;
import cn.bafuka.metricsieve.control.SieveManager;
import cn.bafuka.metricsieve.control.impl.DefaultSieveManager;
import cn.bafuka.metricsieve.spi.ConfigSource;
import cn.bafuka.metricsieve.spi.impl.LocalYamlConfigSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MetricSieve 自动配置类
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MetricSieveProperties.class)
@ConditionalOnProperty(prefix = "metricsieve", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MetricSieveAutoConfiguration {

    public MetricSieveAutoConfiguration() {
        log.info("MetricSieve auto-configuration initializing...");
    }

    /**
     * 本地 YAML 配置源
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(ConfigSource.class)
    public ConfigSource localYamlConfigSource(MetricSieveProperties properties) {
        return new LocalYamlConfigSource(properties);
    }

    /**
     * 筛选阶段管理器
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(SieveManager.class)
    public SieveManager sieveManager() {
        DefaultSieveManager manager = new DefaultSieveManager();
        manager.initialize();
        return manager;
    }

    /**
     * 配置源初始化器
     */
    @Bean
    public MetricSieveConfigInitializer metricSieveConfigInitializer(
            ConfigSource configSource,
            SieveManager sieveManager) {
        MetricSieveConfigInitializer initializer = new MetricSieveConfigInitializer(configSource, sieveManager);
        initializer.initialize();
        return initializer;
    }

    /**
     * 配置源初始化器（内部类）
     */
    @Slf4j
    public static class MetricSieveConfigInitializer {

        private final ConfigSource configSource;
        private final SieveManager sieveManager;

        public MetricSieveConfigInitializer(ConfigSource configSource, SieveManager sieveManager) {
            this.configSource = configSource;
            this.sieveManager = sieveManager;
        }

        public void initialize() {
            log.info("初始化 MetricSieve config from source: {}", configSource.getType());

            configSource.subscribe(rules -> {
                log.info("Received sieve rules, loading stages...");
                sieveManager.loadRules(rules);
            });

            log.info("MetricSieve initialized successfully, stages={}", sieveManager.getAllStages().size());
        }
    }
}
