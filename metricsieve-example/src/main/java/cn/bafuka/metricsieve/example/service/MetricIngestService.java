package cn.bafuka.metricsieve.example.service;

import cn.bafuka.metricsieve.control.SieveManager;
import cn.bafuka.metricsieve.control.SieveStage;
import cn.bafuka.metricsieve.model.MetricBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * 指标接收服务
 * 把上报的指标批次交给对应的筛选阶段
 */
@Slf4j
@Service
public class MetricIngestService {

    @Autowired
    private SieveManager sieveManager;

    /**
     * 筛选一批指标
     *
     * @param stage 阶段名称
     * @param batch 指标批次
     * @return 筛选后的批次；阶段不存在时返回 null
     */
    public MetricBatch ingest(String stage, MetricBatch batch) {
        SieveStage sieveStage = sieveManager.getStage(stage);
        if (sieveStage == null) {
            log.warn("未找到筛选阶段: stage={}", stage);
            return null;
        }

        int before = batch == null ? 0 : batch.dataPointCount();
        MetricBatch result = sieveStage.process(batch);
        log.info("指标批次已筛选: stage={}, dataPoints {} -> {}", stage, before, result.dataPointCount());
        return result;
    }
}
