package cn.bafuka.metricsieve.example.controller;

import cn.bafuka.metricsieve.example.service.MetricIngestService;
import cn.bafuka.metricsieve.model.MetricBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 指标上报控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/metrics")
public class MetricsController {

    @Autowired
    private MetricIngestService metricIngestService;

    /**
     * 上报一批指标，返回筛选后需要转发的部分
     */
    @PostMapping("/{stage}")
    public ResponseEntity<Object> ingest(@PathVariable String stage, @RequestBody MetricBatch batch) {
        MetricBatch result = metricIngestService.ingest(stage, batch);
        if (result == null) {
            Map<String, Object> error = new HashMap<>();
            error.put("success", false);
            error.put("message", "未找到筛选阶段: " + stage);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
        }
        return ResponseEntity.ok(result);
    }
}
