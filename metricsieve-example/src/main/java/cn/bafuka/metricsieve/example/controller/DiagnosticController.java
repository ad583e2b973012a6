package cn.bafuka.metricsieve.example.controller;

import cn.bafuka.metricsieve.control.SieveManager;
import cn.bafuka.metricsieve.control.SieveStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 诊断控制器
 * 用于查看 MetricSieve 的运行状态和配置
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
public class DiagnosticController {

    @Autowired
    private SieveManager sieveManager;

    /**
     * 查看所有阶段
     */
    @GetMapping("/stages")
    public Map<String, Object> getStages() {
        List<SieveStage> stages = sieveManager.getAllStages();

        List<Map<String, Object>> details = stages.stream().map(stage -> {
            Map<String, Object> detail = new HashMap<>();
            detail.put("stage", stage.getName());
            detail.put("rule", stage.getRule());
            detail.put("trackedMetrics", stage.getTrackedMetrics());
            detail.put("stats", stage.getStats());
            detail.put("keepRate", stage.getStats().keepRate());
            return detail;
        }).collect(Collectors.toList());

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("total", stages.size());
        result.put("stages", details);

        return result;
    }

    /**
     * 健康检查
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);

        int stageCount = sieveManager.getAllStages().size();
        result.put("totalStages", stageCount);

        boolean healthy = stageCount > 0;
        result.put("healthy", healthy);

        if (!healthy) {
            result.put("message", "警告：没有加载任何筛选阶段");
        } else {
            result.put("message", "MetricSieve 运行正常");
        }

        return result;
    }
}
