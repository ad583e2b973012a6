package cn.bafuka.metricsieve.control;

import cn.bafuka.metricsieve.model.SieveRule;

import java.util.List;

/**
 * 筛选阶段管理器接口
 * 负责按规则构建、查找和销毁筛选阶段
 */
public interface SieveManager {

    /**
     * 初始化管理器
     */
    void initialize();

    /**
     * 加载规则
     * 同名阶段会被重建，旧阶段的历史数据随之丢弃
     *
     * @param rules 规则列表
     */
    void loadRules(List<SieveRule> rules);

    /**
     * 根据名称获取阶段
     *
     * @param stage 阶段名称
     * @return 阶段，不存在返回 null
     */
    SieveStage getStage(String stage);

    /**
     * 获取所有阶段
     *
     * @return 阶段列表
     */
    List<SieveStage> getAllStages();

    /**
     * 移除阶段
     *
     * @param stage 阶段名称
     */
    void removeStage(String stage);

    /**
     * 移除所有阶段
     */
    void clearAll();

    /**
     * 关闭管理器
     */
    void shutdown();
}
