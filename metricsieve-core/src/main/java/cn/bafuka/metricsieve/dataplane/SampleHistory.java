package cn.bafuka.metricsieve.dataplane;

import cn.bafuka.metricsieve.core.Sample;

import java.time.Instant;
import java.util.NavigableMap;

/**
 * 采样历史存储接口
 * 按指标标识保存近期采样点，单个采样点按存活时间过期，空指标定期清理
 */
public interface SampleHistory {

    /**
     * 写入采样点，相同时间戳覆盖旧值
     *
     * @param identity 指标标识
     * @param sample   采样点
     */
    void register(String identity, Sample sample);

    /**
     * 列出指标当前保存的采样点
     * 返回的是独立快照，调用方可以自由修改
     *
     * @param identity 指标标识
     * @return 时间戳 -> 值，按时间升序；指标不存在时返回空集合
     */
    NavigableMap<Instant, Double> list(String identity);

    /**
     * 移除所有已经没有采样点的指标
     */
    void cleanup();

    /**
     * 清扫过期的采样点
     */
    void expireSamples();

    /**
     * 当前跟踪的指标数量
     */
    int size();

    /**
     * 启动后台清扫任务
     */
    void initialize();

    /**
     * 停止后台清扫任务并释放数据
     */
    void shutdown();
}
