package cn.bafuka.metricsieve.dataplane;

import cn.bafuka.metricsieve.core.Sample;
import cn.bafuka.metricsieve.core.SieveStats;

/**
 * 采样点筛选器接口
 * 逐个采样点判断应当转发还是丢弃
 */
public interface SampleSieve {

    /**
     * 判断采样点是否应该被丢弃
     *
     * @param identity 指标标识
     * @param sample   采样点
     * @return true 表示丢弃；false 表示转发
     */
    boolean sift(String identity, Sample sample);

    /**
     * 获取筛选统计信息
     *
     * @return 统计快照
     */
    SieveStats getStats();
}
