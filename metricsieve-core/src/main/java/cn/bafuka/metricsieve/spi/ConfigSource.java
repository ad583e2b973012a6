package cn.bafuka.metricsieve.spi;

import cn.bafuka.metricsieve.model.SieveRule;

import java.util.List;
import java.util.function.Consumer;

/**
 * 筛选规则来源 SPI
 * 实现负责把外部配置整理成可直接建阶段的规则：
 * 阶段名称去掉首尾空白且不重复，缺省的 report / history 配置段按默认值补全，
 * 交出的规则是副本，之后配置源内部的变化不会影响已经建好的阶段
 */
public interface ConfigSource {

    /**
     * 订阅规则
     * 实现至少在订阅时推送一次当前规则；没有规则时不推送
     *
     * @param listener 规则监听器，通常是 SieveManager::loadRules
     */
    void subscribe(Consumer<List<SieveRule>> listener);

    /**
     * 获取当前规则（同步方式），已按上面的约定整理
     *
     * @return 规则副本，按阶段名称首次出现的顺序排列
     */
    List<SieveRule> getCurrentRules();

    /**
     * 停止订阅
     */
    void shutdown();

    /**
     * 配置源类型标识
     *
     * @return 类型名称（如 "local"）
     */
    String getType();
}
