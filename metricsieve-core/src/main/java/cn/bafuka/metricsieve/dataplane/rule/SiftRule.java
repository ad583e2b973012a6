package cn.bafuka.metricsieve.dataplane.rule;

import java.time.Duration;

/**
 * 筛选规则链
 * 按声明顺序求值，第一条给出非 NEXT 结论的规则决定结果
 */
public enum SiftRule {

    /**
     * NaN 直接转发，不更新最近转发时间
     */
    NAN_PASS_THROUGH("NaN 直接放行") {
        @Override
        public SiftVerdict evaluate(SiftContext context) {
            return context.getSample().isNaN() ? SiftVerdict.KEEP : SiftVerdict.NEXT;
        }
    },

    /**
     * 首次观测：指标的第一个采样点总是转发
     */
    BOOTSTRAP("首次观测") {
        @Override
        public SiftVerdict evaluate(SiftContext context) {
            return context.getLastForwarded() == null ? SiftVerdict.KEEP_AND_MARK : SiftVerdict.NEXT;
        }
    },

    /**
     * 预热：历史不足以分类之前不做任何过滤
     */
    WARM_UP("预热累积") {
        @Override
        public SiftVerdict evaluate(SiftContext context) {
            Duration accumulation = context.getConfig().getMinPointAccumulationTime();
            boolean warmingUp = context.getSample().getTimestamp().isBefore(context.earliest().plus(accumulation));
            return warmingUp ? SiftVerdict.KEEP_AND_MARK : SiftVerdict.NEXT;
        }
    },

    /**
     * 常量指标心跳
     */
    CONSTANT_HEARTBEAT("常量指标心跳") {
        @Override
        public SiftVerdict evaluate(SiftContext context) {
            return keepIfDue(context, context.getConfig().getConstantMetricsReportFrequency());
        }
    },

    /**
     * 常量指标
     */
    CONSTANT("常量指标") {
        @Override
        public SiftVerdict evaluate(SiftContext context) {
            boolean constant = SampleStatistics.isConstant(context.getSample().getValue(), context.getSnapshot().values());
            return constant ? SiftVerdict.DROP : SiftVerdict.NEXT;
        }
    },

    /**
     * 低信息量指标心跳
     */
    LOW_INFO_HEARTBEAT("低信息量指标心跳") {
        @Override
        public SiftVerdict evaluate(SiftContext context) {
            return keepIfDue(context, context.getConfig().getLowInfoMetricsReportFrequency());
        }
    },

    /**
     * 低信息量指标：无 IQR 离群值且波动小
     */
    LOW_INFO("低信息量指标") {
        @Override
        public SiftVerdict evaluate(SiftContext context) {
            boolean lowInfo = SampleStatistics.isLowInformation(context.getSnapshot(),
                    context.getConfig().getIqrAnomalyCoefficient(),
                    context.getConfig().getVariationIqrThresholdCoefficient());
            return lowInfo ? SiftVerdict.DROP : SiftVerdict.NEXT;
        }
    },

    /**
     * 其他指标的最低上报频率
     */
    MAX_HEARTBEAT("最低上报频率") {
        @Override
        public SiftVerdict evaluate(SiftContext context) {
            return keepIfDue(context, context.getConfig().getMaxReportFrequency());
        }
    },

    /**
     * 兜底：丢弃
     */
    FALLBACK("兜底丢弃") {
        @Override
        public SiftVerdict evaluate(SiftContext context) {
            return SiftVerdict.DROP;
        }
    };

    private final String description;

    SiftRule(String description) {
        this.description = description;
    }

    /**
     * 对当前上下文求值
     *
     * @param context 筛选上下文
     * @return 判定结果，NEXT 表示交给下一条规则
     */
    public abstract SiftVerdict evaluate(SiftContext context);

    public String getDescription() {
        return description;
    }

    private static SiftVerdict keepIfDue(SiftContext context, Duration frequency) {
        return context.isDue(frequency) ? SiftVerdict.KEEP_AND_MARK : SiftVerdict.NEXT;
    }
}
