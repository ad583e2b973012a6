package cn.bafuka.metricsieve.dataplane.rule;

/**
 * 规则判定结果
 */
public enum SiftVerdict {

    /**
     * 转发，并把该采样点记为最近一次转发
     */
    KEEP_AND_MARK(false, true),

    /**
     * 转发，不更新最近转发时间
     */
    KEEP(false, false),

    /**
     * 丢弃
     */
    DROP(true, false),

    /**
     * 规则不匹配，交给下一条规则
     */
    NEXT(false, false);

    private final boolean drop;

    private final boolean markForwarded;

    SiftVerdict(boolean drop, boolean markForwarded) {
        this.drop = drop;
        this.markForwarded = markForwarded;
    }

    public boolean isDrop() {
        return drop;
    }

    public boolean isMarkForwarded() {
        return markForwarded;
    }
}
