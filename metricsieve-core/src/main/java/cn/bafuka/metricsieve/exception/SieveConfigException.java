package cn.bafuka.metricsieve.exception;

/**
 * 筛选阶段配置异常
 * 在构建历史存储或筛选引擎时发现非法配置时抛出，阻止该阶段被创建
 *
 * @author MetricSieve Team
 * @since 1.0
 */
public class SieveConfigException extends RuntimeException {

    /**
     * 阶段名称
     */
    private final String stage;

    /**
     * 出错的配置项
     */
    private final String field;

    /**
     * 失败原因
     */
    private final Reason reason;

    public SieveConfigException(String stage, String field, Reason reason, Object value) {
        super(String.format("Invalid %s for stage %s: %s (%s)", field, stage, value, reason.getDescription()));
        this.stage = stage;
        this.field = field;
        this.reason = reason;
    }

    public String getStage() {
        return stage;
    }

    public String getField() {
        return field;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * 配置错误原因枚举
     */
    public enum Reason {
        /**
         * 必须为正数
         */
        NOT_POSITIVE("必须为正数"),

        /**
         * 不能为负数
         */
        NEGATIVE("不能为负数"),

        /**
         * 必须是有限数值
         */
        NOT_FINITE("必须是有限数值"),

        /**
         * 缺少配置
         */
        MISSING("缺少配置"),

        /**
         * 阶段名称非法
         */
        INVALID_NAME("阶段名称非法");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return "SieveConfigException{" +
                "stage=" + stage +
                ", field=" + field +
                ", reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
