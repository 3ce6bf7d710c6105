package cn.bafuka.recall.exception;

/**
 * Recall 配置异常
 * 缓存定义不合法时在构建阶段抛出，查找和写入路径上从不抛出
 *
 * @author Recall Team
 * @since 1.0
 */
public class RecallConfigException extends RuntimeException {

    /**
     * 缓存名称
     */
    private final String cacheName;

    /**
     * 失败原因
     */
    private final ConfigFailureReason reason;

    public RecallConfigException(String message, String cacheName, ConfigFailureReason reason) {
        super(message);
        this.cacheName = cacheName;
        this.reason = reason;
    }

    public String getCacheName() {
        return cacheName;
    }

    public ConfigFailureReason getReason() {
        return reason;
    }

    /**
     * 配置失败原因枚举
     */
    public enum ConfigFailureReason {
        /**
         * 缺少缓存名称
         */
        MISSING_NAME("缺少缓存名称"),

        /**
         * 缺少快照路径
         */
        MISSING_STORAGE_PATH("缺少快照路径"),

        /**
         * 数值越界
         */
        OUT_OF_RANGE("数值越界");

        private final String description;

        ConfigFailureReason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return "RecallConfigException{" +
                "cache=" + cacheName +
                ", reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
