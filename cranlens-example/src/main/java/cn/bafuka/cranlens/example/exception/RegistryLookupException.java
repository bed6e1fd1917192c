package cn.bafuka.cranlens.example.exception;

/**
 * 注册中心查询异常
 * 当从 crandb 或 GitHub 获取数据失败时抛出（404 不算失败）
 *
 * @author CranLens Team
 * @since 1.0
 */
public class RegistryLookupException extends RuntimeException {

    /**
     * 请求的资源描述
     */
    private final String target;

    /**
     * 失败原因
     */
    private final LookupFailureReason reason;

    public RegistryLookupException(String message, Throwable cause,
                                   String target,
                                   LookupFailureReason reason) {
        super(message, cause);
        this.target = target;
        this.reason = reason;
    }

    public String getTarget() {
        return target;
    }

    public LookupFailureReason getReason() {
        return reason;
    }

    /**
     * 查询失败原因枚举
     */
    public enum LookupFailureReason {
        /**
         * 上游返回非 404 的错误状态码
         */
        HTTP_ERROR("上游 HTTP 错误"),

        /**
         * 超时错误
         */
        TIMEOUT("超时"),

        /**
         * 网络错误
         */
        NETWORK_ERROR("网络错误"),

        /**
         * 未知错误
         */
        UNKNOWN("未知错误");

        private final String description;

        LookupFailureReason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return "RegistryLookupException{" +
                "target=" + target +
                ", reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
