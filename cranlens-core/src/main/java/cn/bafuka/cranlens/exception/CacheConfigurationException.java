package cn.bafuka.cranlens.exception;

/**
 * 缓存配置异常
 * 构建缓存引擎时配置非法（预算、TTL、清理间隔不为正数）抛出
 *
 * @author CranLens Team
 * @since 1.0
 */
public class CacheConfigurationException extends RuntimeException {

    /**
     * 非法的配置项名称
     */
    private final String option;

    /**
     * 非法的配置值
     */
    private final long value;

    public CacheConfigurationException(String option, long value) {
        super("Invalid cache option '" + option + "': must be a positive number, got " + value);
        this.option = option;
        this.value = value;
    }

    public String getOption() {
        return option;
    }

    public long getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "CacheConfigurationException{" +
                "option=" + option +
                ", value=" + value +
                ", message=" + getMessage() +
                '}';
    }
}
