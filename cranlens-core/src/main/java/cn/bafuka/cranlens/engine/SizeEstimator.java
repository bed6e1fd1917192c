package cn.bafuka.cranlens.engine;

/**
 * 缓存条目大小估算器
 * 估算结果用于字节预算统计，不要求精确，但必须对任意值（包括循环引用）有限且确定
 */
public interface SizeEstimator {

    /**
     * 估算一个条目的占用
     *
     * @param key   缓存键
     * @param value 缓存值
     * @return 估算字节数
     */
    long estimate(String key, Object value);
}
