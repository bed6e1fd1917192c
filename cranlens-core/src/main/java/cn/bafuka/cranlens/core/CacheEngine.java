package cn.bafuka.cranlens.core;

import java.util.function.Supplier;

/**
 * 缓存引擎核心接口
 * 键为调用方构造的字符串，值对引擎不透明；未命中是正常结果，用 null 表示，不抛异常
 */
public interface CacheEngine {

    /**
     * 获取缓存值，命中时刷新该条目的最近访问时间
     *
     * @param key 缓存键
     * @param <V> 调用方期望的值类型
     * @return 缓存值，不存在或已过期返回 null
     */
    <V> V get(String key);

    /**
     * 使用默认 TTL 写入缓存
     *
     * @param key   缓存键
     * @param value 缓存值
     */
    void set(String key, Object value);

    /**
     * 写入缓存
     *
     * @param key       缓存键
     * @param value     缓存值
     * @param ttlMillis 过期时间（毫秒），不为正数时使用默认 TTL
     */
    void set(String key, Object value, long ttlMillis);

    /**
     * 判断缓存是否存在，不影响命中统计和访问顺序
     *
     * @param key 缓存键
     * @return 存在且未过期返回 true
     */
    boolean has(String key);

    /**
     * 删除缓存
     *
     * @param key 缓存键
     * @return 是否删除了条目
     */
    boolean delete(String key);

    /**
     * 清空所有缓存并重置统计
     */
    void clear();

    /**
     * @return 当前条目数
     */
    long size();

    /**
     * 获取缓存统计信息
     *
     * @return 统计信息对象
     */
    CacheStats getStats();

    /**
     * 立即清理所有已过期条目
     *
     * @return 清理的条目数
     */
    int cleanUp();

    /**
     * 停止后台清理并清空缓存，可重复调用；之后引擎仍可作为空缓存继续使用
     */
    void destroy();

    /**
     * 读取缓存，未命中时调用 loader 回源并写入非空结果
     *
     * @param key       缓存键
     * @param ttlMillis 回源结果的过期时间（毫秒）
     * @param loader    回源函数，抛出的异常原样传给调用方，且不写入缓存
     * @param <V>       值类型
     * @return 缓存值或回源结果
     */
    default <V> V getOrLoad(String key, long ttlMillis, Supplier<V> loader) {
        V cached = get(key);
        if (cached != null) {
            return cached;
        }

        V loaded = loader.get();
        if (loaded != null) {
            set(key, loaded, ttlMillis);
        }
        return loaded;
    }
}
