package cn.bafuka.cranlens.engine.impl;

import cn.bafuka.cranlens.engine.SizeEstimator;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.serializer.SerializerFeature;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 基于 JSON 序列化长度的大小估算器
 * 条目大小 = 键长度 * 2 + 序列化长度 * 2 + 元数据开销；
 * 序列化失败时退化为遍历估算，遍历路径上的对象按引用身份记录，遇到环只计固定开销
 */
@Slf4j
public class JsonSizeEstimator implements SizeEstimator {

    /**
     * 时间戳、TTL 等元数据开销
     */
    static final long METADATA_SIZE = 24;

    /**
     * 当前遍历路径上已出现的对象
     */
    static final long CIRCULAR_REFERENCE_SIZE = 20;

    static final long NULL_SIZE = 4;

    static final long UNKNOWN_TYPE_SIZE = 50;

    /**
     * "{}" / "[]"
     */
    private static final long CONTAINER_OVERHEAD = 2;

    /**
     * 键值分隔符及引号
     */
    private static final long SEPARATOR_OVERHEAD = 3;

    @Override
    public long estimate(String key, Object value) {
        long keySize = key.length() * 2L;
        long dataSize;

        try {
            // 关闭引用检测：共享的子结构按出现次数完整计算，环会导致序列化失败
            dataSize = JSON.toJSONString(value, SerializerFeature.DisableCircularReferenceDetect).length() * 2L;
        } catch (RuntimeException | StackOverflowError e) {
            // 环、过深的嵌套或抛异常的 getter
            log.debug("序列化失败，改用遍历估算: key={}, type={}, error={}",
                    key, value.getClass().getName(), e.toString());
            dataSize = estimateRecursively(value) * 2L;
        }

        return keySize + dataSize + METADATA_SIZE;
    }

    /**
     * 遍历估算值的文本长度
     * 使用显式栈遍历，嵌套深度不受线程栈限制
     *
     * @param value 任意值
     * @return 估算字符数
     */
    public long estimateRecursively(Object value) {
        Set<Object> visiting = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Object> pending = new ArrayDeque<>();
        long size = push(value, pending);

        while (!pending.isEmpty()) {
            Object current = pending.pop();
            if (current instanceof Exit) {
                visiting.remove(((Exit) current).value);
                continue;
            }
            if (visiting.contains(current)) {
                size += CIRCULAR_REFERENCE_SIZE;
                continue;
            }
            size += expand(current, visiting, pending);
        }
        return size;
    }

    /**
     * 标量直接计入；容器入栈，返回 0
     */
    private static long push(Object value, Deque<Object> pending) {
        if (value == null) {
            return NULL_SIZE;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length();
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
            return String.valueOf(value).length();
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name().length();
        }
        if (value instanceof TemporalAccessor || value instanceof Date || value instanceof UUID) {
            return value.toString().length();
        }
        pending.push(value);
        return 0;
    }

    /**
     * 展开一个容器：子元素入栈，返回容器自身的开销。
     * 出栈标记先于子元素入栈，子树处理完后才把容器移出当前路径
     */
    private long expand(Object value, Set<Object> visiting, Deque<Object> pending) {
        if (value instanceof Map) {
            enter(value, visiting, pending);
            long size = CONTAINER_OVERHEAD;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                size += SEPARATOR_OVERHEAD + push(entry.getKey(), pending) + push(entry.getValue(), pending);
            }
            return size;
        }
        if (value instanceof Collection) {
            enter(value, visiting, pending);
            long size = CONTAINER_OVERHEAD;
            for (Object element : (Collection<?>) value) {
                size += push(element, pending);
            }
            return size;
        }
        if (value.getClass().isArray()) {
            enter(value, visiting, pending);
            long size = CONTAINER_OVERHEAD;
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                size += push(Array.get(value, i), pending);
            }
            return size;
        }
        if (isJdkType(value.getClass())) {
            return UNKNOWN_TYPE_SIZE;
        }

        enter(value, visiting, pending);
        return expandFields(value, pending);
    }

    private static void enter(Object value, Set<Object> visiting, Deque<Object> pending) {
        visiting.add(value);
        pending.push(new Exit(value));
    }

    /**
     * 普通对象按实例字段估算，沿父类向上直到 JDK 类型
     */
    private long expandFields(Object value, Deque<Object> pending) {
        long size = CONTAINER_OVERHEAD;
        for (Class<?> type = value.getClass(); type != null && !isJdkType(type); type = type.getSuperclass()) {
            for (Field field : type.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                    continue;
                }
                if (!field.trySetAccessible()) {
                    size += UNKNOWN_TYPE_SIZE;
                    continue;
                }
                try {
                    Object fieldValue = field.get(value);
                    size += field.getName().length() + SEPARATOR_OVERHEAD + push(fieldValue, pending);
                } catch (IllegalAccessException e) {
                    log.debug("字段不可读，按未知类型计: field={}.{}", type.getName(), field.getName());
                    size += UNKNOWN_TYPE_SIZE;
                }
            }
        }
        return size;
    }

    private static boolean isJdkType(Class<?> type) {
        String name = type.getName();
        return name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.") || name.startsWith("sun.");
    }

    /**
     * 容器子树处理完毕的出栈标记
     */
    private static final class Exit {
        private final Object value;

        private Exit(Object value) {
            this.value = value;
        }
    }
}
