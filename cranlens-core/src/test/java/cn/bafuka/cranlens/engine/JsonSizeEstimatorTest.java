package cn.bafuka.cranlens.engine;

import cn.bafuka.cranlens.engine.impl.JsonSizeEstimator;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * JsonSizeEstimator 单元测试
 */
public class JsonSizeEstimatorTest {

    private JsonSizeEstimator estimator;

    @Before
    public void setUp() {
        estimator = new JsonSizeEstimator();
    }

    /**
     * 字符串按 JSON 文本长度计：键 2 字节/字符 + 值 2 字节/字符 + 24 字节元数据
     */
    @Test
    public void testStringValue() {
        // "\"abc\"" = 5 个字符
        assertEquals(2 + 10 + 24, estimator.estimate("k", "abc"));
    }

    /**
     * Map 按序列化结果计
     */
    @Test
    public void testMapValue() {
        // {"a":1} = 7 个字符
        assertEquals(2 + 14 + 24, estimator.estimate("k", Collections.singletonMap("a", 1)));
    }

    /**
     * 键越长估算越大
     */
    @Test
    public void testKeyContributesTwoBytesPerChar() {
        long shortKey = estimator.estimate("k", "value");
        long longKey = estimator.estimate("kkkkk", "value");
        assertEquals(8, longKey - shortKey);
    }

    /**
     * 递归估算：基本类型按文本长度，容器加括号开销
     */
    @Test
    public void testRecursivePrimitivesAndCollections() {
        assertEquals(4, estimator.estimateRecursively(null));
        assertEquals(3, estimator.estimateRecursively("abc"));
        assertEquals(4, estimator.estimateRecursively(1234));
        assertEquals(4, estimator.estimateRecursively(true));
        // [1, "ab", null] = 2 + 1 + 2 + 4
        assertEquals(9, estimator.estimateRecursively(Arrays.asList(1, "ab", null)));
        // int[]{10, 200} = 2 + 2 + 3
        assertEquals(7, estimator.estimateRecursively(new int[]{10, 200}));
    }

    /**
     * 自引用的 Map 在递归估算中只计固定开销
     */
    @Test
    public void testRecursiveSelfReference() {
        Map<String, Object> circular = new HashMap<>();
        circular.put("name", "test");
        circular.put("self", circular);

        // 2 + (4 + 3 + 4) + (4 + 3 + 20)
        assertEquals(40, estimator.estimateRecursively(circular));
    }

    /**
     * 共享但不成环的子结构按出现次数完整计算
     */
    @Test
    public void testRecursiveSharedSubstructure() {
        List<String> shared = new ArrayList<>();
        shared.add("abc");
        Map<String, Object> diamond = new HashMap<>();
        diamond.put("x", shared);
        diamond.put("y", shared);

        // 2 + 2 * (1 + 3 + (2 + 3))
        assertEquals(20, estimator.estimateRecursively(diamond));
    }

    /**
     * 普通对象按字段估算，环形引用终止
     */
    @Test
    public void testRecursiveBeanCycle() {
        Node node = new Node("n1");
        node.next = node;

        // 2 + ("name" 4 + 3 + 2) + ("next" 4 + 3 + 20)
        assertEquals(38, estimator.estimateRecursively(node));
    }

    /**
     * 两个节点互相引用
     */
    @Test
    public void testRecursiveMutualReference() {
        Node first = new Node("a");
        Node second = new Node("b");
        first.next = second;
        second.next = first;

        // first: 2 + (4 + 3 + 1) + (4 + 3 + second)
        // second: 2 + (4 + 3 + 1) + (4 + 3 + 20)
        long secondSize = 2 + 8 + 27;
        assertEquals(2 + 8 + 7 + secondSize, estimator.estimateRecursively(first));
    }

    /**
     * 序列化失败时退化为递归估算
     */
    @Test
    public void testFallbackWhenSerializationFails() {
        ExplodingBean bean = new ExplodingBean("abc");

        long expected = 2 + estimator.estimateRecursively(bean) * 2 + 24;
        assertEquals(expected, estimator.estimate("k", bean));
    }

    /**
     * 自引用的值估算结果有限且稳定
     */
    @Test
    public void testCircularValueIsDeterministic() {
        Map<String, Object> circular = new HashMap<>();
        circular.put("name", "test");
        circular.put("self", circular);

        long first = estimator.estimate("circular", circular);
        long second = estimator.estimate("circular", circular);
        assertTrue(first > 24);
        assertEquals(first, second);
    }

    /**
     * 共享的子结构与独立副本估算结果相同
     */
    @Test
    public void testSharedSubstructureCountedInFull() {
        List<String> items = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            items.add("item-" + i);
        }
        Map<String, Object> shared = new HashMap<>();
        shared.put("items", items);

        Map<String, Object> sharedValue = new LinkedHashMap<>();
        Map<String, Object> copiedValue = new LinkedHashMap<>();
        for (int i = 0; i < 10; i++) {
            sharedValue.put("k" + i, shared);
            Map<String, Object> copy = new HashMap<>();
            copy.put("items", new ArrayList<>(items));
            copiedValue.put("k" + i, copy);
        }

        assertEquals(estimator.estimate("v", copiedValue), estimator.estimate("v", sharedValue));
    }

    /**
     * 自引用的值走遍历估算
     */
    @Test
    public void testSelfReferenceUsesWalk() {
        Map<String, Object> circular = new HashMap<>();
        circular.put("name", "test");
        circular.put("self", circular);

        // 2 * 8 + 40 * 2 + 24
        assertEquals(120, estimator.estimate("circular", circular));
    }

    /**
     * 嵌套极深的值不会撑爆线程栈
     */
    @Test
    public void testDeeplyNestedValue() {
        int depth = 200_000;
        Map<String, Object> root = new HashMap<>();
        Map<String, Object> current = root;
        for (int i = 1; i < depth; i++) {
            Map<String, Object> child = new HashMap<>();
            current.put("c", child);
            current = child;
        }

        // 最内层 {} 为 2，每层 {"c":...} 加 6
        long expectedWalk = 2 + 6L * (depth - 1);
        assertEquals(expectedWalk, estimator.estimateRecursively(root));
        assertEquals(2 * 4 + expectedWalk * 2 + 24, estimator.estimate("deep", root));
    }

    /**
     * 单向链表节点
     */
    static class Node {
        String name;
        Node next;

        Node(String name) {
            this.name = name;
        }
    }

    /**
     * getter 抛异常，无法序列化
     */
    public static class ExplodingBean {
        private final String label;

        public ExplodingBean(String label) {
            this.label = label;
        }

        public String getLabel() {
            throw new IllegalStateException("boom");
        }
    }
}
