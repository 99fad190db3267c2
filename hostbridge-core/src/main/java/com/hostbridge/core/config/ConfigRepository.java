package com.hostbridge.core.config;

import com.hostbridge.api.exception.InvalidArgumentException;
import com.hostbridge.core.util.YamlCompatUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 配置仓库
 * <p>
 * 以嵌套 Map 存储配置项，支持 "database.connections.default" 形式的点路径读写。
 * 写入的 Map 会被深拷贝为可变结构，之后可以继续按点路径修改其中的子项。
 */
@Slf4j
public class ConfigRepository {

    private final Map<String, Object> items = new LinkedHashMap<>();

    public ConfigRepository() {
    }

    public ConfigRepository(Map<String, ?> items) {
        if (items != null) {
            set(new LinkedHashMap<>(items));
        }
    }

    // ==================== 读取 ====================

    public synchronized boolean has(String key) {
        return lookup(key) != MISSING;
    }

    public synchronized Object get(String key) {
        Object value = lookup(key);
        return value == MISSING ? null : value;
    }

    public synchronized Object get(String key, Object defaultValue) {
        Object value = lookup(key);
        return value == MISSING || value == null ? defaultValue : value;
    }

    public String getString(String key, String defaultValue) {
        Object value = get(key, defaultValue);
        return value == null ? null : String.valueOf(value);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }

    /**
     * 读取字符串列表；单个标量会被包装为单元素列表
     */
    public List<String> getStringList(String key) {
        Object value = get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof Iterable<?> iterable) {
            iterable.forEach(item -> result.add(String.valueOf(item)));
        } else {
            result.add(String.valueOf(value));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = get(key);
        if (value instanceof Map) {
            return Collections.unmodifiableMap((Map<String, Object>) value);
        }
        return Collections.emptyMap();
    }

    public synchronized Map<String, Object> all() {
        return Collections.unmodifiableMap(items);
    }

    public synchronized boolean isEmpty() {
        return items.isEmpty();
    }

    // ==================== 写入 ====================

    @SuppressWarnings("unchecked")
    public synchronized void set(String key, Object value) {
        if (key == null || key.trim().isEmpty()) {
            throw new InvalidArgumentException("key", "Config key cannot be blank");
        }
        String[] segments = key.split("\\.");
        Map<String, Object> current = items;
        for (int i = 0; i < segments.length - 1; i++) {
            Object next = current.get(segments[i]);
            if (!(next instanceof Map)) {
                next = new LinkedHashMap<String, Object>();
                current.put(segments[i], next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(segments[segments.length - 1], copyValue(value));
    }

    /**
     * 批量写入，key 同样支持点路径
     */
    public synchronized void set(Map<String, ?> values) {
        values.forEach(this::set);
    }

    /**
     * 向列表型配置追加一项
     */
    public synchronized void push(String key, Object value) {
        List<Object> list = new ArrayList<>();
        Object existing = get(key);
        if (existing instanceof List<?> l) {
            list.addAll(l);
        } else if (existing != null) {
            list.add(existing);
        }
        list.add(value);
        set(key, list);
    }

    @SuppressWarnings("unchecked")
    public synchronized void forget(String key) {
        int idx = key.lastIndexOf('.');
        if (idx < 0) {
            items.remove(key);
            return;
        }
        Object parent = lookup(key.substring(0, idx));
        if (parent instanceof Map) {
            ((Map<String, Object>) parent).remove(key.substring(idx + 1));
        }
    }

    /**
     * 深度合并：Map 与 Map 递归合并，其余类型直接覆盖
     */
    public synchronized void merge(Map<String, ?> values) {
        deepMerge(items, values);
    }

    /**
     * 从 YAML 文件合并配置
     */
    public void mergeYaml(Path path) {
        try {
            Map<String, Object> loaded = YamlCompatUtils.loadMap(path);
            merge(loaded);
            log.info("Merged {} top-level config keys from {}", loaded.size(), path);
        } catch (IOException e) {
            throw new InvalidArgumentException("path", "Cannot read configuration file: " + path, e);
        }
    }

    // ==================== 内部实现 ====================

    private static final Object MISSING = new Object();

    @SuppressWarnings("unchecked")
    private Object lookup(String key) {
        if (key == null) {
            return MISSING;
        }
        if (items.containsKey(key)) {
            return items.get(key);
        }
        Object current = items;
        for (String segment : key.split("\\.")) {
            if (!(current instanceof Map) || !((Map<String, Object>) current).containsKey(segment)) {
                return MISSING;
            }
            current = ((Map<String, Object>) current).get(segment);
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    private static void deepMerge(Map<String, Object> target, Map<String, ?> source) {
        source.forEach((key, value) -> {
            Object existing = target.get(key);
            if (existing instanceof Map && value instanceof Map) {
                deepMerge((Map<String, Object>) existing, (Map<String, ?>) value);
            } else {
                target.put(key, copyValue(value));
            }
        });
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }

    @Override
    public synchronized String toString() {
        return "ConfigRepository" + items.keySet();
    }
}
