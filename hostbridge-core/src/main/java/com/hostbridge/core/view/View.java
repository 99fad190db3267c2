package com.hostbridge.core.view;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次待渲染的视图
 */
public class View {

    private final ViewFactory factory;
    private final CompilerEngine engine;
    private final String name;
    private final String path;
    private final Map<String, Object> data;

    public View(ViewFactory factory, CompilerEngine engine, String name, String path, Map<String, ?> data) {
        this.factory = factory;
        this.engine = engine;
        this.name = name;
        this.path = path;
        this.data = new LinkedHashMap<>(data);
    }

    public View with(String key, Object value) {
        data.put(key, value);
        return this;
    }

    /**
     * 共享数据在前，视图自身数据覆盖同名共享数据
     */
    public String render() {
        Map<String, Object> merged = new LinkedHashMap<>(factory.getShared());
        merged.putAll(data);
        return engine.get(path, merged);
    }

    public String getName() {
        return name;
    }

    public String getPath() {
        return path;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }
}
