package com.hostbridge.core.view;

import com.hostbridge.api.exception.InvalidArgumentException;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 视图工厂
 */
public class ViewFactory {

    private final ViewFinder finder;
    private final CompilerEngine engine;
    private final Map<String, Object> shared = new ConcurrentHashMap<>();

    public ViewFactory(ViewFinder finder, CompilerEngine engine) {
        this.finder = finder;
        this.engine = engine;
    }

    public View make(String name) {
        return make(name, Collections.emptyMap());
    }

    public View make(String name, Map<String, ?> data) {
        String path = finder.find(name);
        return new View(this, engine, name, path, data);
    }

    public boolean exists(String name) {
        try {
            finder.find(name);
            return true;
        } catch (InvalidArgumentException e) {
            return false;
        }
    }

    /**
     * 共享给所有视图的数据
     */
    public void share(String key, Object value) {
        shared.put(key, value);
    }

    public Map<String, Object> getShared() {
        return Collections.unmodifiableMap(shared);
    }

    public ViewFinder getFinder() {
        return finder;
    }

    public CompilerEngine getEngine() {
        return engine;
    }
}
