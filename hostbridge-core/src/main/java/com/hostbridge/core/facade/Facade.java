package com.hostbridge.core.facade;

import com.hostbridge.api.container.Container;
import com.hostbridge.core.exception.BindingResolutionException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 门面基类
 * <p>
 * 门面让调用方通过静态方法访问容器中的服务，而不必持有容器本身。
 * 门面应用（容器）在启动时设置，重置时清除。
 */
public abstract class Facade {

    private static volatile Container app;
    private static final Map<String, Object> resolvedInstances = new ConcurrentHashMap<>();

    protected Facade() {
    }

    public static void setFacadeApplication(Container container) {
        app = container;
    }

    public static Container getFacadeApplication() {
        return app;
    }

    public static void clearResolvedInstances() {
        resolvedInstances.clear();
    }

    /**
     * 解析门面背后的服务，解析结果按访问名缓存
     */
    protected static <T> T resolveFacadeInstance(String accessor, Class<T> type) {
        Object cached = resolvedInstances.get(accessor);
        if (cached != null) {
            return type.cast(cached);
        }
        Container container = app;
        if (container == null) {
            throw new BindingResolutionException(accessor, "A facade root has not been set.");
        }
        T instance = container.make(accessor, type);
        if (instance != null) {
            resolvedInstances.put(accessor, instance);
        }
        return instance;
    }
}
