package com.hostbridge.core.container;

import com.hostbridge.api.container.Container;
import com.hostbridge.api.container.ServiceFactory;
import com.hostbridge.api.exception.InvalidArgumentException;
import com.hostbridge.core.exception.BindingResolutionException;
import com.hostbridge.core.exception.UnboundServiceException;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 默认服务容器
 * <p>
 * - 实例 / 单例 / 工厂三种绑定，后注册覆盖先注册
 * - 单例的"检查-构造-缓存"在同一把可重入锁内完成，工厂内可嵌套解析
 * - 同一线程内的循环构造会被检测并拒绝
 */
@Slf4j
public class ServiceContainer implements Container {

    private static final String RUNNING_IN_CONSOLE = "runningInConsole";

    // ConcurrentHashMap 不接受 null 值，单例构造结果为 null 时以此占位
    private static final Object NULL = new Object();

    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();
    private final Map<String, Object> resolved = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    private final ReentrantLock resolveLock = new ReentrantLock();
    private final ThreadLocal<Deque<String>> buildStack = ThreadLocal.withInitial(ArrayDeque::new);

    // ==================== 绑定 ====================

    @Override
    public <T> T instance(String key, T value) {
        register(key, Binding.ofInstance(value));
        return value;
    }

    @Override
    public void singleton(String key, ServiceFactory<?> factory) {
        requireFactory(key, factory);
        register(key, Binding.ofSingleton(factory));
    }

    @Override
    public void singleton(String key, Class<?> type) {
        if (type == null) {
            throw new InvalidArgumentException("type", "Singleton type for [" + key + "] cannot be null");
        }
        register(key, Binding.ofSingleton(c -> instantiate(key, type)));
    }

    @Override
    public void bind(String key, ServiceFactory<?> factory) {
        requireFactory(key, factory);
        register(key, Binding.ofFactory(factory));
    }

    @Override
    public void alias(String key, String alias) {
        requireKey(key);
        requireKey(alias);
        if (key.equals(alias)) {
            throw new InvalidArgumentException("alias", "[" + key + "] is aliased to itself");
        }
        // 目标沿别名链回到 alias 即成环
        for (String current = key; current != null; current = aliases.get(current)) {
            if (current.equals(alias)) {
                throw new InvalidArgumentException("alias",
                        "Aliasing [" + alias + "] to [" + key + "] would create a cycle");
            }
        }
        aliases.put(alias, key);
    }

    private void register(String key, Binding binding) {
        requireKey(key);
        resolveLock.lock();
        try {
            // 覆盖绑定时丢弃旧的单例缓存，同名别名也随之失效
            resolved.remove(key);
            aliases.remove(key);
            bindings.put(key, binding);
        } finally {
            resolveLock.unlock();
        }
        log.debug("Bound [{}] as {}", key, binding.getType());
    }

    // ==================== 解析 ====================

    @Override
    public Object make(String key) {
        requireKey(key);
        String abstractKey = getAlias(key);
        Binding binding = bindings.get(abstractKey);
        if (binding == null) {
            throw new UnboundServiceException(key);
        }

        switch (binding.getType()) {
            case INSTANCE:
                return binding.getInstance();
            case FACTORY:
                return build(abstractKey, binding.getFactory());
            default:
                return resolveShared(abstractKey, binding);
        }
    }

    @Override
    public <T> T make(String key, Class<T> type) {
        Object value = make(key);
        if (value != null && !type.isInstance(value)) {
            throw new BindingResolutionException(key,
                    "Service [" + key + "] is a " + value.getClass().getName() + ", not a " + type.getName());
        }
        return type.cast(value);
    }

    private Object resolveShared(String key, Binding binding) {
        Object cached = resolved.get(key);
        if (cached != null) {
            return unmask(cached);
        }

        resolveLock.lock();
        try {
            cached = resolved.get(key);
            if (cached != null) {
                return unmask(cached);
            }
            Object created = build(key, binding.getFactory());
            // 构造期间 key 可能被重新绑定，只缓存仍然有效的绑定
            if (bindings.get(key) == binding) {
                resolved.put(key, created == null ? NULL : created);
            }
            log.debug("Resolved singleton [{}]", key);
            return created;
        } finally {
            resolveLock.unlock();
        }
    }

    private Object build(String key, ServiceFactory<?> factory) {
        Deque<String> stack = buildStack.get();
        if (stack.contains(key)) {
            throw new BindingResolutionException(key,
                    "Circular dependency while resolving [" + key + "]: " + stack);
        }
        stack.push(key);
        try {
            // 工厂抛出的异常原样向上传播
            return factory.create(this);
        } finally {
            stack.pop();
        }
    }

    private Object instantiate(String key, Class<?> type) {
        try {
            Constructor<?> constructor = findConstructor(type);
            if (constructor.getParameterCount() == 1) {
                return constructor.newInstance(this);
            }
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new BindingResolutionException(key,
                    "Class " + type.getName() + " must have a public (Container) or no-arg constructor", e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new BindingResolutionException(key,
                    "Class " + type.getName() + " threw an exception during initialization", cause);
        } catch (ReflectiveOperationException e) {
            throw new BindingResolutionException(key, "Failed to instantiate " + type.getName(), e);
        }
    }

    private Constructor<?> findConstructor(Class<?> type) throws NoSuchMethodException {
        try {
            return type.getConstructor(Container.class);
        } catch (NoSuchMethodException ignored) {
            // 退回无参构造器
            return type.getConstructor();
        }
    }

    // ==================== 状态查询 ====================

    @Override
    public boolean bound(String key) {
        if (key == null) {
            return false;
        }
        return bindings.containsKey(key) || (aliases.containsKey(key) && bindings.containsKey(getAlias(key)));
    }

    @Override
    public boolean resolved(String key) {
        if (key == null) {
            return false;
        }
        String abstractKey = getAlias(key);
        Binding binding = bindings.get(abstractKey);
        if (binding != null && binding.getType() == BindingType.INSTANCE) {
            return true;
        }
        return resolved.containsKey(abstractKey);
    }

    public boolean isAlias(String name) {
        return aliases.containsKey(name);
    }

    /**
     * 沿别名链找到最终的 key
     */
    public String getAlias(String name) {
        String current = name;
        int hops = 0;
        while (aliases.containsKey(current)) {
            current = aliases.get(current);
            if (++hops > aliases.size()) {
                throw new BindingResolutionException(name, "Alias cycle detected for [" + name + "]");
            }
        }
        return current;
    }

    /**
     * 当前绑定快照（只读）
     */
    public Map<String, Binding> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    @Override
    public boolean runningInConsole() {
        if (!bound(RUNNING_IN_CONSOLE)) {
            return false;
        }
        return Boolean.TRUE.equals(make(RUNNING_IN_CONSOLE));
    }

    // ==================== 数组式访问 ====================

    /**
     * 等价于 {@link #make(String)}
     */
    public Object get(String key) {
        return make(key);
    }

    /**
     * 等价于 {@link #instance(String, Object)}
     */
    public void set(String key, Object value) {
        instance(key, value);
    }

    // ==================== 清理 ====================

    /**
     * 清空所有绑定、单例缓存与别名
     */
    @Override
    public void flush() {
        resolveLock.lock();
        try {
            bindings.clear();
            resolved.clear();
            aliases.clear();
        } finally {
            resolveLock.unlock();
        }
        log.debug("Container flushed");
    }

    // ==================== 校验 ====================

    private static void requireKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new InvalidArgumentException("key", "Service key cannot be blank");
        }
    }

    private static void requireFactory(String key, ServiceFactory<?> factory) {
        if (factory == null) {
            throw new InvalidArgumentException("factory", "Factory for [" + key + "] cannot be null");
        }
    }

    private static Object unmask(Object cached) {
        return cached == NULL ? null : cached;
    }
}
