package com.hostbridge.api.container;

/**
 * 服务容器契约
 * <p>
 * 支持三种绑定：
 * <ul>
 * <li>实例：已构造好的对象</li>
 * <li>单例：首次解析时构造，之后返回同一对象</li>
 * <li>工厂：每次解析都重新构造</li>
 * </ul>
 * 同一个 key 重复绑定时，后注册者覆盖前者。
 */
public interface Container {

    /**
     * 绑定现成实例
     */
    <T> T instance(String key, T value);

    /**
     * 绑定单例（延迟构造，记忆化）
     */
    void singleton(String key, ServiceFactory<?> factory);

    /**
     * 按类型绑定单例，通过 (Container) 构造器或无参构造器实例化
     */
    void singleton(String key, Class<?> type);

    /**
     * 绑定工厂（每次解析都构造新对象）
     */
    void bind(String key, ServiceFactory<?> factory);

    /**
     * 为已有 key 注册别名
     */
    void alias(String key, String alias);

    /**
     * 解析服务
     */
    Object make(String key);

    /**
     * 解析服务并转换为指定类型
     */
    <T> T make(String key, Class<T> type);

    /**
     * 是否存在绑定（不触发解析）
     */
    boolean bound(String key);

    /**
     * 是否已经解析过（单例已构造或直接绑定了实例）
     */
    boolean resolved(String key);

    /**
     * 清空所有绑定、别名与单例缓存
     */
    void flush();

    /**
     * 宿主是否运行在控制台（非 HTTP）环境
     */
    boolean runningInConsole();
}
