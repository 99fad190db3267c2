package com.hostbridge.core.container;

import com.hostbridge.api.container.ServiceFactory;
import lombok.Value;

/**
 * 绑定描述：告诉容器如何为某个 key 产出值
 */
@Value
public class Binding {

    BindingType type;

    /**
     * INSTANCE 时为现成实例
     */
    Object instance;

    /**
     * SINGLETON / FACTORY 时为构造工厂
     */
    ServiceFactory<?> factory;

    public static Binding ofInstance(Object instance) {
        return new Binding(BindingType.INSTANCE, instance, null);
    }

    public static Binding ofSingleton(ServiceFactory<?> factory) {
        return new Binding(BindingType.SINGLETON, null, factory);
    }

    public static Binding ofFactory(ServiceFactory<?> factory) {
        return new Binding(BindingType.FACTORY, null, factory);
    }
}
