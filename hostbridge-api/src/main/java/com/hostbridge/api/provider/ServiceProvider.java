package com.hostbridge.api.provider;

import com.hostbridge.api.container.Container;

/**
 * 服务提供者
 * <p>
 * 子系统接入容器的入口。register 阶段只声明绑定，不解析任何依赖。
 * 需要在绑定完成后接线运行时行为的提供者应实现 {@link BootableServiceProvider}。
 */
public interface ServiceProvider {

    /**
     * 注册阶段：向容器声明绑定
     *
     * @param container 目标容器
     */
    void register(Container container);
}
