package com.hostbridge.api.provider;

import com.hostbridge.api.container.Container;

/**
 * 带启动阶段的服务提供者
 * <p>
 * boot 在同一提供者的 register 完成后调用，依赖从调用时刻的容器状态中解析。
 */
public interface BootableServiceProvider extends ServiceProvider {

    /**
     * 启动阶段：接线运行时行为（注册编译器、挂接事件等）
     *
     * @param container 目标容器
     */
    void boot(Container container);
}
