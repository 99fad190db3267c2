package com.hostbridge.api.container;

import com.hostbridge.api.exception.EntryNotFoundException;

/**
 * 服务定位接口
 * <p>
 * 外部调用方只通过 has/get 两个能力访问容器，不直接依赖容器实现。
 */
public interface ServiceLocator {

    /**
     * 标识是否已注册（实例、单例或工厂任意一种）
     */
    boolean has(String id);

    /**
     * 按标识获取服务
     *
     * @throws EntryNotFoundException 标识从未注册
     */
    Object get(String id);
}
