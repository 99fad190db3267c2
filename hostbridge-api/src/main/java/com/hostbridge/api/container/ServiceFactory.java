package com.hostbridge.api.container;

/**
 * 延迟构造服务的工厂
 * <p>
 * 解析时以当前容器为参数调用，可从容器中读取其它依赖。
 *
 * @param <T> 服务类型
 */
@FunctionalInterface
public interface ServiceFactory<T> {

    T create(Container container);
}
