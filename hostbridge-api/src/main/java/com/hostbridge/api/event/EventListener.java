package com.hostbridge.api.event;

/**
 * 事件监听器
 *
 * @param <E> 事件类型
 */
@FunctionalInterface
public interface EventListener<E extends BridgeEvent> {

    void onEvent(E event);
}
