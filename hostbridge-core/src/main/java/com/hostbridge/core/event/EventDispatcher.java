package com.hostbridge.core.event;

import com.hostbridge.api.event.BridgeEvent;
import com.hostbridge.api.event.EventListener;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 事件分发器
 * <p>
 * 按事件的具体类型分发，监听器按注册顺序调用。
 * 监听器抛出的运行时异常直接向分发方传播。
 */
@Slf4j
public class EventDispatcher {

    private final Map<Class<? extends BridgeEvent>, List<EventListener<? extends BridgeEvent>>> listeners =
            new ConcurrentHashMap<>();

    /**
     * 注册监听器
     */
    public <E extends BridgeEvent> void listen(Class<E> eventType, EventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Listener registered for {}", eventType.getSimpleName());
    }

    public boolean hasListeners(Class<? extends BridgeEvent> eventType) {
        List<EventListener<? extends BridgeEvent>> list = listeners.get(eventType);
        return list != null && !list.isEmpty();
    }

    public List<EventListener<? extends BridgeEvent>> getListeners(Class<? extends BridgeEvent> eventType) {
        List<EventListener<? extends BridgeEvent>> list = listeners.get(eventType);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    /**
     * 移除某类事件的全部监听器
     */
    public void forget(Class<? extends BridgeEvent> eventType) {
        List<EventListener<? extends BridgeEvent>> removed = listeners.remove(eventType);
        if (removed != null) {
            log.debug("Removed {} listeners for {}", removed.size(), eventType.getSimpleName());
        }
    }

    public <E extends BridgeEvent> void dispatch(E event) {
        List<EventListener<? extends BridgeEvent>> list = listeners.get(event.getClass());
        if (list == null) {
            return;
        }
        for (EventListener<? extends BridgeEvent> listener : list) {
            @SuppressWarnings("unchecked")
            EventListener<E> castListener = (EventListener<E>) listener;
            try {
                castListener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener for {} threw exception, propagating: {}",
                        event.getClass().getSimpleName(), e.getMessage());
                throw e;
            }
        }
    }
}
