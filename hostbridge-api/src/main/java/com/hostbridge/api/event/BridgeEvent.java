package com.hostbridge.api.event;

/**
 * 事件标记接口
 */
public interface BridgeEvent {
}
