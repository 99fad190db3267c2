package com.hostbridge.api.exception;

/**
 * HostBridge 异常基类
 * <p>
 * 桥接层抛出的所有异常均为非受检异常，由宿主应用决定是否恢复。
 */
public class BridgeException extends RuntimeException {

    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
