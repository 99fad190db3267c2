package com.hostbridge.core.exception;

import com.hostbridge.api.exception.BridgeException;

/**
 * 绑定解析异常
 * <p>
 * 按类型绑定的单例无法实例化，或单例构造出现循环依赖时抛出
 */
public class BindingResolutionException extends BridgeException {

    private final String key;

    public BindingResolutionException(String key, String message) {
        super(message);
        this.key = key;
    }

    public BindingResolutionException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
