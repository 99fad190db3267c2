package com.hostbridge.core.exception;

import com.hostbridge.api.exception.BridgeException;

/**
 * 服务未绑定异常
 * 解析一个没有任何绑定的 key 时抛出。
 */
public class UnboundServiceException extends BridgeException {

    private final String key;

    public UnboundServiceException(String key) {
        super("Service [" + key + "] is not bound in the container");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
