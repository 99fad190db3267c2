package com.hostbridge.core.exception;

import com.hostbridge.api.exception.BridgeException;

/**
 * 未定义操作异常
 * 调用了启动器既不认识、也无法委托给容器的操作名时抛出。
 */
public class UndefinedOperationException extends BridgeException {

    private final String operation;

    public UndefinedOperationException(String operation) {
        super("Undefined method '" + operation + "'");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
