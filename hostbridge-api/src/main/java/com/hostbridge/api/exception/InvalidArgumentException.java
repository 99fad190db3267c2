package com.hostbridge.api.exception;

/**
 * 参数或配置无效
 * <p>
 * argument 指出被拒绝的是哪一项：配置键（如 {@code database.fetch}）、
 * 操作参数（{@code args}）或容器键（{@code key} / {@code alias}）。
 * 异常消息末尾会附上该名称，日志中无需再单独打印。
 */
public class InvalidArgumentException extends BridgeException {

    private final String argument;
    private final Object rejectedValue;

    public InvalidArgumentException(String argument, String message) {
        this(argument, null, message, null);
    }

    public InvalidArgumentException(String argument, Object rejectedValue, String message) {
        this(argument, rejectedValue, message, null);
    }

    public InvalidArgumentException(String argument, String message, Throwable cause) {
        this(argument, null, message, cause);
    }

    private InvalidArgumentException(String argument, Object rejectedValue, String message, Throwable cause) {
        super(argument == null ? message : message + " (argument: " + argument + ")", cause);
        this.argument = argument;
        this.rejectedValue = rejectedValue;
    }

    /**
     * 被拒绝的配置键或参数名
     */
    public String getArgument() {
        return argument;
    }

    /**
     * 被拒绝的值，未记录时为 null
     */
    public Object getRejectedValue() {
        return rejectedValue;
    }

    /**
     * 是否由配置项引起（带点号的键，如 {@code view.compiled}）
     */
    public boolean isConfigurationError() {
        return argument != null && argument.indexOf('.') > 0;
    }
}
