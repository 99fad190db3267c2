package com.hostbridge.api.exception;

/**
 * 服务条目未找到异常
 * 当通过 {@link com.hostbridge.api.container.ServiceLocator} 查找一个从未注册的标识时抛出。
 * <p>
 * 与"已注册但构造失败"区分开：后者会原样抛出构造时的异常。
 */
public class EntryNotFoundException extends BridgeException {

    private final String id;

    public EntryNotFoundException(String id) {
        super("No entry was found for identifier: " + id);
        this.id = id;
    }

    public EntryNotFoundException(String id, Throwable cause) {
        super("No entry was found for identifier: " + id, cause);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
