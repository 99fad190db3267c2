package com.hostbridge.core.http;

/**
 * 当前线程的请求持有者
 * 宿主在处理 HTTP 请求前写入，处理完成后清理
 */
public class RequestContextHolder {

    private static final ThreadLocal<Request> CURRENT_REQUEST = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(Request request) {
        CURRENT_REQUEST.set(request);
    }

    public static Request get() {
        return CURRENT_REQUEST.get();
    }

    public static void clear() {
        CURRENT_REQUEST.remove();
    }
}
