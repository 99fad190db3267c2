package com.hostbridge.core.http;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 请求快照
 * <p>
 * 宿主通过 {@link RequestContextHolder} 提供当前请求；没有请求时（控制台、定时任务）
 * {@link #capture()} 返回一个 GET / 的空请求。
 */
@Getter
@Builder
public class Request {

    @Builder.Default
    private final String method = "GET";

    @Builder.Default
    private final String scheme = "http";

    @Builder.Default
    private final String host = "localhost";

    @Builder.Default
    private final String path = "/";

    @Singular("queryParam")
    private final Map<String, String> query;

    @Singular
    private final Map<String, String> headers;

    /**
     * 捕获当前请求
     */
    public static Request capture() {
        Request current = RequestContextHolder.get();
        return current != null ? current : console();
    }

    public static Request console() {
        return Request.builder().build();
    }

    /**
     * 读取查询参数
     */
    public String input(String key) {
        return query.get(key);
    }

    public String input(String key, String defaultValue) {
        return query.getOrDefault(key, defaultValue);
    }

    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * 不带查询串的完整 URL
     */
    public String url() {
        return scheme + "://" + host + (path.startsWith("/") ? path : "/" + path);
    }

    public List<String> segments() {
        String trimmed = path.replaceAll("^/+|/+$", "");
        return trimmed.isEmpty() ? Collections.emptyList() : List.of(trimmed.split("/"));
    }

    @Override
    public String toString() {
        return method + " " + url();
    }
}
