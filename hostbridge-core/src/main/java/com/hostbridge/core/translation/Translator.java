package com.hostbridge.core.translation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 翻译器
 * <p>
 * key 形如 "group.item"（如 messages.welcome），第一段为分组文件名。
 * 找不到时依次尝试回退语言，最终返回 key 本身。
 * 文本中的 :name 占位符由 replace 参数替换。
 */
public class Translator {

    private final Loader loader;
    private volatile String locale;
    private volatile String fallback;

    // locale → group → lines
    private final Map<String, Map<String, Map<String, Object>>> loaded = new ConcurrentHashMap<>();

    public Translator(Loader loader, String locale) {
        this.loader = loader;
        this.locale = locale;
    }

    public String get(String key) {
        return get(key, Collections.emptyMap(), null);
    }

    public String get(String key, Map<String, ?> replace) {
        return get(key, replace, null);
    }

    public String get(String key, Map<String, ?> replace, String locale) {
        String line = findLine(key, locale);
        return makeReplacements(line == null ? key : line, replace);
    }

    public boolean has(String key) {
        return findLine(key, null) != null;
    }

    /**
     * 复数选择："apple|apples"，count 为 1 取第一种，否则取第二种；
     * 只有一种形式时直接使用它。count 同时作为 :count 占位符。
     */
    public String choice(String key, long count, Map<String, ?> replace) {
        String line = findLine(key, null);
        if (line == null) {
            return key;
        }
        String[] forms = line.split("\\|");
        String chosen = forms.length == 1 || count == 1 ? forms[0] : forms[1];
        Map<String, Object> all = replace == null ? new LinkedHashMap<>() : new LinkedHashMap<>(replace);
        all.putIfAbsent("count", count);
        return makeReplacements(chosen.trim(), all);
    }

    private String findLine(String key, String requestedLocale) {
        String primary = requestedLocale != null ? requestedLocale : locale;
        String line = lookup(primary, key);
        if (line == null && fallback != null && !fallback.equals(primary)) {
            line = lookup(fallback, key);
        }
        return line;
    }

    private String lookup(String locale, String key) {
        int dot = key.indexOf('.');
        if (dot <= 0 || dot == key.length() - 1) {
            return null;
        }
        String group = key.substring(0, dot);
        String item = key.substring(dot + 1);
        Map<String, Object> lines = loaded
                .computeIfAbsent(locale, l -> new ConcurrentHashMap<>())
                .computeIfAbsent(group, g -> loader.load(locale, g));

        Object value = lines.get(item);
        if (value == null) {
            Object current = lines;
            for (String segment : item.split("\\.")) {
                if (!(current instanceof Map<?, ?> map)) {
                    return null;
                }
                current = map.get(segment);
            }
            value = current;
        }
        return value instanceof String s ? s : null;
    }

    private static String makeReplacements(String line, Map<String, ?> replace) {
        if (replace == null || replace.isEmpty()) {
            return line;
        }
        String result = line;
        // 长 key 先替换，避免 :name 截断 :name_full
        List<String> keys = new ArrayList<>(replace.keySet());
        keys.sort(Comparator.comparingInt(String::length).reversed());
        for (String key : keys) {
            String value = String.valueOf(replace.get(key));
            result = result.replace(":" + key, value);
        }
        return result;
    }

    public String getLocale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public String getFallback() {
        return fallback;
    }

    public void setFallback(String fallback) {
        this.fallback = fallback;
    }

    public Loader getLoader() {
        return loader;
    }
}
