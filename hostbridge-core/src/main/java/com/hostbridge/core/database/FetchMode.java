package com.hostbridge.core.database;

import com.hostbridge.api.exception.InvalidArgumentException;

/**
 * 查询结果的行形态
 */
public enum FetchMode {
    ASSOC, // 列名 → 值 的 Map
    NUM, // 按列序的 List
    CLASS; // Row 对象，可按列名或列序取值

    /**
     * 解析配置值，支持枚举本身或大小写不敏感的名称
     */
    public static FetchMode from(Object value) {
        if (value == null) {
            return CLASS;
        }
        if (value instanceof FetchMode mode) {
            return mode;
        }
        try {
            return FetchMode.valueOf(String.valueOf(value).trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("database.fetch", value, "Unknown fetch mode: " + value);
        }
    }
}
