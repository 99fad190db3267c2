package com.hostbridge.core.facade;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程级别名注册表
 * <p>
 * 把短名称（如 "View"）映射到门面类。已存在的名称不会被覆盖，
 * 因此宿主先定义的同名别名始终优先。
 */
@Slf4j
public final class AliasLoader {

    private static final Map<String, Class<?>> ALIASES = new ConcurrentHashMap<>();

    private AliasLoader() {
    }

    /**
     * 定义别名
     *
     * @return 是否新定义成功；名称已存在时返回 false
     */
    public static boolean define(String alias, Class<?> target) {
        Class<?> existing = ALIASES.putIfAbsent(alias, target);
        if (existing != null) {
            log.debug("Alias [{}] already defined as {}, skipping", alias, existing.getName());
            return false;
        }
        return true;
    }

    public static boolean exists(String alias) {
        return ALIASES.containsKey(alias);
    }

    public static Optional<Class<?>> resolve(String alias) {
        return Optional.ofNullable(ALIASES.get(alias));
    }

    /**
     * 仅当别名仍指向 target 时移除
     */
    public static boolean remove(String alias, Class<?> target) {
        return ALIASES.remove(alias, target);
    }

    public static Map<String, Class<?>> getAliases() {
        return Collections.unmodifiableMap(ALIASES);
    }
}
