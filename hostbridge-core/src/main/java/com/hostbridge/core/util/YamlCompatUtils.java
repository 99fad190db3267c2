package com.hostbridge.core.util;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * YAML 读取工具类
 * 配置文件与翻译文件都只需要普通的 Map / List / 标量结构，
 * 因此统一使用 SafeConstructor，拒绝任何全局类型标签。
 */
@Slf4j
public class YamlCompatUtils {

    private YamlCompatUtils() {
    }

    /**
     * 创建仅用于加载的安全 Yaml 实例
     */
    public static Yaml createLoaderYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(loaderOptions));
    }

    /**
     * 加载 YAML 文档为 Map，空文档返回空 Map
     */
    public static Map<String, Object> loadMap(InputStream in) {
        return toMap(createLoaderYaml().load(in));
    }

    public static Map<String, Object> loadMap(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return toMap(createLoaderYaml().load(reader));
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toMap(Object document) {
        if (document == null) {
            return Collections.emptyMap();
        }
        if (!(document instanceof Map)) {
            log.warn("YAML root is a {}, expected a mapping; ignoring", document.getClass().getSimpleName());
            return Collections.emptyMap();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<Object, Object>) document).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
