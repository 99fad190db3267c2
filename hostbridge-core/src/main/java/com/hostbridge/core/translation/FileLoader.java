package com.hostbridge.core.translation;

import com.hostbridge.core.filesystem.Filesystem;
import com.hostbridge.core.util.YamlCompatUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

/**
 * 从 {langPath}/{locale}/{group}.yml 加载翻译
 */
@Slf4j
public class FileLoader implements Loader {

    private final Filesystem files;
    private final String path;

    public FileLoader(Filesystem files, String path) {
        this.files = files;
        this.path = path;
    }

    @Override
    public Map<String, Object> load(String locale, String group) {
        for (String extension : new String[]{"yml", "yaml"}) {
            String file = path + File.separator + locale + File.separator + group + "." + extension;
            if (files.isFile(file)) {
                byte[] bytes = files.get(file).getBytes(StandardCharsets.UTF_8);
                Map<String, Object> lines = YamlCompatUtils.loadMap(new ByteArrayInputStream(bytes));
                log.debug("Loaded {} translation keys from {}", lines.size(), file);
                return lines;
            }
        }
        return Collections.emptyMap();
    }

    public String getPath() {
        return path;
    }
}
