package com.hostbridge.core.filesystem;

import com.hostbridge.api.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 本地文件系统访问
 * 视图编译与翻译加载都通过它读写文件，便于测试替换。
 */
@Slf4j
public class Filesystem {

    public boolean exists(String path) {
        return Files.exists(Paths.get(path));
    }

    public boolean isFile(String path) {
        return Files.isRegularFile(Paths.get(path));
    }

    public boolean isDirectory(String path) {
        return Files.isDirectory(Paths.get(path));
    }

    /**
     * 读取文件全部内容
     *
     * @throws InvalidArgumentException 文件不存在
     */
    public String get(String path) {
        Path file = Paths.get(path);
        if (!Files.isRegularFile(file)) {
            throw new InvalidArgumentException("path", path, "File does not exist at path " + path);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    /**
     * 写入文件，父目录不存在时自动创建
     */
    public void put(String path, String contents) {
        Path file = Paths.get(path);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, contents, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    public long lastModified(String path) {
        try {
            return Files.getLastModifiedTime(Paths.get(path)).toMillis();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + path, e);
        }
    }

    public boolean makeDirectory(String path) {
        Path dir = Paths.get(path);
        if (Files.isDirectory(dir)) {
            return false;
        }
        try {
            Files.createDirectories(dir);
            log.debug("Created directory {}", dir);
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + path, e);
        }
    }

    public boolean delete(String path) {
        try {
            return Files.deleteIfExists(Paths.get(path));
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * 列出目录下的普通文件（不递归）
     */
    public List<String> files(String directory) {
        Path dir = Paths.get(directory);
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isRegularFile)
                    .map(Path::toString)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
    }
}
