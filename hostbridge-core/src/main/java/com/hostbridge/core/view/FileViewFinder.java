package com.hostbridge.core.view;

import com.hostbridge.api.exception.InvalidArgumentException;
import com.hostbridge.core.filesystem.Filesystem;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 基于文件系统的视图定位器
 * 视图名中的 "." 对应目录分隔符，按目录顺序、再按扩展名顺序查找。
 */
public class FileViewFinder implements ViewFinder {

    public static final List<String> DEFAULT_EXTENSIONS = List.of("html", "tpl");

    private final Filesystem files;
    private final List<String> paths;
    private final List<String> extensions;
    private final Map<String, String> views = new ConcurrentHashMap<>();

    public FileViewFinder(Filesystem files, List<String> paths) {
        this(files, paths, DEFAULT_EXTENSIONS);
    }

    public FileViewFinder(Filesystem files, List<String> paths, List<String> extensions) {
        this.files = files;
        this.paths = new CopyOnWriteArrayList<>(paths);
        this.extensions = new ArrayList<>(extensions);
    }

    @Override
    public String find(String name) {
        String cached = views.get(name);
        if (cached != null) {
            return cached;
        }
        String found = findInPaths(name);
        views.put(name, found);
        return found;
    }

    private String findInPaths(String name) {
        String relative = name.replace('.', File.separatorChar);
        for (String path : paths) {
            for (String extension : extensions) {
                String candidate = path + File.separator + relative + "." + extension;
                if (files.isFile(candidate)) {
                    return candidate;
                }
            }
        }
        throw new InvalidArgumentException("view", name, "View [" + name + "] not found.");
    }

    @Override
    public void addLocation(String location) {
        paths.add(location);
    }

    @Override
    public List<String> getPaths() {
        return Collections.unmodifiableList(paths);
    }

    public List<String> getExtensions() {
        return Collections.unmodifiableList(extensions);
    }

    @Override
    public void flush() {
        views.clear();
    }
}
