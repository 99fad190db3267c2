package com.hostbridge.core.view;

import java.util.List;

/**
 * 视图定位器 SPI
 */
public interface ViewFinder {

    /**
     * 根据视图名（如 "emails.welcome"）定位模板文件
     *
     * @return 模板文件的完整路径
     */
    String find(String name);

    /**
     * 追加一个查找目录
     */
    void addLocation(String location);

    List<String> getPaths();

    /**
     * 清空查找缓存
     */
    void flush();
}
