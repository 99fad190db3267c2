package com.hostbridge.core.translation;

import java.util.Map;

/**
 * 翻译资源加载器 SPI
 */
public interface Loader {

    /**
     * 加载某语言下的一组翻译
     *
     * @return 嵌套的 key → 文本结构，不存在时返回空 Map
     */
    Map<String, Object> load(String locale, String group);
}
