package com.hostbridge.core.diagnostics;

/**
 * 诊断面板
 */
public interface Panel {

    String getId();

    /**
     * 面板的单行摘要
     */
    String getSummary();
}
