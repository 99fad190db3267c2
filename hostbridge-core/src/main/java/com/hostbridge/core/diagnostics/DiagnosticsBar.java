package com.hostbridge.core.diagnostics;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 诊断栏
 * <p>
 * 配置项：
 * <ul>
 * <li>enabled：总开关，默认 true</li>
 * <li>showBar：是否展示诊断栏，默认 true；控制台环境下始终不展示</li>
 * <li>maxQueries：数据库面板保留的查询条数，默认 100</li>
 * <li>panels.database：是否启用数据库面板，默认 true</li>
 * </ul>
 */
@Slf4j
public class DiagnosticsBar {

    private final boolean enabled;
    private final boolean showBar;
    private final boolean runningInConsole;
    private final Map<String, Panel> panels = new LinkedHashMap<>();

    public DiagnosticsBar(Map<String, ?> config, boolean runningInConsole) {
        this.enabled = flag(config.get("enabled"), true);
        this.showBar = flag(config.get("showBar"), true);
        this.runningInConsole = runningInConsole;

        Map<?, ?> panelConfig = config.get("panels") instanceof Map<?, ?> m ? m : Collections.emptyMap();
        if (enabled && flag(panelConfig.get(DatabasePanel.ID), true)) {
            panels.put(DatabasePanel.ID, new DatabasePanel(number(config.get("maxQueries"), 100)));
        }
        log.info("Diagnostics bar initialized (enabled={}, panels={})", enabled, panels.keySet());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isBarVisible() {
        return enabled && showBar && !runningInConsole;
    }

    public Panel getPanel(String id) {
        return panels.get(id);
    }

    public <T extends Panel> T getPanel(String id, Class<T> type) {
        Panel panel = panels.get(id);
        return type.isInstance(panel) ? type.cast(panel) : null;
    }

    public Map<String, Panel> getPanels() {
        return Collections.unmodifiableMap(panels);
    }

    /**
     * 各面板摘要，每行一个
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        panels.forEach((id, panel) -> sb.append(id).append(": ").append(panel.getSummary()).append('\n'));
        return sb.toString();
    }

    private static boolean flag(Object value, boolean defaultValue) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }

    private static int number(Object value, int defaultValue) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid maxQueries value '{}', using {}", s, defaultValue);
            }
        }
        return defaultValue;
    }
}
