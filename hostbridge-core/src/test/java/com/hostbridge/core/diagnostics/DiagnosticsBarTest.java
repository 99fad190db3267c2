package com.hostbridge.core.diagnostics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("DiagnosticsBar 测试")
class DiagnosticsBarTest {

    @Test
    @DisplayName("默认启用数据库面板")
    void databasePanelShouldBeEnabledByDefault() {
        DiagnosticsBar bar = new DiagnosticsBar(Map.of(), false);

        assertTrue(bar.isEnabled());
        assertTrue(bar.isBarVisible());
        assertNotNull(bar.getPanel(DatabasePanel.ID, DatabasePanel.class));
    }

    @Test
    @DisplayName("控制台环境下不展示诊断栏")
    void consoleShouldHideBar() {
        DiagnosticsBar bar = new DiagnosticsBar(Map.of(), true);

        assertFalse(bar.isBarVisible());
        assertTrue(bar.isEnabled());
    }

    @Test
    @DisplayName("关闭总开关或面板开关时没有数据库面板")
    void disabledShouldHavePanelsOff() {
        assertTrue(new DiagnosticsBar(Map.of("enabled", false), false).getPanels().isEmpty());
        assertNull(new DiagnosticsBar(Map.of("panels", Map.of("database", false)), false)
                .getPanel(DatabasePanel.ID));
    }

    @Test
    @DisplayName("数据库面板只保留最近 maxQueries 条")
    void panelShouldBeBounded() throws SQLException {
        DiagnosticsBar bar = new DiagnosticsBar(Map.of("maxQueries", 2), false);
        DatabasePanel panel = bar.getPanel(DatabasePanel.ID, DatabasePanel.class);

        Connection handle = mock(Connection.class);
        DatabaseMetaData meta = mock(DatabaseMetaData.class);
        when(handle.getMetaData()).thenReturn(meta);
        when(meta.getDatabaseProductName()).thenReturn("H2");

        panel.logQuery("q1", List.of(), 1.0, "main", handle);
        panel.logQuery("q2", List.of(1), 2.0, "main", handle);
        panel.logQuery("q3", List.of(2), 3.0, "main", null);

        assertEquals(2, panel.getQueries().size());
        assertEquals("q2", panel.getQueries().get(0).getSql());
        assertEquals("H2", panel.getQueries().get(0).getDatabaseProduct());
        assertNull(panel.getQueries().get(1).getDatabaseProduct());
        assertEquals(3, panel.getTotalCount());
        assertEquals(6.0, panel.getTotalTime(), 0.0001);
        assertTrue(bar.render().startsWith("database: 3 queries"));

        panel.reset();
        assertEquals(0, panel.getTotalCount());
    }
}
