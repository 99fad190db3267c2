package com.hostbridge.core.config;

import com.hostbridge.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigRepository 测试")
class ConfigRepositoryTest {

    private ConfigRepository config;

    @BeforeEach
    void setUp() {
        config = new ConfigRepository();
    }

    @Nested
    @DisplayName("点路径读写")
    class DottedTests {

        @Test
        @DisplayName("写入点路径后可以逐层读取")
        void shouldReadNestedValue() {
            config.set("database.connections.main.url", "jdbc:h2:mem:test");

            assertTrue(config.has("database.connections.main"));
            assertEquals("jdbc:h2:mem:test", config.get("database.connections.main.url"));
            assertEquals(Map.of("url", "jdbc:h2:mem:test"), config.getMap("database.connections.main"));
        }

        @Test
        @DisplayName("写入的 Map 被深拷贝，之后仍可按点路径修改")
        void shouldCopyWrittenMaps() {
            Map<String, Object> main = new LinkedHashMap<>();
            main.put("url", "jdbc:a");
            config.set("database.connections", Map.of("main", main));

            config.set("database.connections.main.url", "jdbc:b");

            assertEquals("jdbc:a", main.get("url"));
            assertEquals("jdbc:b", config.get("database.connections.main.url"));
        }

        @Test
        @DisplayName("缺失的 key 返回默认值")
        void missingKeyShouldReturnDefault() {
            assertNull(config.get("nope"));
            assertEquals("en", config.get("app.locale", "en"));
            assertEquals("en", config.getString("app.locale", "en"));
            assertTrue(config.getBoolean("flag", true));
            assertTrue(config.getMap("nothing").isEmpty());
        }

        @Test
        @DisplayName("标量被包装为单元素列表")
        void scalarShouldBecomeList() {
            config.set("view.paths", "templates");

            assertEquals(List.of("templates"), config.getStringList("view.paths"));
        }

        @Test
        @DisplayName("空白 key 被拒绝")
        void blankKeyShouldBeRejected() {
            assertThrows(InvalidArgumentException.class, () -> config.set("", 1));
        }
    }

    @Nested
    @DisplayName("批量操作")
    class BulkTests {

        @Test
        @DisplayName("push 向列表追加")
        void pushShouldAppend() {
            config.set("view.paths", List.of("a"));
            config.push("view.paths", "b");

            assertEquals(List.of("a", "b"), config.getStringList("view.paths"));
        }

        @Test
        @DisplayName("forget 移除嵌套项")
        void forgetShouldRemoveNested() {
            config.set("app.locale", "en");
            config.set("app.name", "demo");

            config.forget("app.locale");

            assertFalse(config.has("app.locale"));
            assertTrue(config.has("app.name"));
        }

        @Test
        @DisplayName("merge 递归合并 Map")
        void mergeShouldBeDeep() {
            config.set("app.locale", "en");
            config.merge(Map.of("app", Map.of("name", "demo")));

            assertEquals("en", config.get("app.locale"));
            assertEquals("demo", config.get("app.name"));
        }

        @Test
        @DisplayName("从 YAML 文件合并")
        void mergeYamlShouldLoadFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("app.yml");
            Files.writeString(file, "app:\n  locale: zh_CN\n  debug: true\n", StandardCharsets.UTF_8);

            config.mergeYaml(file);

            assertEquals("zh_CN", config.get("app.locale"));
            assertTrue(config.getBoolean("app.debug", false));
        }

        @Test
        @DisplayName("YAML 文件不存在时抛出 InvalidArgumentException")
        void missingYamlShouldFail(@TempDir Path dir) {
            assertThrows(InvalidArgumentException.class, () -> config.mergeYaml(dir.resolve("missing.yml")));
        }
    }
}
