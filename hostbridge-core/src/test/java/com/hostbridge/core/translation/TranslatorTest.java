package com.hostbridge.core.translation;

import com.hostbridge.core.filesystem.Filesystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Translator 测试")
class TranslatorTest {

    @TempDir
    Path lang;

    private Translator translator;

    @BeforeEach
    void setUp() throws IOException {
        write("en/messages.yml", String.join("\n",
                "welcome: 'Welcome, :name'",
                "apples: 'One apple|:count apples'",
                "only_en: 'English only'",
                "nav:",
                "  home: Home",
                ""));
        write("zh_CN/messages.yaml", String.join("\n",
                "welcome: '欢迎，:name'",
                "greeting: ':name_full 与 :name'",
                ""));

        translator = new Translator(new FileLoader(new Filesystem(), lang.toString()), "zh_CN");
        translator.setFallback("en");
    }

    private void write(String relative, String content) throws IOException {
        Path file = lang.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("按当前语言翻译并替换占位符")
    void shouldTranslateWithReplacements() {
        assertEquals("欢迎，Tom", translator.get("messages.welcome", Map.of("name", "Tom")));
    }

    @Test
    @DisplayName("长占位符先替换")
    void longerPlaceholderShouldWin() {
        assertEquals("Tom Lee 与 Tom",
                translator.get("messages.greeting", Map.of("name", "Tom", "name_full", "Tom Lee")));
    }

    @Test
    @DisplayName("缺失时使用回退语言")
    void shouldUseFallbackLocale() {
        assertEquals("English only", translator.get("messages.only_en"));
        assertEquals("Home", translator.get("messages.nav.home"));
    }

    @Test
    @DisplayName("找不到时返回 key 本身")
    void missingKeyShouldReturnKey() {
        assertEquals("messages.nothing", translator.get("messages.nothing"));
        assertEquals("plain", translator.get("plain"));
        assertFalse(translator.has("messages.nothing"));
    }

    @Test
    @DisplayName("可以指定语言")
    void explicitLocaleShouldWin() {
        assertEquals("Welcome, Ann", translator.get("messages.welcome", Map.of("name", "Ann"), "en"));
    }

    @Test
    @DisplayName("choice 按数量选择复数形式")
    void choiceShouldPickForm() {
        translator.setLocale("en");

        assertEquals("One apple", translator.choice("messages.apples", 1, Map.of()));
        assertEquals("5 apples", translator.choice("messages.apples", 5, Map.of()));
    }

    @Test
    @DisplayName("choice 与 get 一样接受空的替换表")
    void choiceShouldAcceptNullReplacements() {
        translator.setLocale("en");

        assertEquals("5 apples", translator.choice("messages.apples", 5, null));
        assertEquals("One apple", translator.choice("messages.apples", 1, null));
    }
}
