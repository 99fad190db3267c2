package com.hostbridge.core.view;

import com.hostbridge.api.exception.InvalidArgumentException;
import com.hostbridge.core.filesystem.Filesystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("视图子系统测试")
class ViewFactoryTest {

    @TempDir
    Path root;

    private Path templates;
    private Path compiled;
    private Filesystem files;
    private ViewFactory factory;

    @BeforeEach
    void setUp() throws IOException {
        templates = Files.createDirectories(root.resolve("templates"));
        compiled = root.resolve("compiled");
        files = new Filesystem();

        TemplateCompiler compiler = new TemplateCompiler(files, compiled.toString());
        factory = new ViewFactory(
                new FileViewFinder(files, List.of(templates.toString())),
                new CompilerEngine(compiler, files));
    }

    private void template(String relative, String content) throws IOException {
        Path file = templates.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("渲染")
    class RenderTests {

        @Test
        @DisplayName("转义输出与原样输出")
        void shouldEscapeAndRaw() throws IOException {
            template("hello.html", "<p>{{ name }}</p>{!! html !!}");

            String out = factory.make("hello", Map.of("name", "<b>Tom</b>", "html", "<i>ok</i>")).render();

            assertEquals("<p>&lt;b&gt;Tom&lt;/b&gt;</p><i>ok</i>", out);
        }

        @Test
        @DisplayName("视图名中的点对应子目录")
        void dottedNameShouldMapToDirectory() throws IOException {
            template("emails/welcome.tpl", "Hi {{ user.name }}");

            assertTrue(factory.exists("emails.welcome"));
            assertEquals("Hi Ann", factory.make("emails.welcome", Map.of("user", Map.of("name", "Ann"))).render());
        }

        @Test
        @DisplayName("?? 提供默认值，注释被移除")
        void defaultValueAndComment() throws IOException {
            template("guest.html", "{{-- hidden --}}Hello {{ name ?? 'Guest' }}");

            assertEquals("Hello Guest", factory.make("guest").render());
        }

        @Test
        @DisplayName("共享数据可被视图数据覆盖")
        void sharedDataShouldBeOverridable() throws IOException {
            template("site.html", "{{ title }}|{{ site }}");
            factory.share("site", "Demo");
            factory.share("title", "Shared");

            String out = factory.make("site").with("title", "Own").render();

            assertEquals("Own|Demo", out);
        }

        @Test
        @DisplayName("编译结果写入缓存目录")
        void compiledFileShouldBeCached() throws IOException {
            template("cached.html", "{{ a }}");
            View view = factory.make("cached", Map.of("a", 1));

            view.render();

            String compiledPath = factory.getEngine().getCompiler().getCompiledPath(view.getPath());
            assertTrue(files.isFile(compiledPath));
            assertEquals("@{e:a}", files.get(compiledPath));
            assertTrue(compiledPath.startsWith(compiled.toString()));
        }
    }

    @Nested
    @DisplayName("查找与编译")
    class FinderTests {

        @Test
        @DisplayName("视图不存在时抛出 InvalidArgumentException")
        void missingViewShouldFail() {
            assertFalse(factory.exists("missing"));
            InvalidArgumentException e = assertThrows(InvalidArgumentException.class,
                    () -> factory.make("missing"));
            assertTrue(e.getMessage().contains("View [missing] not found."));
        }

        @Test
        @DisplayName("缓存路径为空时拒绝创建编译器")
        void blankCachePathShouldFail() {
            assertThrows(InvalidArgumentException.class, () -> new TemplateCompiler(files, " "));
        }

        @Test
        @DisplayName("模板中原有的 @{ 原样保留")
        void literalMarkerShouldSurvive() throws IOException {
            template("marker.html", "@{e:secret} {{ v }}");

            assertEquals("@{e:secret} x", factory.make("marker", Map.of("v", "x")).render());
        }

        @Test
        @DisplayName("预编译步骤先于内置规则执行")
        void precompilerShouldRunFirst() {
            TemplateCompiler compiler = new TemplateCompiler(files, compiled.toString());
            compiler.precompiler(s -> s.replace("[[", "{{").replace("]]", "}}"));

            assertEquals("@{e:x}", compiler.compileString("[[ x ]]"));
        }

        @Test
        @DisplayName("escape 转义 HTML 特殊字符")
        void escapeShouldCoverHtmlChars() {
            assertEquals("&amp;&lt;&gt;&quot;&#039;", CompilerEngine.escape("&<>\"'"));
        }
    }
}
