package com.hostbridge.core.view;

import com.hostbridge.core.filesystem.Filesystem;

import java.util.List;
import java.util.Map;

/**
 * 编译型视图引擎
 * <p>
 * 渲染前检查编译缓存是否过期，然后对编译结果中的 {@code @{e:expr}} / {@code @{r:expr}} 求值。
 * 表达式支持点路径取值（Map 键或列表下标）和 {@code ??} 默认值：
 * {@code user.name ?? 'Guest'}。
 */
public class CompilerEngine {

    private final TemplateCompiler compiler;
    private final Filesystem files;

    public CompilerEngine(TemplateCompiler compiler, Filesystem files) {
        this.compiler = compiler;
        this.files = files;
    }

    public TemplateCompiler getCompiler() {
        return compiler;
    }

    public String get(String path, Map<String, Object> data) {
        if (compiler.isExpired(path)) {
            compiler.compile(path);
        }
        return evaluate(files.get(compiler.getCompiledPath(path)), data);
    }

    String evaluate(String compiled, Map<String, Object> data) {
        StringBuilder out = new StringBuilder(compiled.length());
        int i = 0;
        while (i < compiled.length()) {
            if (compiled.startsWith("@@{", i)) {
                out.append("@{");
                i += 3;
                continue;
            }
            if (compiled.startsWith("@{", i)) {
                int end = compiled.indexOf('}', i);
                if (end > i + 4 && compiled.charAt(i + 3) == ':') {
                    char mode = compiled.charAt(i + 2);
                    Object value = resolveExpression(compiled.substring(i + 4, end), data);
                    String text = value == null ? "" : String.valueOf(value);
                    out.append(mode == 'e' ? escape(text) : text);
                    i = end + 1;
                    continue;
                }
            }
            out.append(compiled.charAt(i));
            i++;
        }
        return out.toString();
    }

    private Object resolveExpression(String expression, Map<String, Object> data) {
        String[] parts = expression.split("\\?\\?", 2);
        Object value = lookup(parts[0].trim(), data);
        if (value == null && parts.length == 2) {
            return literal(parts[1].trim(), data);
        }
        return value;
    }

    private Object literal(String token, Map<String, Object> data) {
        if (token.length() >= 2 && (token.startsWith("'") && token.endsWith("'")
                || token.startsWith("\"") && token.endsWith("\""))) {
            return token.substring(1, token.length() - 1);
        }
        return lookup(token, data);
    }

    private static Object lookup(String path, Map<String, Object> data) {
        Object current = data;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && segment.matches("\\d+")) {
                int index = Integer.parseInt(segment);
                current = index < list.size() ? list.get(index) : null;
            } else {
                return null;
            }
        }
        return current;
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                case '\'':
                    sb.append("&#039;");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
