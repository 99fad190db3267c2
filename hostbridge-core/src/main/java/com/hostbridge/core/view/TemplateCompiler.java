package com.hostbridge.core.view;

import com.hostbridge.api.exception.InvalidArgumentException;
import com.hostbridge.core.filesystem.Filesystem;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模板编译器
 * <p>
 * 把模板语法编译为引擎可直接求值的中间形式，并缓存到编译目录：
 * <ul>
 * <li>{@code {{-- 注释 --}}} 删除</li>
 * <li>{@code {!! expr !!}} 原样输出 → {@code @{r:expr}}</li>
 * <li>{@code {{ expr }}} 转义输出 → {@code @{e:expr}}</li>
 * </ul>
 * 模板中原有的 {@code @{} 写作 {@code @@{}。
 */
@Slf4j
public class TemplateCompiler {

    private static final Pattern COMMENT = Pattern.compile("\\{\\{--.*?--}}", Pattern.DOTALL);
    private static final Pattern RAW_ECHO = Pattern.compile("\\{!!\\s*(.+?)\\s*!!}", Pattern.DOTALL);
    private static final Pattern ESCAPED_ECHO = Pattern.compile("\\{\\{\\s*(.+?)\\s*}}", Pattern.DOTALL);

    private final Filesystem files;
    private final String cachePath;

    // 在内置规则之前执行的自定义编译步骤
    private final List<UnaryOperator<String>> precompilers = new CopyOnWriteArrayList<>();

    public TemplateCompiler(Filesystem files, String cachePath) {
        if (cachePath == null || cachePath.trim().isEmpty()) {
            throw new InvalidArgumentException("view.compiled", "Please provide a valid cache path.");
        }
        this.files = files;
        this.cachePath = cachePath;
    }

    public String getCachePath() {
        return cachePath;
    }

    public String getCompiledPath(String path) {
        return cachePath + File.separator + sha1(path) + ".compiled";
    }

    /**
     * 编译结果不存在，或模板比编译结果更新时视为过期
     */
    public boolean isExpired(String path) {
        String compiled = getCompiledPath(path);
        if (!files.exists(compiled)) {
            return true;
        }
        return files.lastModified(path) >= files.lastModified(compiled);
    }

    public void compile(String path) {
        String compiled = compileString(files.get(path));
        files.put(getCompiledPath(path), compiled);
        log.debug("Compiled view {}", path);
    }

    public String compileString(String template) {
        String result = template;
        for (UnaryOperator<String> precompiler : precompilers) {
            result = precompiler.apply(result);
        }
        result = result.replace("@{", "@@{");
        result = COMMENT.matcher(result).replaceAll("");
        result = replaceEcho(RAW_ECHO, result, "r");
        result = replaceEcho(ESCAPED_ECHO, result, "e");
        return result;
    }

    public void precompiler(UnaryOperator<String> precompiler) {
        precompilers.add(precompiler);
    }

    private static String replaceEcho(Pattern pattern, String input, String mode) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement = "@{" + mode + ":" + matcher.group(1).trim() + "}";
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String sha1(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
