package com.hostbridge.starter.config;

import com.hostbridge.core.database.FetchMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HostBridge 配置项，前缀 hostbridge
 *
 * <pre>
 * hostbridge:
 *   locale: zh_CN
 *   view:
 *     paths: [templates]
 *     compiled: build/views
 *   database:
 *     default: main
 *     connections:
 *       main:
 *         url: jdbc:h2:mem:app
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "hostbridge")
public class HostBridgeProperties {

    /**
     * 总开关
     */
    private boolean enabled = true;

    private Boolean runningInConsole;

    private String locale;

    /**
     * 额外合并进配置仓库的 YAML 文件
     */
    private String configFile;

    private View view = new View();

    private Database database = new Database();

    private Pagination pagination = new Pagination();

    private Translator translator = new Translator();

    private Diagnostics diagnostics = new Diagnostics();

    @Data
    public static class View {
        private List<String> paths = new ArrayList<>();
        private String compiled;
    }

    @Data
    public static class Database {
        private String defaultConnection = "default";
        private FetchMode fetch = FetchMode.CLASS;
        private Map<String, Map<String, Object>> connections = new LinkedHashMap<>();
    }

    @Data
    public static class Pagination {
        private boolean enabled = false;
    }

    @Data
    public static class Translator {
        private String langPath;
    }

    @Data
    public static class Diagnostics {
        private boolean enabled = false;
        private Map<String, Object> config = new LinkedHashMap<>();
    }
}
