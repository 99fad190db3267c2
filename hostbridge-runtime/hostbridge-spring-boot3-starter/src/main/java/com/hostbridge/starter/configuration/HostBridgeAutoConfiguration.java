package com.hostbridge.starter.configuration;

import com.hostbridge.runtime.HostBridge;
import com.hostbridge.starter.config.HostBridgeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(HostBridgeProperties.class)
@ConditionalOnProperty(prefix = "hostbridge", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HostBridgeAutoConfiguration {

    // 每个 ApplicationContext 持有自己的实例，上下文关闭时 flash；HostBridge 本身即 ServiceLocator
    @Bean(destroyMethod = "flash")
    @ConditionalOnMissingBean
    public HostBridge hostBridge(HostBridgeProperties properties) {
        HostBridge bridge = new HostBridge().bootstrap();

        if (StringUtils.hasText(properties.getConfigFile())) {
            bridge.setupConfiguration(Paths.get(properties.getConfigFile()));
        }
        if (properties.getRunningInConsole() != null) {
            bridge.setupRunningInConsole(properties.getRunningInConsole());
        }

        HostBridgeProperties.View view = properties.getView();
        if (!view.getPaths().isEmpty() && StringUtils.hasText(view.getCompiled())) {
            bridge.setupView(view.getPaths(), view.getCompiled());
        }

        HostBridgeProperties.Database database = properties.getDatabase();
        if (!database.getConnections().isEmpty()) {
            bridge.setupDatabase(database.getConnections(), database.getDefaultConnection(), database.getFetch());
        }

        if (properties.getPagination().isEnabled()) {
            bridge.setupPagination();
        }
        if (StringUtils.hasText(properties.getTranslator().getLangPath())) {
            bridge.setupTranslator(properties.getTranslator().getLangPath());
        }
        if (StringUtils.hasText(properties.getLocale())) {
            bridge.setupLocale(properties.getLocale());
        }
        if (properties.getDiagnostics().isEnabled()) {
            bridge.setupDiagnostics(properties.getDiagnostics().getConfig());
        }

        log.info("HostBridge configured with {} provider(s)", bridge.getLoadedProviders().size());
        return bridge;
    }
}
