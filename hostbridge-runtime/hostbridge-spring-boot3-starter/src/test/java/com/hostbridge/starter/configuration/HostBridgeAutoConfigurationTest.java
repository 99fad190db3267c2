package com.hostbridge.starter.configuration;

import com.hostbridge.api.container.ServiceLocator;
import com.hostbridge.core.diagnostics.DiagnosticsBar;
import com.hostbridge.core.pagination.PaginationServiceProvider;
import com.hostbridge.core.translation.TranslationServiceProvider;
import com.hostbridge.runtime.HostBridge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HostBridgeAutoConfiguration 测试")
class HostBridgeAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HostBridgeAutoConfiguration.class));

    @Test
    @DisplayName("默认注册已启动的 HostBridge，同时作为 ServiceLocator 暴露")
    void shouldRegisterBootstrappedBridge() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(HostBridge.class);
            assertThat(context).hasSingleBean(ServiceLocator.class);

            HostBridge bridge = context.getBean(HostBridge.class);
            assertThat(bridge.isBootstrapped()).isTrue();
            assertThat(bridge.has("config")).isTrue();
            assertThat(bridge.getLoadedProviders()).isEmpty();
        });
    }

    @Test
    @DisplayName("按配置接入子系统")
    void shouldApplyProperties() {
        contextRunner
                .withPropertyValues(
                        "hostbridge.locale=zh_CN",
                        "hostbridge.running-in-console=true",
                        "hostbridge.pagination.enabled=true",
                        "hostbridge.translator.lang-path=lang",
                        "hostbridge.diagnostics.enabled=true",
                        "hostbridge.diagnostics.config.enabled=true")
                .run(context -> {
                    HostBridge bridge = context.getBean(HostBridge.class);

                    assertThat(bridge.getConfig().get("app.locale")).isEqualTo("zh_CN");
                    assertThat(bridge.getApp().runningInConsole()).isTrue();
                    assertThat(bridge.getLoadedProviders())
                            .hasAtLeastOneElementOfType(PaginationServiceProvider.class)
                            .hasAtLeastOneElementOfType(TranslationServiceProvider.class);
                    assertThat(bridge.getApp().make("diagnostics", DiagnosticsBar.class).isBarVisible()).isFalse();
                });
    }

    @Test
    @DisplayName("关闭总开关时不注册")
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("hostbridge.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(HostBridge.class));
    }

    @Test
    @DisplayName("上下文关闭时 flash")
    void shouldFlashOnClose() {
        HostBridge[] holder = new HostBridge[1];
        contextRunner.run(context -> holder[0] = context.getBean(HostBridge.class));

        assertThat(holder[0].isBootstrapped()).isFalse();
    }
}
