package com.hostbridge.core.view;

import com.hostbridge.api.container.Container;
import com.hostbridge.api.provider.BootableServiceProvider;
import com.hostbridge.core.config.ConfigRepository;
import com.hostbridge.core.filesystem.Filesystem;
import lombok.extern.slf4j.Slf4j;

/**
 * 视图子系统提供者
 * <p>
 * 读取配置 view.paths / view.compiled，注册 view.finder、view.compiler、view.engine 与 view。
 */
@Slf4j
public class ViewServiceProvider implements BootableServiceProvider {

    @Override
    public void register(Container container) {
        container.singleton("view.finder", c -> new FileViewFinder(
                c.make("files", Filesystem.class),
                c.make("config", ConfigRepository.class).getStringList("view.paths")));

        container.singleton("view.compiler", c -> new TemplateCompiler(
                c.make("files", Filesystem.class),
                c.make("config", ConfigRepository.class).getString("view.compiled", null)));

        container.singleton("view.engine", c -> new CompilerEngine(
                c.make("view.compiler", TemplateCompiler.class),
                c.make("files", Filesystem.class)));

        container.singleton("view", c -> new ViewFactory(
                c.make("view.finder", ViewFinder.class),
                c.make("view.engine", CompilerEngine.class)));
    }

    @Override
    public void boot(Container container) {
        TemplateCompiler compiler = container.make("view.compiler", TemplateCompiler.class);
        if (container.make("files", Filesystem.class).makeDirectory(compiler.getCachePath())) {
            log.info("Created compiled view directory {}", compiler.getCachePath());
        }
        container.make("view", ViewFactory.class).share("app", container);
    }
}
