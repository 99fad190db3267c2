package com.hostbridge.core.translation;

import com.hostbridge.api.container.Container;
import com.hostbridge.api.provider.ServiceProvider;
import com.hostbridge.core.config.ConfigRepository;
import com.hostbridge.core.filesystem.Filesystem;

/**
 * 翻译子系统提供者
 * <p>
 * 翻译目录取自 path.lang，语言取自 app.locale（默认 en），回退语言取自 app.fallback_locale。
 */
public class TranslationServiceProvider implements ServiceProvider {

    @Override
    public void register(Container container) {
        container.singleton("translation.loader", c -> new FileLoader(
                c.make("files", Filesystem.class),
                c.make("path.lang", String.class)));

        container.singleton("translator", c -> {
            ConfigRepository config = c.make("config", ConfigRepository.class);
            Translator translator = new Translator(
                    c.make("translation.loader", Loader.class),
                    config.getString("app.locale", "en"));
            translator.setFallback(config.getString("app.fallback_locale", null));
            return translator;
        });
    }
}
