package com.hostbridge.core.database;

import com.hostbridge.api.container.Container;
import com.hostbridge.api.provider.BootableServiceProvider;
import com.hostbridge.core.event.EventDispatcher;

/**
 * 数据库子系统提供者
 * <p>
 * 注册 db.factory（宿主未提供时使用 DriverManager）、db 与 db.connection，
 * 启动阶段把事件分发器挂到管理器上，使每条 SQL 都会分发 QueryExecutedEvent。
 */
public class DatabaseServiceProvider implements BootableServiceProvider {

    @Override
    public void register(Container container) {
        if (!container.bound("db.factory")) {
            container.singleton("db.factory", c -> new DriverManagerConnectionFactory());
        }

        container.singleton("db", c -> new DatabaseManager(c, c.make("db.factory", ConnectionFactory.class)));

        container.bind("db.connection", c -> c.make("db", DatabaseManager.class).connection());
    }

    @Override
    public void boot(Container container) {
        container.make("db", DatabaseManager.class)
                .setEventDispatcher(container.make("events", EventDispatcher.class));
    }
}
