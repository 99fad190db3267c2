package com.hostbridge.core.database;

import com.hostbridge.api.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.Properties;

/**
 * 默认连接工厂：通过 {@link DriverManager} 按 url / username / password 建立连接
 */
@Slf4j
public class DriverManagerConnectionFactory implements ConnectionFactory {

    @Override
    public Connection connect(String name, Map<String, Object> config) throws SQLException {
        Object url = config.get("url");
        if (url == null || String.valueOf(url).trim().isEmpty()) {
            throw new InvalidArgumentException("url", "Database connection [" + name + "] has no url configured.");
        }

        Properties props = new Properties();
        Object options = config.get("options");
        if (options instanceof Map<?, ?> map) {
            map.forEach((k, v) -> props.setProperty(String.valueOf(k), String.valueOf(v)));
        }
        if (config.get("username") != null) {
            props.setProperty("user", String.valueOf(config.get("username")));
        }
        if (config.get("password") != null) {
            props.setProperty("password", String.valueOf(config.get("password")));
        }

        log.info("[{}] Opening JDBC connection to {}", name, url);
        return DriverManager.getConnection(String.valueOf(url), props);
    }
}
