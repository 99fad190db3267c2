package com.hostbridge.core.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * JDBC 连接工厂 SPI
 * 宿主可在 setupDatabase 之前以 "db.factory" 绑定自己的实现（例如连接池）
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * 创建连接
     *
     * @param name   连接名
     * @param config database.connections.{name} 下的配置
     */
    Connection connect(String name, Map<String, Object> config) throws SQLException;
}
