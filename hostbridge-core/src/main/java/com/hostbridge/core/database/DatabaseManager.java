package com.hostbridge.core.database;

import com.hostbridge.api.container.Container;
import com.hostbridge.api.exception.InvalidArgumentException;
import com.hostbridge.core.config.ConfigRepository;
import com.hostbridge.core.event.EventDispatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 数据库管理器
 * <p>
 * 按名称懒创建 {@link DatabaseConnection}，连接配置读取自 database.connections.{name}，
 * 默认连接名读取自 database.default。
 */
@Slf4j
public class DatabaseManager {

    private final Container container;
    private final ConnectionFactory connectionFactory;
    private final Map<String, DatabaseConnection> connections = new ConcurrentHashMap<>();

    private volatile EventDispatcher events;

    public DatabaseManager(Container container, ConnectionFactory connectionFactory) {
        this.container = container;
        this.connectionFactory = connectionFactory;
    }

    public DatabaseConnection connection() {
        return connection(null);
    }

    public DatabaseConnection connection(String name) {
        String connectionName = name == null ? getDefaultConnection() : name;
        return connections.computeIfAbsent(connectionName, this::makeConnection);
    }

    private DatabaseConnection makeConnection(String name) {
        ConfigRepository config = config();
        Map<String, Object> connectionConfig = config.getMap("database.connections." + name);
        if (connectionConfig.isEmpty()) {
            throw new InvalidArgumentException("connection", name, "Database connection [" + name + "] not configured.");
        }
        FetchMode fetchMode = FetchMode.from(config.get("database.fetch"));
        DatabaseConnection connection = new DatabaseConnection(name, connectionConfig, connectionFactory, fetchMode);
        connection.setEventDispatcher(events);
        log.info("[{}] Database connection created (fetch={})", name, fetchMode);
        return connection;
    }

    public String getDefaultConnection() {
        return config().getString("database.default", "default");
    }

    public void setDefaultConnection(String name) {
        config().set("database.default", name);
    }

    /**
     * 断开并移除连接，下次访问时重新创建
     */
    public void purge(String name) {
        String connectionName = name == null ? getDefaultConnection() : name;
        DatabaseConnection removed = connections.remove(connectionName);
        if (removed != null) {
            removed.disconnect();
        }
    }

    public void disconnectAll() {
        connections.values().forEach(DatabaseConnection::disconnect);
        connections.clear();
    }

    public Map<String, DatabaseConnection> getConnections() {
        return Collections.unmodifiableMap(connections);
    }

    /**
     * 设置事件分发器，已创建的连接同步更新
     */
    public void setEventDispatcher(EventDispatcher events) {
        this.events = events;
        connections.values().forEach(c -> c.setEventDispatcher(events));
    }

    public EventDispatcher getEventDispatcher() {
        return events;
    }

    // ==================== 默认连接快捷方法 ====================

    public List<Object> select(String sql, Object... bindings) {
        return connection().select(sql, bindings);
    }

    public Object selectOne(String sql, Object... bindings) {
        return connection().selectOne(sql, bindings);
    }

    public boolean statement(String sql, Object... bindings) {
        return connection().statement(sql, bindings);
    }

    public int affectingStatement(String sql, Object... bindings) {
        return connection().affectingStatement(sql, bindings);
    }

    private ConfigRepository config() {
        return container.make("config", ConfigRepository.class);
    }
}
