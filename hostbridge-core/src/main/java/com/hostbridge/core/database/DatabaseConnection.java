package com.hostbridge.core.database;

import com.hostbridge.core.database.event.QueryExecutedEvent;
import com.hostbridge.core.event.EventDispatcher;
import com.hostbridge.core.exception.QueryException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 具名数据库连接
 * <p>
 * JDBC 连接在首次执行语句时才建立。每条语句执行成功后分发 {@link QueryExecutedEvent}，
 * 开启查询日志时同时记录到内存。
 */
@Slf4j
public class DatabaseConnection {

    private final String name;
    private final Map<String, Object> config;
    private final ConnectionFactory connectionFactory;

    private volatile FetchMode fetchMode;
    private volatile EventDispatcher events;
    private Connection jdbcConnection;

    private volatile boolean loggingQueries = false;
    private final List<QueryLogEntry> queryLog = Collections.synchronizedList(new ArrayList<>());

    @Value
    public static class QueryLogEntry {
        String sql;
        List<Object> bindings;
        double time;
    }

    @FunctionalInterface
    private interface StatementCallback<T> {
        T run(PreparedStatement statement) throws SQLException;
    }

    public DatabaseConnection(String name, Map<String, Object> config,
                              ConnectionFactory connectionFactory, FetchMode fetchMode) {
        this.name = name;
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        this.connectionFactory = connectionFactory;
        this.fetchMode = fetchMode;
    }

    // ==================== 查询 ====================

    public List<Object> select(String sql, Object... bindings) {
        return run(sql, bindings, statement -> {
            try (ResultSet rs = statement.executeQuery()) {
                return fetchAll(rs);
            }
        });
    }

    /**
     * 返回第一行，没有结果时返回 null
     */
    public Object selectOne(String sql, Object... bindings) {
        List<Object> rows = select(sql, bindings);
        return rows.isEmpty() ? null : rows.get(0);
    }

    public int insert(String sql, Object... bindings) {
        return affectingStatement(sql, bindings);
    }

    public int update(String sql, Object... bindings) {
        return affectingStatement(sql, bindings);
    }

    public int delete(String sql, Object... bindings) {
        return affectingStatement(sql, bindings);
    }

    public int affectingStatement(String sql, Object... bindings) {
        return run(sql, bindings, PreparedStatement::executeUpdate);
    }

    public boolean statement(String sql, Object... bindings) {
        return run(sql, bindings, PreparedStatement::execute);
    }

    /**
     * 在事务中执行回调，回调抛出异常时回滚并原样抛出
     */
    public <T> T transaction(Function<DatabaseConnection, T> callback) {
        Connection connection = getJdbcConnection();
        try {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            T result;
            try {
                result = callback.apply(this);
            } catch (RuntimeException e) {
                log.warn("[{}] Rolling back transaction: {}", name, e.getMessage());
                // 回滚或恢复 autoCommit 失败只作为附带异常，抛出的仍是回调的异常
                try {
                    connection.rollback();
                } catch (SQLException rollbackFailure) {
                    log.error("[{}] Rollback failed: {}", name, rollbackFailure.getMessage());
                    e.addSuppressed(rollbackFailure);
                }
                try {
                    connection.setAutoCommit(autoCommit);
                } catch (SQLException restoreFailure) {
                    e.addSuppressed(restoreFailure);
                }
                throw e;
            }
            try {
                connection.commit();
            } finally {
                connection.setAutoCommit(autoCommit);
            }
            return result;
        } catch (SQLException e) {
            throw new QueryException(name, "transaction", new Object[0], e);
        }
    }

    private <T> T run(String sql, Object[] bindings, StatementCallback<T> callback) {
        Object[] params = bindings == null ? new Object[0] : bindings;
        long start = System.nanoTime();
        T result;
        try (PreparedStatement statement = getJdbcConnection().prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            result = callback.run(statement);
        } catch (SQLException e) {
            throw new QueryException(name, sql, params, e);
        }
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        logQuery(sql, Arrays.asList(params), elapsedMs);
        return result;
    }

    private void logQuery(String sql, List<Object> bindings, double time) {
        EventDispatcher dispatcher = events;
        if (dispatcher != null) {
            dispatcher.dispatch(new QueryExecutedEvent(sql, bindings, time, this));
        }
        if (loggingQueries) {
            queryLog.add(new QueryLogEntry(sql, bindings, time));
        }
        log.debug("[{}] {} {} ({} ms)", name, sql, bindings, String.format("%.2f", time));
    }

    private List<Object> fetchAll(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Object> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> columns = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                columns.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(shape(columns));
        }
        return rows;
    }

    private Object shape(Map<String, Object> columns) {
        switch (fetchMode) {
            case ASSOC:
                return columns;
            case NUM:
                return new ArrayList<>(columns.values());
            default:
                return new Row(columns);
        }
    }

    // ==================== 连接管理 ====================

    /**
     * 底层 JDBC 连接，按需建立
     */
    public synchronized Connection getJdbcConnection() {
        if (jdbcConnection == null) {
            try {
                jdbcConnection = connectionFactory.connect(name, config);
            } catch (SQLException e) {
                throw new QueryException(name, "connect", new Object[0], e);
            }
        }
        return jdbcConnection;
    }

    public synchronized boolean isConnected() {
        return jdbcConnection != null;
    }

    public synchronized void disconnect() {
        if (jdbcConnection == null) {
            return;
        }
        try {
            jdbcConnection.close();
            log.info("[{}] Disconnected", name);
        } catch (SQLException e) {
            log.warn("[{}] Error while closing connection: {}", name, e.getMessage());
        } finally {
            jdbcConnection = null;
        }
    }

    // ==================== 查询日志 ====================

    public void enableQueryLog() {
        loggingQueries = true;
    }

    public void disableQueryLog() {
        loggingQueries = false;
    }

    public List<QueryLogEntry> getQueryLog() {
        synchronized (queryLog) {
            return new ArrayList<>(queryLog);
        }
    }

    public void flushQueryLog() {
        queryLog.clear();
    }

    // ==================== 属性 ====================

    public String getName() {
        return name;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public FetchMode getFetchMode() {
        return fetchMode;
    }

    public void setFetchMode(FetchMode fetchMode) {
        this.fetchMode = fetchMode;
    }

    public EventDispatcher getEventDispatcher() {
        return events;
    }

    public void setEventDispatcher(EventDispatcher events) {
        this.events = events;
    }
}
