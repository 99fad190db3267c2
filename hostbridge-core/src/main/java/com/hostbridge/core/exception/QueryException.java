package com.hostbridge.core.exception;

import com.hostbridge.api.exception.BridgeException;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

/**
 * SQL 执行异常
 * 包装 {@link SQLException}，并携带出错的 SQL 与绑定参数
 */
public class QueryException extends BridgeException {

    private final String connectionName;
    private final String sql;
    private final List<Object> bindings;

    public QueryException(String connectionName, String sql, Object[] bindings, SQLException cause) {
        super(String.format("%s (Connection: %s, SQL: %s, Bindings: %s)",
                cause.getMessage(), connectionName, sql, Arrays.toString(bindings)), cause);
        this.connectionName = connectionName;
        this.sql = sql;
        this.bindings = Arrays.asList(bindings);
    }

    public String getConnectionName() {
        return connectionName;
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getBindings() {
        return bindings;
    }
}
