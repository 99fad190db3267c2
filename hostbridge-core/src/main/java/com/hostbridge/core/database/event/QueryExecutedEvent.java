package com.hostbridge.core.database.event;

import com.hostbridge.api.event.BridgeEvent;
import com.hostbridge.core.database.DatabaseConnection;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * SQL 执行完成事件
 */
@Getter
@RequiredArgsConstructor
public class QueryExecutedEvent implements BridgeEvent {
    private final String sql;
    private final List<Object> bindings;
    private final double time; // 耗时（毫秒）
    private final DatabaseConnection connection;

    public String getConnectionName() {
        return connection.getName();
    }
}
