package com.hostbridge.core.diagnostics;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 数据库查询面板
 * 只保留最近 maxQueries 条记录，计数与总耗时覆盖全部查询。
 */
@Slf4j
public class DatabasePanel implements Panel {

    public static final String ID = "database";

    private final int maxQueries;
    private final Deque<QueryRecord> queries = new ArrayDeque<>();
    private long totalCount = 0;
    private double totalTime = 0;

    @Value
    public static class QueryRecord {
        String sql;
        List<Object> bindings;
        double time; // 毫秒
        String connectionName;
        String databaseProduct;
    }

    public DatabasePanel(int maxQueries) {
        this.maxQueries = Math.max(maxQueries, 1);
    }

    @Override
    public String getId() {
        return ID;
    }

    public synchronized void logQuery(String sql, List<Object> bindings, double time,
                                      String connectionName, Connection handle) {
        if (queries.size() >= maxQueries) {
            queries.pollFirst();
        }
        queries.addLast(new QueryRecord(sql, new ArrayList<>(bindings), time, connectionName, productOf(handle)));
        totalCount++;
        totalTime += time;
        log.debug("[{}] {} {} {} ms", connectionName, sql, bindings, String.format("%.2f", time));
    }

    public synchronized List<QueryRecord> getQueries() {
        return new ArrayList<>(queries);
    }

    public synchronized long getTotalCount() {
        return totalCount;
    }

    public synchronized double getTotalTime() {
        return totalTime;
    }

    public synchronized void reset() {
        queries.clear();
        totalCount = 0;
        totalTime = 0;
    }

    @Override
    public synchronized String getSummary() {
        return String.format("%d queries, %.2f ms", totalCount, totalTime);
    }

    private static String productOf(Connection handle) {
        if (handle == null) {
            return null;
        }
        try {
            DatabaseMetaData meta = handle.getMetaData();
            return meta == null ? null : meta.getDatabaseProductName();
        } catch (SQLException e) {
            log.debug("Cannot read database metadata: {}", e.getMessage());
            return null;
        }
    }
}
