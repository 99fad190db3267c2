package com.hostbridge.core.database;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一行查询结果（FetchMode.CLASS）
 */
public final class Row {

    private final Map<String, Object> columns;

    public Row(Map<String, Object> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public Object get(String column) {
        return columns.get(column);
    }

    public Object get(int index) {
        return new ArrayList<>(columns.values()).get(index);
    }

    public boolean has(String column) {
        return columns.containsKey(column);
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public Map<String, Object> toMap() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row other && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + columns;
    }
}
