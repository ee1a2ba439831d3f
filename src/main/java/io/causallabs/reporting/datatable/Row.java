package io.causallabs.reporting.datatable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One row of a report: named columns holding raw counters or already computed values. */
public class Row {

    public Row() {}

    public Row(Map<String, ?> columns) {
        m_columns.putAll(columns);
    }

    /** Return the column value, or null if the row doesn't have that column. */
    public Object getColumn(String name) {
        return m_columns.get(name);
    }

    public boolean hasColumn(String name) {
        return m_columns.containsKey(name);
    }

    public Row setColumn(String name, Object value) {
        m_columns.put(name, value);
        return this;
    }

    public void deleteColumn(String name) {
        m_columns.remove(name);
    }

    /** Read only view of the columns, in insertion order. */
    public Map<String, Object> getColumns() {
        return Collections.unmodifiableMap(m_columns);
    }

    @Override
    public String toString() {
        return "Row" + m_columns;
    }

    private final Map<String, Object> m_columns = new LinkedHashMap<>();
}
