package io.causallabs.reporting.datatable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.causallabs.reporting.metrics.ProcessedMetric;

/**
 * The rows of a report plus a metadata side channel used to hand information to later stages of
 * the reporting pipeline.
 *
 * <p>Rows are identified by the id returned from {@link #addRow(Row)}. Ids are never reused within
 * a table. A table is not thread safe; it should be processed by one flow at a time.
 */
public class DataTable {

    /**
     * Metadata entry holding the ordered list of {@link ProcessedMetric}s the renderer should add
     * to each row.
     */
    public static final String EXTRA_PROCESSED_METRICS_METADATA_NAME = "EXTRA_PROCESSED_METRICS";

    public DataTable() {}

    public int addRow(Row row) {
        Objects.requireNonNull(row, "row");
        int id = m_nextRowId++;
        m_rows.put(id, row);
        return id;
    }

    public Row getRow(int id) {
        return m_rows.get(id);
    }

    /** Snapshot of the row ids. Safe to iterate while deleting rows. */
    public List<Integer> getRowIds() {
        return new ArrayList<>(m_rows.keySet());
    }

    /** Snapshot of the rows, in insertion order. */
    public List<Row> getRows() {
        return new ArrayList<>(m_rows.values());
    }

    /** @return true if the row was present */
    public boolean deleteRow(int id) {
        return m_rows.remove(id) != null;
    }

    public int getRowsCount() {
        return m_rows.size();
    }

    public void filter(DataTableFilter filter) {
        filter.filter(this);
    }

    /** Return the metadata value, or null if it isn't set. */
    public Object getMetadata(String name) {
        return m_metadata.get(name);
    }

    public void setMetadata(String name, Object value) {
        if (EXTRA_PROCESSED_METRICS_METADATA_NAME.equals(name)) {
            checkProcessedMetrics(value);
            Object previous = m_metadata.get(name);
            if (previous instanceof List && !((List<?>) previous).isEmpty()) {
                logger.warn("Replacing " + ((List<?>) previous).size()
                        + " extra processed metrics through setMetadata");
            }
        }
        m_metadata.put(name, value);
    }

    /**
     * The processed metrics registered for this table, in presentation order. Empty if none are
     * registered. The returned list is a copy.
     */
    public List<ProcessedMetric> getExtraProcessedMetrics() {
        Object value = m_metadata.get(EXTRA_PROCESSED_METRICS_METADATA_NAME);
        if (value == null) {
            return new ArrayList<>();
        }
        checkProcessedMetrics(value);
        List<ProcessedMetric> result = new ArrayList<>();
        for (Object o : (List<?>) value) {
            result.add((ProcessedMetric) o);
        }
        return result;
    }

    public void setExtraProcessedMetrics(List<? extends ProcessedMetric> metrics) {
        Objects.requireNonNull(metrics, "metrics");
        m_metadata.put(EXTRA_PROCESSED_METRICS_METADATA_NAME, new ArrayList<>(metrics));
    }

    private static void checkProcessedMetrics(Object value) {
        if (value == null) {
            return;
        }
        if (!(value instanceof List)) {
            throw new IllegalStateException(EXTRA_PROCESSED_METRICS_METADATA_NAME
                    + " must be a list of processed metrics, found "
                    + value.getClass().getName());
        }
        for (Object o : (List<?>) value) {
            if (!(o instanceof ProcessedMetric)) {
                throw new IllegalStateException(EXTRA_PROCESSED_METRICS_METADATA_NAME
                        + " contains a non metric entry: " + o);
            }
        }
    }

    private final Map<Integer, Row> m_rows = new LinkedHashMap<>();
    private final Map<String, Object> m_metadata = new LinkedHashMap<>();
    private int m_nextRowId = 0;
    private static final Logger logger = LoggerFactory.getLogger(DataTable.class);
}
