package io.causallabs.reporting.metrics;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import io.causallabs.reporting.datatable.Row;

/**
 * A metric derived from the raw columns of a row by a fixed formula. Definitions are registered
 * on a table and evaluated lazily by whatever renders the table.
 *
 * <p>Subclasses must be immutable and {@link #compute(Row)} must only read the columns returned by
 * {@link #getDependentMetrics()}. One instance can be shared by any number of tables.
 */
public abstract class ProcessedMetric {

    protected ProcessedMetric() {
        this(MetricsColumnAccessor.INSTANCE);
    }

    protected ProcessedMetric(RawColumnAccessor accessor) {
        m_accessor = accessor;
    }

    /** The output column name, e.g. conversion_rate */
    public abstract String getName();

    /** The raw columns this metric reads */
    public abstract List<String> getDependentMetrics();

    /**
     * Compute the metric for a row. Never modifies the row.
     *
     * @return the value, or null if the metric is undefined for this row
     */
    public abstract Number compute(Row row);

    protected double getRawColumn(Row row, String columnId) {
        return m_accessor.getRawColumn(row, columnId);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getName() + "]";
    }

    /**
     * Return the given definitions without repeats, keeping the first definition for each name.
     * Useful when a table may have been filtered more than once.
     */
    public static List<ProcessedMetric> distinctByName(List<? extends ProcessedMetric> metrics) {
        Set<String> seen = new LinkedHashSet<>();
        List<ProcessedMetric> result = new ArrayList<>();
        for (ProcessedMetric metric : metrics) {
            if (seen.add(metric.getName())) {
                result.add(metric);
            }
        }
        return result;
    }

    private final RawColumnAccessor m_accessor;
}
