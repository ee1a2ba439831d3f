package io.causallabs.reporting.metrics;

import java.util.Objects;
import io.causallabs.reporting.datatable.Row;

/**
 * Default {@link RawColumnAccessor}. Looks a column up by its canonical name first, then by its
 * archive index (see {@link Metrics#getColumnIndex(String)}).
 */
public class MetricsColumnAccessor implements RawColumnAccessor {

    public static final MetricsColumnAccessor INSTANCE = new MetricsColumnAccessor();

    @Override
    public double getRawColumn(Row row, String columnId) {
        Objects.requireNonNull(row, "row");
        Object value = row.getColumn(columnId);
        if (value == null) {
            Integer index = Metrics.getColumnIndex(columnId);
            if (index != null) {
                value = row.getColumn(String.valueOf(index));
            }
        }
        return toNumber(columnId, value);
    }

    private static double toNumber(String columnId, Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Raw column " + columnId + " is not numeric: '" + value + "'", e);
            }
        }
        throw new IllegalArgumentException("Raw column " + columnId + " is not numeric: "
                + value.getClass().getName());
    }
}
