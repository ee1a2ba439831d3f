package io.causallabs.reporting.metrics;

import io.causallabs.reporting.datatable.Row;

/** Reads raw counter columns out of a row. Implementations never write to the row. */
public interface RawColumnAccessor {

    /**
     * @param columnId one of the canonical names in {@link Metrics}
     * @return the value of the column, or 0 if the row doesn't have it
     */
    public double getRawColumn(Row row, String columnId);
}
