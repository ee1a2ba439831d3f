package io.causallabs.reporting.datatable;

/**
 * A pass over a {@link DataTable} that changes it in place, e.g. deleting rows or attaching
 * metadata for the rendering stage. Run one with {@link DataTable#filter(DataTableFilter)}.
 */
public abstract class DataTableFilter {

    public abstract void filter(DataTable table);
}
