package io.causallabs.reporting.datatable.filter;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.causallabs.reporting.datatable.DataTable;
import io.causallabs.reporting.datatable.Row;
import io.causallabs.reporting.metrics.Metrics;
import io.causallabs.reporting.metrics.MetricsColumnAccessor;
import io.causallabs.reporting.metrics.RawColumnAccessor;

/** Removes rows that carry no activity at all. */
public class RowPruner {

    public RowPruner() {
        this(MetricsColumnAccessor.INSTANCE);
    }

    public RowPruner(RawColumnAccessor accessor) {
        m_accessor = accessor;
    }

    /**
     * Delete every row whose nb_visits and nb_actions are both 0. A row with actions but no
     * visits (e.g. a conversion recorded for a keyword without a visit that day) is kept.
     *
     * @return the number of rows deleted
     */
    public int pruneZeroActivityRows(DataTable table) {
        Objects.requireNonNull(table, "table");
        int deleted = 0;
        for (int id : table.getRowIds()) {
            Row row = table.getRow(id);
            double nbVisits = m_accessor.getRawColumn(row, Metrics.NB_VISITS);
            double nbActions = m_accessor.getRawColumn(row, Metrics.NB_ACTIONS);
            if (nbVisits == 0 && nbActions == 0) {
                table.deleteRow(id);
                deleted++;
                logger.debug("Deleted row {} with no visit", id);
            }
        }
        return deleted;
    }

    private final RawColumnAccessor m_accessor;
    private static final Logger logger = LoggerFactory.getLogger(RowPruner.class);
}
