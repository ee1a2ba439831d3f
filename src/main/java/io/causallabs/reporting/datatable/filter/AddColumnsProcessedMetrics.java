package io.causallabs.reporting.datatable.filter;

import java.util.List;
import java.util.Objects;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.causallabs.reporting.datatable.DataTable;
import io.causallabs.reporting.datatable.DataTableFilter;
import io.causallabs.reporting.metrics.ProcessedMetric;
import io.causallabs.reporting.metrics.processed.ActionsPerVisit;
import io.causallabs.reporting.metrics.processed.AverageTimeOnSite;
import io.causallabs.reporting.metrics.processed.BounceRate;
import io.causallabs.reporting.metrics.processed.ConversionRate;

/**
 * Registers processed metrics on a {@link DataTable}, computed from columns the rows already have.
 *
 * <p>Metrics registered, in this order:
 * <ul>
 * <li>conversion_rate: nb_visits_converted / nb_visits</li>
 * <li>nb_actions_per_visit: nb_actions / nb_visits</li>
 * <li>avg_time_on_site: round(visit_length / nb_visits), in seconds</li>
 * <li>bounce_rate: bounce_count / nb_visits</li>
 * </ul>
 * <p>
 * The metrics are appended to the table's {@link DataTable#EXTRA_PROCESSED_METRICS_METADATA_NAME}
 * metadata, after anything already there, and are only evaluated when the table is rendered.
 * Filtering the same table twice registers them twice; see
 * {@link ProcessedMetric#distinctByName(List)}.
 *
 * <p>By default rows with neither visits nor actions are deleted first.
 *
 * <pre>
 * table.filter(new AddColumnsProcessedMetrics());
 * </pre>
 */
public class AddColumnsProcessedMetrics extends DataTableFilter {

    /** Request parameter that asks for the processed metrics columns. */
    public static final String REQUEST_PARAMETER = "filter_add_columns_when_show_all_columns";

    public AddColumnsProcessedMetrics() {
        this(FilterOptions.DEFAULTS);
    }

    public AddColumnsProcessedMetrics(boolean deleteRowsWithNoVisit) {
        this(FilterOptions.builder().deleteRowsWithNoVisit(deleteRowsWithNoVisit).build());
    }

    public AddColumnsProcessedMetrics(FilterOptions options) {
        m_options = Objects.requireNonNull(options, "options");
        m_rowPruner = new RowPruner();
    }

    @Override
    public void filter(DataTable table) {
        Objects.requireNonNull(table, "table");
        if (m_options.isDeleteRowsWithNoVisit()) {
            int deleted = m_rowPruner.pruneZeroActivityRows(table);
            logger.debug("Deleted {} rows with no visit", deleted);
        }

        List<ProcessedMetric> extraProcessedMetrics = table.getExtraProcessedMetrics();
        extraProcessedMetrics.addAll(createMetrics());
        table.setExtraProcessedMetrics(extraProcessedMetrics);
        logger.debug("Table now has {} extra processed metrics", extraProcessedMetrics.size());
    }

    /** The metrics this filter registers, configured from its options. */
    public List<ProcessedMetric> createMetrics() {
        int precision = m_options.getRoundPrecision();
        double invalidDivision = m_options.getInvalidDivision();
        return List.of(new ConversionRate(precision, invalidDivision),
                new ActionsPerVisit(precision, invalidDivision),
                new AverageTimeOnSite(invalidDivision),
                new BounceRate(precision, invalidDivision));
    }

    public FilterOptions getOptions() {
        return m_options;
    }

    /**
     * Does a request ask for the processed metrics columns? Accepts true, 1, "1" and "true" for
     * {@link #REQUEST_PARAMETER}.
     */
    public static boolean isRequested(JsonNode params) {
        if (params == null || !params.has(REQUEST_PARAMETER)) {
            return false;
        }
        JsonNode node = params.get(REQUEST_PARAMETER);
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isIntegralNumber()) {
            return node.asLong() == 1;
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            return text.equals("1") || text.equalsIgnoreCase("true");
        }
        return false;
    }

    private final FilterOptions m_options;
    private final RowPruner m_rowPruner;
    private static final Logger logger = LoggerFactory.getLogger(AddColumnsProcessedMetrics.class);
}
