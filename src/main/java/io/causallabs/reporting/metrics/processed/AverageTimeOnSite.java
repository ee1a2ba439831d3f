package io.causallabs.reporting.metrics.processed;

import java.util.List;
import io.causallabs.reporting.datatable.Row;
import io.causallabs.reporting.metrics.Metrics;
import io.causallabs.reporting.metrics.ProcessedMetric;
import io.causallabs.reporting.metrics.SafeRatio;

/**
 * Average visit duration in whole seconds: visit_length / nb_visits rounded to the nearest
 * second. Not formatted as a duration. Rows without visits yield 0.
 */
public class AverageTimeOnSite extends ProcessedMetric {

    public static final String NAME = "avg_time_on_site";

    public AverageTimeOnSite() {
        this(SafeRatio.DEFAULT_INVALID_DIVISION);
    }

    public AverageTimeOnSite(double invalidDivision) {
        m_invalidDivision = invalidDivision;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<String> getDependentMetrics() {
        return DEPENDENT_METRICS;
    }

    @Override
    public Number compute(Row row) {
        double visitLength = getRawColumn(row, Metrics.VISIT_LENGTH);
        double visits = getRawColumn(row, Metrics.NB_VISITS);
        double seconds = SafeRatio.getQuotientSafe(visitLength, visits, m_invalidDivision, 0);
        return Math.round(seconds);
    }

    private final double m_invalidDivision;

    private static final List<String> DEPENDENT_METRICS =
            List.of(Metrics.VISIT_LENGTH, Metrics.NB_VISITS);
}
