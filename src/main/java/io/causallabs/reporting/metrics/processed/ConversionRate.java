package io.causallabs.reporting.metrics.processed;

import io.causallabs.reporting.metrics.Metrics;
import io.causallabs.reporting.metrics.RatioMetric;
import io.causallabs.reporting.metrics.SafeRatio;

/** Share of visits that converted, as a fraction in [0,1]. Percent formatting is left to the renderer. */
public class ConversionRate extends RatioMetric {

    public static final String NAME = "conversion_rate";

    public ConversionRate() {
        this(SafeRatio.DEFAULT_PRECISION, SafeRatio.DEFAULT_INVALID_DIVISION);
    }

    public ConversionRate(int precision, double invalidDivision) {
        super(Metrics.NB_VISITS_CONVERTED, Metrics.NB_VISITS, precision, invalidDivision);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
