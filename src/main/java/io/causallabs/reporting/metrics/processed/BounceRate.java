package io.causallabs.reporting.metrics.processed;

import io.causallabs.reporting.metrics.Metrics;
import io.causallabs.reporting.metrics.RatioMetric;
import io.causallabs.reporting.metrics.SafeRatio;

/** Share of visits that bounced, as a fraction in [0,1]. */
public class BounceRate extends RatioMetric {

    public static final String NAME = "bounce_rate";

    public BounceRate() {
        this(SafeRatio.DEFAULT_PRECISION, SafeRatio.DEFAULT_INVALID_DIVISION);
    }

    public BounceRate(int precision, double invalidDivision) {
        super(Metrics.BOUNCE_COUNT, Metrics.NB_VISITS, precision, invalidDivision);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
