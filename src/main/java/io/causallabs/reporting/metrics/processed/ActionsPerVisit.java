package io.causallabs.reporting.metrics.processed;

import io.causallabs.reporting.metrics.Metrics;
import io.causallabs.reporting.metrics.RatioMetric;
import io.causallabs.reporting.metrics.SafeRatio;

/** Average number of actions per visit. */
public class ActionsPerVisit extends RatioMetric {

    public static final String NAME = "nb_actions_per_visit";

    public ActionsPerVisit() {
        this(SafeRatio.DEFAULT_PRECISION, SafeRatio.DEFAULT_INVALID_DIVISION);
    }

    public ActionsPerVisit(int precision, double invalidDivision) {
        super(Metrics.NB_ACTIONS, Metrics.NB_VISITS, precision, invalidDivision);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
