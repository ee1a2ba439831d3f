package io.causallabs.reporting.metrics;

import java.util.List;
import io.causallabs.reporting.datatable.Row;

/** A processed metric that is the rounded ratio of two raw columns. */
public abstract class RatioMetric extends ProcessedMetric {

    protected RatioMetric(String numerator, String denominator, int precision,
            double invalidDivision) {
        if (precision < 0) {
            throw new IllegalArgumentException("Precision must not be negative: " + precision);
        }
        m_numerator = numerator;
        m_denominator = denominator;
        m_precision = precision;
        m_invalidDivision = invalidDivision;
        m_dependentMetrics = List.of(numerator, denominator);
    }

    @Override
    public List<String> getDependentMetrics() {
        return m_dependentMetrics;
    }

    @Override
    public Number compute(Row row) {
        double numerator = getRawColumn(row, m_numerator);
        double denominator = getRawColumn(row, m_denominator);
        return SafeRatio.getQuotientSafe(numerator, denominator, m_invalidDivision, m_precision);
    }

    public int getPrecision() {
        return m_precision;
    }

    public double getInvalidDivision() {
        return m_invalidDivision;
    }

    private final String m_numerator;
    private final String m_denominator;
    private final int m_precision;
    private final double m_invalidDivision;
    private final List<String> m_dependentMetrics;
}
