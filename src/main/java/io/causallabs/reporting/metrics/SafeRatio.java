package io.causallabs.reporting.metrics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Division helper for ratios where an empty denominator is an expected case, not an error. */
public final class SafeRatio {

    public static final double DEFAULT_INVALID_DIVISION = 0;
    public static final int DEFAULT_PRECISION = 2;

    public static double getQuotientSafe(double numerator, double denominator, int precision) {
        return getQuotientSafe(numerator, denominator, DEFAULT_INVALID_DIVISION, precision);
    }

    /**
     * Divide numerator by denominator and round the result.
     *
     * @param invalidDefault returned as is (not rounded) when the denominator is zero
     * @param precision number of decimal digits to keep
     */
    public static double getQuotientSafe(double numerator, double denominator,
            double invalidDefault, int precision) {
        if (denominator == 0) {
            return invalidDefault;
        }
        return round(numerator / denominator, precision);
    }

    /** Round half away from zero to the given number of decimal digits. */
    public static double round(double value, int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("Precision must not be negative: " + precision);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP).doubleValue();
    }

    private SafeRatio() {}
}
