package io.causallabs.reporting.datatable.filter;

import java.io.IOException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import io.causallabs.reporting.metrics.SafeRatio;

/** Options that change the behavior of {@link AddColumnsProcessedMetrics}. */
public class FilterOptions {

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        /**
         * Should rows with neither visits nor actions be removed from the table before the
         * metrics are registered. Defaults to true.
         */
        public Builder deleteRowsWithNoVisit(boolean x) {
            m_obj.m_deleteRowsWithNoVisit = x;
            return this;
        }

        /** Decimal digits kept by the ratio metrics. Defaults to 2. */
        public Builder roundPrecision(int x) {
            if (x < 0) {
                throw new IllegalArgumentException("round precision must not be negative: " + x);
            }
            m_obj.m_roundPrecision = x;
            return this;
        }

        /** Value of a metric when its row has no visits. Defaults to 0. */
        public Builder invalidDivision(double x) {
            m_obj.m_invalidDivision = x;
            return this;
        }

        public FilterOptions build() {
            return m_obj;
        }

        private Builder() {}

        private final FilterOptions m_obj = new FilterOptions();
    }

    /**
     * Read the options out of request parameters. Missing parameters keep their defaults.
     *
     * @throws IllegalArgumentException if a parameter is present but has the wrong type
     */
    public FilterOptions(JsonNode jsonNode) {
        if (jsonNode.has(DELETE_ROWS_WITH_NO_VISIT)) {
            JsonNode node = jsonNode.get(DELETE_ROWS_WITH_NO_VISIT);
            if (!node.isBoolean()) {
                throw new IllegalArgumentException(
                        DELETE_ROWS_WITH_NO_VISIT + " must be a boolean, got " + node);
            }
            m_deleteRowsWithNoVisit = node.asBoolean();
        }
        if (jsonNode.has(ROUND_PRECISION)) {
            JsonNode node = jsonNode.get(ROUND_PRECISION);
            if (!node.canConvertToInt() || !node.isIntegralNumber() || node.asInt() < 0) {
                throw new IllegalArgumentException(
                        ROUND_PRECISION + " must be a non negative integer, got " + node);
            }
            m_roundPrecision = node.asInt();
        }
        if (jsonNode.has(INVALID_DIVISION)) {
            JsonNode node = jsonNode.get(INVALID_DIVISION);
            if (!node.isNumber()) {
                throw new IllegalArgumentException(
                        INVALID_DIVISION + " must be a number, got " + node);
            }
            m_invalidDivision = node.asDouble();
        }
    }

    public void serialize(JsonGenerator gen) throws IOException {
        gen.writeFieldName("options");
        gen.writeStartObject();
        gen.writeBooleanField(DELETE_ROWS_WITH_NO_VISIT, m_deleteRowsWithNoVisit);
        gen.writeNumberField(ROUND_PRECISION, m_roundPrecision);
        gen.writeNumberField(INVALID_DIVISION, m_invalidDivision);
        gen.writeEndObject();
    }

    public boolean isDeleteRowsWithNoVisit() {
        return m_deleteRowsWithNoVisit;
    }

    public int getRoundPrecision() {
        return m_roundPrecision;
    }

    public double getInvalidDivision() {
        return m_invalidDivision;
    }

    private FilterOptions() {}

    private boolean m_deleteRowsWithNoVisit = true;
    private int m_roundPrecision = SafeRatio.DEFAULT_PRECISION;
    private double m_invalidDivision = SafeRatio.DEFAULT_INVALID_DIVISION;

    public static final String DELETE_ROWS_WITH_NO_VISIT = "delete_rows_with_no_visit";
    public static final String ROUND_PRECISION = "round_precision";
    public static final String INVALID_DIVISION = "invalid_division";

    public static final FilterOptions DEFAULTS = new FilterOptions();
}
