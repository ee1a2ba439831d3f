package io.causallabs.reporting.render;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.causallabs.reporting.datatable.DataTable;
import io.causallabs.reporting.datatable.Row;
import io.causallabs.reporting.metrics.ProcessedMetric;

/**
 * Writes a {@link DataTable} as a JSON array of row objects. The processed metrics registered on
 * the table are computed here, row by row, and written after the row's own columns under their
 * metric names. Rows are not modified.
 */
public class JsonRenderer {

    public String render(DataTable table) {
        StringWriter sw = new StringWriter();
        try {
            render(table, sw);
        } catch (IOException e) {
            // we are writing to a string, so this should never fail
            throw new RuntimeException("Error rendering table to in memory JSON string.", e);
        }
        return sw.toString();
    }

    public void render(DataTable table, Writer out) throws IOException {
        Objects.requireNonNull(table, "table");
        List<ProcessedMetric> metrics =
                ProcessedMetric.distinctByName(table.getExtraProcessedMetrics());
        JsonGenerator gen = m_mapper.getFactory().createGenerator(out);
        gen.writeStartArray();
        for (Row row : table.getRows()) {
            gen.writeStartObject();
            serializeRow(gen, row, metrics);
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.flush();
        logger.debug("Rendered {} rows with {} processed metrics", table.getRowsCount(),
                metrics.size());
    }

    // Just writes the fields. You must be in an object context
    private void serializeRow(JsonGenerator gen, Row row, List<ProcessedMetric> metrics)
            throws IOException {
        for (Map.Entry<String, Object> column : row.getColumns().entrySet()) {
            // a computed metric wins over a stale column of the same name
            if (isMetricName(column.getKey(), metrics)) {
                continue;
            }
            gen.writeFieldName(column.getKey());
            m_mapper.writeValue(gen, column.getValue());
        }
        for (ProcessedMetric metric : metrics) {
            Number value = metric.compute(row);
            gen.writeFieldName(metric.getName());
            if (value == null) {
                gen.writeNull();
            } else {
                m_mapper.writeValue(gen, value);
            }
        }
    }

    private static boolean isMetricName(String name, List<ProcessedMetric> metrics) {
        for (ProcessedMetric metric : metrics) {
            if (metric.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static final Logger logger = LoggerFactory.getLogger(JsonRenderer.class);
    static final ObjectMapper m_mapper = new ObjectMapper();
}
