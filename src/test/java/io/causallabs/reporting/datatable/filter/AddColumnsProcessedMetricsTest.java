package io.causallabs.reporting.datatable.filter;

import java.util.List;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import io.causallabs.reporting.datatable.DataTable;
import io.causallabs.reporting.datatable.Row;
import io.causallabs.reporting.metrics.Metrics;
import io.causallabs.reporting.metrics.ProcessedMetric;
import io.causallabs.reporting.metrics.RatioMetric;
import io.causallabs.reporting.metrics.processed.ActionsPerVisit;
import io.causallabs.reporting.metrics.processed.AverageTimeOnSite;
import io.causallabs.reporting.metrics.processed.BounceRate;
import io.causallabs.reporting.metrics.processed.ConversionRate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddColumnsProcessedMetricsTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private DataTable table;
    private int activeRow;
    private int emptyRow;
    private int actionsOnlyRow;

    @BeforeEach
    void setUp() {
        table = new DataTable();
        activeRow = table.addRow(new Row()
                .setColumn(Metrics.NB_VISITS, 10)
                .setColumn(Metrics.NB_VISITS_CONVERTED, 2)
                .setColumn(Metrics.NB_ACTIONS, 30)
                .setColumn(Metrics.VISIT_LENGTH, 600)
                .setColumn(Metrics.BOUNCE_COUNT, 4));
        emptyRow = table.addRow(new Row()
                .setColumn(Metrics.NB_VISITS, 0)
                .setColumn(Metrics.NB_VISITS_CONVERTED, 0)
                .setColumn(Metrics.NB_ACTIONS, 0));
        actionsOnlyRow = table.addRow(new Row()
                .setColumn(Metrics.NB_VISITS, 0)
                .setColumn(Metrics.NB_ACTIONS, 5));
    }

    @Test
    void registers_metrics_in_fixed_order() {
        table.filter(new AddColumnsProcessedMetrics());

        assertThat(table.getExtraProcessedMetrics())
                .extracting(ProcessedMetric::getName)
                .containsExactly("conversion_rate", "nb_actions_per_visit", "avg_time_on_site",
                        "bounce_rate");
        assertThat(table.getExtraProcessedMetrics()).hasExactlyElementsOfTypes(
                ConversionRate.class, ActionsPerVisit.class, AverageTimeOnSite.class,
                BounceRate.class);
    }

    @Test
    void appends_after_existing_metrics() {
        ProcessedMetric existing = new BounceRate();
        table.setExtraProcessedMetrics(List.of(existing));

        table.filter(new AddColumnsProcessedMetrics());

        List<ProcessedMetric> metrics = table.getExtraProcessedMetrics();
        assertThat(metrics).hasSize(5);
        assertThat(metrics.get(0)).isSameAs(existing);
        assertThat(metrics.subList(1, 5)).extracting(ProcessedMetric::getName)
                .containsExactly("conversion_rate", "nb_actions_per_visit", "avg_time_on_site",
                        "bounce_rate");
    }

    @Test
    void filtering_twice_registers_metrics_twice() {
        AddColumnsProcessedMetrics filter = new AddColumnsProcessedMetrics();
        filter.filter(table);
        filter.filter(table);

        List<ProcessedMetric> metrics = table.getExtraProcessedMetrics();
        assertThat(metrics).hasSize(8);
        assertThat(ProcessedMetric.distinctByName(metrics)).hasSize(4);
    }

    @Test
    void deletes_rows_without_activity_by_default() {
        table.filter(new AddColumnsProcessedMetrics());

        assertThat(table.getRowsCount()).isEqualTo(2);
        assertThat(table.getRow(emptyRow)).isNull();
        assertThat(table.getRow(activeRow)).isNotNull();
        assertThat(table.getRow(actionsOnlyRow)).isNotNull();
    }

    @Test
    void keeps_all_rows_when_pruning_is_disabled() {
        table.filter(new AddColumnsProcessedMetrics(false));

        assertThat(table.getRowsCount()).isEqualTo(3);
        Row row = table.getRow(emptyRow);
        for (ProcessedMetric metric : table.getExtraProcessedMetrics()) {
            assertThat(metric.compute(row).doubleValue()).isEqualTo(0.0);
        }
    }

    @Test
    void does_not_compute_values_into_rows() {
        table.filter(new AddColumnsProcessedMetrics());

        Row row = table.getRow(activeRow);
        assertThat(row.hasColumn("conversion_rate")).isFalse();
        assertThat(row.getColumns()).hasSize(5);
    }

    @Test
    void registered_metrics_compute_expected_values() {
        table.filter(new AddColumnsProcessedMetrics());

        Row row = table.getRow(activeRow);
        List<ProcessedMetric> metrics = table.getExtraProcessedMetrics();
        assertThat(metrics.get(0).compute(row)).isEqualTo(0.2);
        assertThat(metrics.get(1).compute(row)).isEqualTo(3.0);
        assertThat(metrics.get(2).compute(row)).isEqualTo(60L);
        assertThat(metrics.get(3).compute(row)).isEqualTo(0.4);

        Row actionsOnly = table.getRow(actionsOnlyRow);
        assertThat(metrics.get(0).compute(actionsOnly)).isEqualTo(0.0);
        assertThat(metrics.get(1).compute(actionsOnly)).isEqualTo(0.0);
        assertThat(metrics.get(3).compute(actionsOnly)).isEqualTo(0.0);
    }

    @Test
    void options_configure_registered_metrics() {
        FilterOptions options = FilterOptions.builder().roundPrecision(3).invalidDivision(-1)
                .build();

        table.filter(new AddColumnsProcessedMetrics(options));

        RatioMetric conversionRate = (RatioMetric) table.getExtraProcessedMetrics().get(0);
        assertThat(conversionRate.getPrecision()).isEqualTo(3);
        assertThat(conversionRate.compute(new Row())).isEqualTo(-1.0);
    }

    @Test
    void null_table_is_rejected() {
        assertThatThrownBy(() -> new AddColumnsProcessedMetrics().filter(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void isRequested_reads_request_parameter() throws Exception {
        assertThat(AddColumnsProcessedMetrics.isRequested(params("{}"))).isFalse();
        assertThat(AddColumnsProcessedMetrics.isRequested(null)).isFalse();
        assertThat(AddColumnsProcessedMetrics.isRequested(
                params("{\"filter_add_columns_when_show_all_columns\": 1}"))).isTrue();
        assertThat(AddColumnsProcessedMetrics.isRequested(
                params("{\"filter_add_columns_when_show_all_columns\": \"1\"}"))).isTrue();
        assertThat(AddColumnsProcessedMetrics.isRequested(
                params("{\"filter_add_columns_when_show_all_columns\": true}"))).isTrue();
        assertThat(AddColumnsProcessedMetrics.isRequested(
                params("{\"filter_add_columns_when_show_all_columns\": \"0\"}"))).isFalse();
    }

    private static JsonNode params(String json) throws Exception {
        return mapper.readTree(json);
    }
}
