package io.causallabs.reporting.metrics;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Identifiers of the raw columns produced by the aggregation stage.
 *
 * <p>Archived rows may store a raw column under its numeric index instead of its name to save
 * space. {@link #getColumnIndex(String)} maps a canonical name to that index.
 */
public final class Metrics {

    public static final String NB_UNIQ_VISITORS = "nb_uniq_visitors";
    public static final String NB_VISITS = "nb_visits";
    public static final String NB_ACTIONS = "nb_actions";
    public static final String MAX_ACTIONS = "max_actions";
    public static final String VISIT_LENGTH = "visit_length";
    public static final String BOUNCE_COUNT = "bounce_count";
    public static final String NB_VISITS_CONVERTED = "nb_visits_converted";

    public static final int INDEX_NB_UNIQ_VISITORS = 1;
    public static final int INDEX_NB_VISITS = 2;
    public static final int INDEX_NB_ACTIONS = 3;
    public static final int INDEX_MAX_ACTIONS = 4;
    // archived as sum_visit_length
    public static final int INDEX_SUM_VISIT_LENGTH = 5;
    public static final int INDEX_BOUNCE_COUNT = 6;
    public static final int INDEX_NB_VISITS_CONVERTED = 7;

    /**
     * Return the archive index of a raw column, or null if the column has no archived form.
     */
    public static Integer getColumnIndex(String columnName) {
        return m_indexByName.get(columnName);
    }

    private static final Map<String, Integer> m_indexByName;
    static {
        Map<String, Integer> m = new HashMap<>();
        m.put(NB_UNIQ_VISITORS, INDEX_NB_UNIQ_VISITORS);
        m.put(NB_VISITS, INDEX_NB_VISITS);
        m.put(NB_ACTIONS, INDEX_NB_ACTIONS);
        m.put(MAX_ACTIONS, INDEX_MAX_ACTIONS);
        m.put(VISIT_LENGTH, INDEX_SUM_VISIT_LENGTH);
        m.put(BOUNCE_COUNT, INDEX_BOUNCE_COUNT);
        m.put(NB_VISITS_CONVERTED, INDEX_NB_VISITS_CONVERTED);
        m_indexByName = Collections.unmodifiableMap(m);
    }

    private Metrics() {}
}
