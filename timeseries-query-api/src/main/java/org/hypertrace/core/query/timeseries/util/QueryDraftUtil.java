package org.hypertrace.core.query.timeseries.util;

import java.util.List;
import java.util.UUID;
import org.hypertrace.core.query.timeseries.api.FormulaDraft;
import org.hypertrace.core.query.timeseries.api.QueryDraft;
import org.hypertrace.core.query.timeseries.api.QuerySource;
import org.hypertrace.core.query.timeseries.api.TracesMetric;

/** Utility methods to create {@link QueryDraft}s and {@link FormulaDraft}s with editor defaults. */
public class QueryDraftUtil {

  private QueryDraftUtil() {}

  /** Query names run A, B, C... by position. */
  public static String queryLabel(int index) {
    return String.valueOf((char) ('A' + index));
  }

  /** Formula names run F1, F2, F3... by position. */
  public static String formulaLabel(int index) {
    return "F" + (index + 1);
  }

  /**
   * New traces query grouped by service. The first query of a request defaults to error rate, the
   * others to count.
   */
  public static QueryDraft createQueryDraft(int index) {
    return QueryDraft.builder()
        .id(UUID.randomUUID().toString())
        .name(queryLabel(index))
        .dataSource(QuerySource.TRACES.getValue())
        .aggregation(
            index == 0 ? TracesMetric.ERROR_RATE.getValue() : TracesMetric.COUNT.getValue())
        .stepInterval("60")
        .groupByEnabled(true)
        .groupBy("service.name")
        .build();
  }

  /** New formula dividing the first two given query names, {@code A / B} when there are none. */
  public static FormulaDraft createFormulaDraft(int index, List<String> queryNames) {
    String first = queryNames.size() > 0 ? queryNames.get(0) : "A";
    String second = queryNames.size() > 1 ? queryNames.get(1) : "B";
    return FormulaDraft.builder()
        .id(UUID.randomUUID().toString())
        .name(formulaLabel(index))
        .expression(first + " / " + second)
        .legend("Error ratio")
        .build();
  }

  /**
   * Switches a draft to another source, resetting the aggregation to the first one the source
   * supports. The metric name only survives a switch to metrics.
   */
  public static QueryDraft resetQueryForDataSource(QueryDraft draft, QuerySource source) {
    return draft.toBuilder()
        .dataSource(source.getValue())
        .aggregation(source.getSupportedMetrics().get(0).getValue())
        .metricName(source == QuerySource.METRICS ? draft.getMetricName() : "")
        .build();
  }
}
