package org.hypertrace.core.query.timeseries.adapter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;
import java.util.Map;
import org.hypertrace.core.query.timeseries.api.GroupBy;
import org.hypertrace.core.query.timeseries.api.LogsMetric;
import org.hypertrace.core.query.timeseries.api.MetricType;
import org.hypertrace.core.query.timeseries.api.MetricsMetric;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryFilters;
import org.hypertrace.core.query.timeseries.api.QueryKind;
import org.hypertrace.core.query.timeseries.api.QuerySource;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.api.TracesMetric;
import org.junit.jupiter.api.Test;

class QuerySpecToBackendQueryConverterTest {
  private static final String START = "2026-01-01 00:00:00";
  private static final String END = "2026-01-01 01:00:00";

  private final QuerySpecToBackendQueryConverter converter = new QuerySpecToBackendQueryConverter();

  @Test
  void convertsTracesTimeseries() {
    QuerySpec spec =
        QuerySpec.builder()
            .kind(QueryKind.TIMESERIES)
            .source(QuerySource.TRACES)
            .metric(TracesMetric.P95_DURATION)
            .groupBy(GroupBy.SERVICE)
            .filters(
                QueryFilters.builder()
                    .serviceName("checkout")
                    .rootSpansOnly(true)
                    .environments(List.of("prod", "staging"))
                    .attributeKey("tier")
                    .attributeValue("gold")
                    .build())
            .build();

    BackendQuery query = converter.convert(new QueryEngineRequest(START, END, spec), 300);

    assertEquals(BackendPipe.CUSTOM_TRACES_TIMESERIES, query.getPipe());
    assertEquals(
        Map.of(
            "start_time", START,
            "end_time", END,
            "bucket_seconds", "300",
            "service_name", "checkout",
            "root_only", "1",
            "environments", "prod,staging",
            "group_by_service", "1",
            "attribute_filter_key", "tier",
            "attribute_filter_value", "gold"),
        query.getParameters());
  }

  @Test
  void sendsAttributeKeyForAttributeGrouping() {
    QuerySpec spec =
        QuerySpec.builder()
            .kind(QueryKind.TIMESERIES)
            .source(QuerySource.TRACES)
            .metric(TracesMetric.COUNT)
            .groupBy(GroupBy.ATTRIBUTE)
            .filters(QueryFilters.builder().attributeKey("user.tier").build())
            .build();

    BackendQuery query = converter.convert(new QueryEngineRequest(START, END, spec), 60);

    assertEquals("user.tier", query.getParameters().get("group_by_attribute"));
    assertEquals("user.tier", query.getParameters().get("attribute_filter_key"));
    assertNull(query.getParameters().get("group_by_service"));
  }

  @Test
  void convertsLogsBreakdown() {
    QuerySpec spec =
        QuerySpec.builder()
            .kind(QueryKind.BREAKDOWN)
            .source(QuerySource.LOGS)
            .metric(LogsMetric.COUNT)
            .groupBy(GroupBy.SEVERITY)
            .filters(QueryFilters.builder().serviceName("cart").build())
            .limit(20)
            .build();

    BackendQuery query = converter.convert(new QueryEngineRequest(START, END, spec), null);

    assertEquals(BackendPipe.CUSTOM_LOGS_BREAKDOWN, query.getPipe());
    assertEquals(
        Map.of(
            "start_time", START,
            "end_time", END,
            "service_name", "cart",
            "limit", "20",
            "group_by_severity", "1"),
        query.getParameters());
  }

  @Test
  void picksMetricsTimeseriesPipeByMetricType() {
    QuerySpec spec =
        QuerySpec.builder()
            .kind(QueryKind.TIMESERIES)
            .source(QuerySource.METRICS)
            .metric(MetricsMetric.AVG)
            .filters(
                QueryFilters.builder()
                    .metricName("http.server.duration")
                    .metricType(MetricType.HISTOGRAM)
                    .serviceName("api")
                    .build())
            .build();

    BackendQuery query = converter.convert(new QueryEngineRequest(START, END, spec), 60);

    assertEquals(BackendPipe.METRIC_TIME_SERIES_HISTOGRAM, query.getPipe());
    assertEquals(
        Map.of(
            "metric_name", "http.server.duration",
            "service", "api",
            "start_time", START,
            "end_time", END,
            "bucket_seconds", "60"),
        query.getParameters());
  }

  @Test
  void convertsMetricsBreakdown() {
    QuerySpec spec =
        QuerySpec.builder()
            .kind(QueryKind.BREAKDOWN)
            .source(QuerySource.METRICS)
            .metric(MetricsMetric.SUM)
            .groupBy(GroupBy.SERVICE)
            .filters(
                QueryFilters.builder().metricName("requests").metricType(MetricType.SUM).build())
            .limit(5)
            .build();

    BackendQuery query = converter.convert(new QueryEngineRequest(START, END, spec), null);

    assertEquals(BackendPipe.CUSTOM_METRICS_BREAKDOWN, query.getPipe());
    assertEquals("sum", query.getParameters().get("metric_type"));
    assertEquals("5", query.getParameters().get("limit"));
  }
}
