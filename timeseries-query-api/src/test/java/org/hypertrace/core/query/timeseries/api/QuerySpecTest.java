package org.hypertrace.core.query.timeseries.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class QuerySpecTest {

  @Test
  public void testMetricMustMatchSource() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            QuerySpec.builder()
                .kind(QueryKind.TIMESERIES)
                .source(QuerySource.LOGS)
                .metric(TracesMetric.COUNT)
                .build());
  }

  @Test
  public void testMetricsSourceRequiresNameAndType() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            QuerySpec.builder()
                .kind(QueryKind.TIMESERIES)
                .source(QuerySource.METRICS)
                .metric(MetricsMetric.AVG)
                .filters(QueryFilters.builder().metricName("cpu").build())
                .build());
  }

  @Test
  public void testFiltersAreScopedToSource() {
    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                QuerySpec.builder()
                    .kind(QueryKind.TIMESERIES)
                    .source(QuerySource.LOGS)
                    .metric(LogsMetric.COUNT)
                    .filters(QueryFilters.builder().spanName("GET /").severity("ERROR").build())
                    .build());
    assertEquals("Filters [spanName] are not supported for logs queries", exception.getMessage());
  }

  @Test
  public void testBreakdownRules() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            QuerySpec.builder()
                .kind(QueryKind.BREAKDOWN)
                .source(QuerySource.TRACES)
                .metric(TracesMetric.COUNT)
                .build());
    assertThrows(
        IllegalArgumentException.class,
        () ->
            QuerySpec.builder()
                .kind(QueryKind.BREAKDOWN)
                .source(QuerySource.METRICS)
                .metric(MetricsMetric.MAX)
                .groupBy(GroupBy.SERVICE)
                .filters(
                    QueryFilters.builder().metricName("cpu").metricType(MetricType.GAUGE).build())
                .build());
    assertThrows(
        IllegalArgumentException.class,
        () ->
            QuerySpec.builder()
                .kind(QueryKind.TIMESERIES)
                .source(QuerySource.TRACES)
                .metric(TracesMetric.COUNT)
                .limit(10)
                .build());
  }

  @Test
  public void testGroupByScopedToSource() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            QuerySpec.builder()
                .kind(QueryKind.TIMESERIES)
                .source(QuerySource.LOGS)
                .metric(LogsMetric.COUNT)
                .groupBy(GroupBy.SPAN_NAME)
                .build());
  }

  @Test
  public void testVisitorDispatchesOnSourceAndKind() {
    QuerySpecVisitor<String> visitor =
        new QuerySpecVisitor<>() {
          @Override
          public String visitTracesTimeseries(QuerySpec spec) {
            return "traces-timeseries";
          }

          @Override
          public String visitLogsTimeseries(QuerySpec spec) {
            return "logs-timeseries";
          }

          @Override
          public String visitMetricsTimeseries(QuerySpec spec) {
            return "metrics-timeseries";
          }

          @Override
          public String visitTracesBreakdown(QuerySpec spec) {
            return "traces-breakdown";
          }

          @Override
          public String visitLogsBreakdown(QuerySpec spec) {
            return "logs-breakdown";
          }

          @Override
          public String visitMetricsBreakdown(QuerySpec spec) {
            return "metrics-breakdown";
          }
        };

    QuerySpec logsBreakdown =
        QuerySpec.builder()
            .kind(QueryKind.BREAKDOWN)
            .source(QuerySource.LOGS)
            .metric(LogsMetric.COUNT)
            .groupBy(GroupBy.SEVERITY)
            .limit(5)
            .build();
    QuerySpec metricsTimeseries =
        QuerySpec.builder()
            .kind(QueryKind.TIMESERIES)
            .source(QuerySource.METRICS)
            .metric(MetricsMetric.SUM)
            .filters(
                QueryFilters.builder()
                    .metricName("requests")
                    .metricType(MetricType.SUM)
                    .build())
            .build();

    assertEquals("logs-breakdown", logsBreakdown.accept(visitor));
    assertEquals("metrics-timeseries", metricsTimeseries.accept(visitor));
    assertEquals(60, metricsTimeseries.withBucketSeconds(60).getBucketSeconds());
  }

  @Test
  public void testRunResultSeriesData() {
    QueryRunResult empty =
        QueryRunResult.builder()
            .queryId("q1")
            .queryName("A")
            .source("traces")
            .status(QueryRunStatus.SUCCESS)
            .point(new TimeseriesPoint("2026-01-01T00:00:00.000Z", Map.of()))
            .build();
    assertFalse(empty.hasSeriesData());

    QueryRunResult failed =
        QueryRunResult.failure("q2", "B", "logs", "boom", List.of("Invalid step interval"));
    assertFalse(failed.isSuccess());
    assertEquals(List.of("Invalid step interval"), failed.getWarnings());
    assertEquals(List.of(), failed.getData());
  }
}
