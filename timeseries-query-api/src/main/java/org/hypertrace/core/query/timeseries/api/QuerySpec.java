package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Normalized, backend agnostic description of a single query. A spec is discriminated by its
 * {@link QuerySource} and {@link QueryKind}; code that needs to branch on the combination should go
 * through {@link #accept(QuerySpecVisitor)} so that every pairing is handled.
 *
 * <p>Construction rejects specs that no backend pipe could serve: a metric from another source,
 * filters the source does not understand, a metrics query without metric name and type, a breakdown
 * without a grouping, or bucket/limit settings on the wrong kind. Attribute filter consistency is
 * left to request validation so that it is reported with the other validation details.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QuerySpec {

  QueryKind kind;
  QuerySource source;
  QueryMetric metric;
  GroupBy groupBy;
  QueryFilters filters;
  Integer bucketSeconds;
  Integer limit;

  @Builder(toBuilder = true)
  private QuerySpec(
      @NonNull QueryKind kind,
      @NonNull QuerySource source,
      @NonNull QueryMetric metric,
      GroupBy groupBy,
      QueryFilters filters,
      Integer bucketSeconds,
      Integer limit) {
    if (metric.getSource() != source) {
      throw new IllegalArgumentException(
          String.format(
              "Metric %s is not supported for %s queries", metric.getValue(), source.getValue()));
    }
    if (filters != null) {
      List<String> unsupportedFields = filters.unsupportedFieldsFor(source);
      if (!unsupportedFields.isEmpty()) {
        throw new IllegalArgumentException(
            String.format(
                "Filters %s are not supported for %s queries",
                unsupportedFields, source.getValue()));
      }
    }
    if (source == QuerySource.METRICS
        && (filters == null
            || filters.getMetricName() == null
            || filters.getMetricName().isEmpty()
            || filters.getMetricType() == null)) {
      throw new IllegalArgumentException("Metrics queries require metricName and metricType");
    }
    if (groupBy != null && !GroupBy.supportedBy(source, kind).contains(groupBy)) {
      throw new IllegalArgumentException(
          String.format(
              "Group by %s is not supported for %s %s queries",
              groupBy.getValue(), source.getValue(), kind.getValue()));
    }
    if (kind == QueryKind.BREAKDOWN) {
      if (groupBy == null) {
        throw new IllegalArgumentException("Breakdown queries require a group by");
      }
      if (bucketSeconds != null) {
        throw new IllegalArgumentException("Breakdown queries do not accept bucketSeconds");
      }
      if (source == QuerySource.METRICS && !((MetricsMetric) metric).isBreakdownSupported()) {
        throw new IllegalArgumentException(
            "Metrics breakdown does not support metric " + metric.getValue());
      }
    } else {
      if (limit != null) {
        throw new IllegalArgumentException("Timeseries queries do not accept a limit");
      }
      if (bucketSeconds != null && bucketSeconds <= 0) {
        throw new IllegalArgumentException("bucketSeconds must be greater than 0");
      }
    }
    this.kind = kind;
    this.source = source;
    this.metric = metric;
    this.groupBy = groupBy;
    this.filters = filters;
    this.bucketSeconds = bucketSeconds;
    this.limit = limit;
  }

  /** Filters of this spec, never {@code null}. */
  @JsonIgnore
  public QueryFilters getFiltersOrEmpty() {
    return filters == null ? QueryFilters.EMPTY : filters;
  }

  @JsonIgnore
  public boolean isTimeseries() {
    return kind == QueryKind.TIMESERIES;
  }

  public QuerySpec withBucketSeconds(int bucketSeconds) {
    return toBuilder().bucketSeconds(bucketSeconds).build();
  }

  public <T> T accept(QuerySpecVisitor<T> visitor) {
    switch (source) {
      case TRACES:
        return isTimeseries()
            ? visitor.visitTracesTimeseries(this)
            : visitor.visitTracesBreakdown(this);
      case LOGS:
        return isTimeseries() ? visitor.visitLogsTimeseries(this) : visitor.visitLogsBreakdown(this);
      case METRICS:
        return isTimeseries()
            ? visitor.visitMetricsTimeseries(this)
            : visitor.visitMetricsBreakdown(this);
      default:
        throw new IllegalStateException("Unknown query source: " + source);
    }
  }
}
