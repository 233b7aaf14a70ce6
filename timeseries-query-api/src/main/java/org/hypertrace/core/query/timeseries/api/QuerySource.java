package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Signal family a query reads from. Each source scopes its own metrics, group-bys and filters. */
public enum QuerySource {
  TRACES("traces"),
  LOGS("logs"),
  METRICS("metrics");

  private final String value;

  QuerySource(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Metrics accepted for this source, in the order the query editor offers them. */
  public List<QueryMetric> getSupportedMetrics() {
    switch (this) {
      case TRACES:
        return List.of(TracesMetric.values());
      case LOGS:
        return List.of(LogsMetric.values());
      case METRICS:
        return List.of(MetricsMetric.values());
      default:
        throw new IllegalStateException("Unknown query source: " + this);
    }
  }

  public Optional<QueryMetric> findMetric(String value) {
    return getSupportedMetrics().stream()
        .filter(metric -> metric.getValue().equals(value))
        .findFirst();
  }

  public static Optional<QuerySource> fromValue(String value) {
    return Arrays.stream(values()).filter(source -> source.value.equals(value)).findFirst();
  }
}
