package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TracesMetric implements QueryMetric {
  COUNT("count"),
  AVG_DURATION("avg_duration"),
  P50_DURATION("p50_duration"),
  P95_DURATION("p95_duration"),
  P99_DURATION("p99_duration"),
  ERROR_RATE("error_rate");

  private final String value;

  TracesMetric(String value) {
    this.value = value;
  }

  @Override
  @JsonValue
  public String getValue() {
    return value;
  }

  @Override
  public QuerySource getSource() {
    return QuerySource.TRACES;
  }
}
