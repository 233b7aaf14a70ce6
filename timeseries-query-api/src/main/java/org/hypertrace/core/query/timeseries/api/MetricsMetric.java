package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MetricsMetric implements QueryMetric {
  AVG("avg"),
  SUM("sum"),
  MIN("min"),
  MAX("max"),
  COUNT("count");

  private final String value;

  MetricsMetric(String value) {
    this.value = value;
  }

  @Override
  @JsonValue
  public String getValue() {
    return value;
  }

  @Override
  public QuerySource getSource() {
    return QuerySource.METRICS;
  }

  /** Breakdowns over metrics are only served as avg, sum or count. */
  public boolean isBreakdownSupported() {
    return this == AVG || this == SUM || this == COUNT;
  }
}
