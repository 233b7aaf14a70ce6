package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LogsMetric implements QueryMetric {
  COUNT("count");

  private final String value;

  LogsMetric(String value) {
    this.value = value;
  }

  @Override
  @JsonValue
  public String getValue() {
    return value;
  }

  @Override
  public QuerySource getSource() {
    return QuerySource.LOGS;
  }
}
