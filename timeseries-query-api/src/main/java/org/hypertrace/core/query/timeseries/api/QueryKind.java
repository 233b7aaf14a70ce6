package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueryKind {
  TIMESERIES("timeseries"),
  BREAKDOWN("breakdown");

  private final String value;

  QueryKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
