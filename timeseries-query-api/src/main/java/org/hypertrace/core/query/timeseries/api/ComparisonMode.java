package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ComparisonMode {
  NONE("none"),
  PREVIOUS_PERIOD("previous_period");

  private final String value;

  ComparisonMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
