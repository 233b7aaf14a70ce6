package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueryRunStatus {
  SUCCESS("success"),
  ERROR("error");

  private final String value;

  QueryRunStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
