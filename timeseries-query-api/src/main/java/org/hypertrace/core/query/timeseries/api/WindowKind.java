package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WindowKind {
  PRIMARY("primary"),
  FALLBACK("fallback");

  private final String value;

  WindowKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
