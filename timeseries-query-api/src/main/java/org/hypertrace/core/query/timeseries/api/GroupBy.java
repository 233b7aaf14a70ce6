package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

public enum GroupBy {
  SERVICE("service"),
  SPAN_NAME("span_name"),
  STATUS_CODE("status_code"),
  HTTP_METHOD("http_method"),
  SEVERITY("severity"),
  ATTRIBUTE("attribute"),
  NONE("none");

  private final String value;

  GroupBy(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Groupings a backend pipe can serve for the given source and kind. */
  public static Set<GroupBy> supportedBy(QuerySource source, QueryKind kind) {
    boolean timeseries = kind == QueryKind.TIMESERIES;
    switch (source) {
      case TRACES:
        return timeseries
            ? EnumSet.of(SERVICE, SPAN_NAME, STATUS_CODE, HTTP_METHOD, ATTRIBUTE, NONE)
            : EnumSet.of(SERVICE, SPAN_NAME, STATUS_CODE, HTTP_METHOD, ATTRIBUTE);
      case LOGS:
        return timeseries ? EnumSet.of(SERVICE, SEVERITY, NONE) : EnumSet.of(SERVICE, SEVERITY);
      case METRICS:
        return timeseries ? EnumSet.of(SERVICE, NONE) : EnumSet.of(SERVICE);
      default:
        throw new IllegalStateException("Unknown query source: " + source);
    }
  }
}
