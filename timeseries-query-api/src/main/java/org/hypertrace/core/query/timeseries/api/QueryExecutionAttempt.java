package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryExecutionAttempt {
  String startTime;
  String endTime;
  WindowKind kind;
  Integer bucketSeconds;
  int pointCount;
  boolean hasSeries;
  String error;
}
