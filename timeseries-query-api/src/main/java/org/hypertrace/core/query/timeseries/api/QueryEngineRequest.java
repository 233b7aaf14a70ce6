package org.hypertrace.core.query.timeseries.api;

import lombok.NonNull;
import lombok.Value;

/** A single query spec to run over {@code [startTime, endTime)}, both in wire format. */
@Value
public class QueryEngineRequest {
  @NonNull String startTime;
  @NonNull String endTime;
  @NonNull QuerySpec query;
}
