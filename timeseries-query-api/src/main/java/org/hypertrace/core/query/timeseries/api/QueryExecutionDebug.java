package org.hypertrace.core.query.timeseries.api;

import java.util.List;
import lombok.Value;

/** Per query telemetry. {@code spec} is absent when the draft could not be built. */
@Value
public class QueryExecutionDebug {
  String queryId;
  String queryName;
  String source;
  QuerySpec spec;
  List<QueryExecutionAttempt> attempts;
  boolean fallbackUsed;
}
