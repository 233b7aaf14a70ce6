package org.hypertrace.core.query.timeseries.fallback;

import java.util.List;
import lombok.Value;
import org.hypertrace.core.query.timeseries.api.QueryExecutionAttempt;
import org.hypertrace.core.query.timeseries.api.TimeseriesPoint;

@Value
public class FallbackExecution {
  List<TimeseriesPoint> points;
  List<QueryExecutionAttempt> attempts;
  boolean fallbackUsed;

  public QueryExecutionAttempt getLastAttempt() {
    return attempts.get(attempts.size() - 1);
  }
}
