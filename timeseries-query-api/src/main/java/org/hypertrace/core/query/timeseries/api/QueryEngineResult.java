package org.hypertrace.core.query.timeseries.api;

import java.util.List;
import lombok.Value;

@Value
public class QueryEngineResult {
  QueryKind kind;
  QuerySource source;
  List<TimeseriesPoint> timeseries;
  List<BreakdownItem> breakdown;

  public static QueryEngineResult ofTimeseries(QuerySource source, List<TimeseriesPoint> points) {
    return new QueryEngineResult(QueryKind.TIMESERIES, source, points, List.of());
  }

  public static QueryEngineResult ofBreakdown(QuerySource source, List<BreakdownItem> items) {
    return new QueryEngineResult(QueryKind.BREAKDOWN, source, List.of(), items);
  }
}
