package org.hypertrace.core.query.timeseries.api;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of running one query draft or formula over one window. Instances are never mutated; a
 * previous-period run produces its own shifted copy through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class QueryRunResult {

  public static final String FORMULA_SOURCE = "formula";

  String queryId;
  String queryName;

  /** {@code traces}, {@code logs}, {@code metrics} or {@link #FORMULA_SOURCE}. */
  String source;

  QueryRunStatus status;
  String error;
  @Singular List<String> warnings;
  @Singular("point") List<TimeseriesPoint> data;

  public boolean isSuccess() {
    return status == QueryRunStatus.SUCCESS;
  }

  /** Whether any bucket carries at least one group value. */
  public boolean hasSeriesData() {
    return data.stream().anyMatch(TimeseriesPoint::hasSeries);
  }

  public static QueryRunResult failure(
      String queryId, String queryName, String source, String error, List<String> warnings) {
    return QueryRunResult.builder()
        .queryId(queryId)
        .queryName(queryName)
        .source(source)
        .status(QueryRunStatus.ERROR)
        .error(error)
        .warnings(warnings)
        .build();
  }
}
