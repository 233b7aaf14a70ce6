package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Merged table, one row per bucket. Each row holds {@code bucket} plus one numeric entry per series
 * name. {@code error} is set when no query produced data.
 */
@Value
public class TimeseriesQueryResponse {
  List<Map<String, Object>> data;

  @JsonInclude(JsonInclude.Include.ALWAYS)
  String error;

  @JsonInclude(JsonInclude.Include.NON_NULL)
  TimeseriesQueryDebug debug;

  public static TimeseriesQueryResponse failure(String error, TimeseriesQueryDebug debug) {
    return new TimeseriesQueryResponse(List.of(), error, debug);
  }
}
