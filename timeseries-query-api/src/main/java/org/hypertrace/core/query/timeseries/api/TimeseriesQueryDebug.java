package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Telemetry returned when a request asks for {@code debug}. Never affects the data. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TimeseriesQueryDebug {
  TimeWindow primaryWindow;
  ComparisonDebug comparison;
  StrategyDebug strategy;
  List<QueryExecutionDebug> queries;
  List<QueryExecutionDebug> previousQueries;

  @Value
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ComparisonDebug {
    ComparisonMode mode;
    boolean includePercentChange;
    long shiftedByMs;
    String previousStartTime;
    String previousEndTime;
  }

  @Value
  public static class StrategyDebug {
    boolean enableEmptyRangeFallback;
    List<Long> fallbackWindowSeconds;
    long maxFallbackRangeSeconds;
  }
}
