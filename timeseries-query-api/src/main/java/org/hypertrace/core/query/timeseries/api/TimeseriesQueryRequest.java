package org.hypertrace.core.query.timeseries.api;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class TimeseriesQueryRequest {
  String startTime;
  String endTime;
  @Builder.Default List<QueryDraft> queries = List.of();
  @Builder.Default List<FormulaDraft> formulas = List.of();
  @Builder.Default ComparisonOptions comparison = ComparisonOptions.NONE;
  StrategyOptions strategy;
  boolean debug;
}
