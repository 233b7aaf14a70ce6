package org.hypertrace.core.query.timeseries.api;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ComparisonOptions {
  public static final ComparisonOptions NONE = ComparisonOptions.builder().build();

  @Builder.Default ComparisonMode mode = ComparisonMode.NONE;
  @Builder.Default boolean includePercentChange = true;
}
