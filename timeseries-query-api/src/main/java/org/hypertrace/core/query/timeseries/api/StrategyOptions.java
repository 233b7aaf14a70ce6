package org.hypertrace.core.query.timeseries.api;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Per-request overrides of the empty range fallback policy. Unset fields use configured values. */
@Value
@Builder
@Jacksonized
public class StrategyOptions {
  Boolean enableEmptyRangeFallback;
  List<Long> fallbackWindowSeconds;
  Long maxFallbackRangeSeconds;
}
