package org.hypertrace.core.query.timeseries.fallback;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;
import org.hypertrace.core.query.timeseries.QueryEngineConfig.FallbackConfig;
import org.hypertrace.core.query.timeseries.api.StrategyOptions;
import org.hypertrace.core.query.timeseries.api.TimeseriesQueryDebug.StrategyDebug;

/** Effective empty range fallback policy of one request. */
@Value
public class FallbackStrategy {
  boolean enableEmptyRangeFallback;

  /** Positive, distinct and ascending. */
  List<Long> fallbackWindowSeconds;

  long maxFallbackRangeSeconds;

  /** Request overrides win over configured defaults, field by field. */
  public static FallbackStrategy resolve(StrategyOptions options, FallbackConfig defaults) {
    StrategyOptions requested = options == null ? StrategyOptions.builder().build() : options;
    List<Long> windows =
        requested.getFallbackWindowSeconds() != null
            ? requested.getFallbackWindowSeconds()
            : defaults.getWindowSeconds();
    return new FallbackStrategy(
        requested.getEnableEmptyRangeFallback() != null
            ? requested.getEnableEmptyRangeFallback()
            : defaults.isEnabled(),
        windows.stream()
            .filter(seconds -> seconds != null && seconds > 0)
            .distinct()
            .sorted()
            .collect(Collectors.toUnmodifiableList()),
        requested.getMaxFallbackRangeSeconds() != null
            ? requested.getMaxFallbackRangeSeconds()
            : defaults.getMaxRangeSeconds());
  }

  public StrategyDebug toDebug() {
    return new StrategyDebug(
        enableEmptyRangeFallback, fallbackWindowSeconds, maxFallbackRangeSeconds);
  }
}
