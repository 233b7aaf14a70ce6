package org.hypertrace.core.query.timeseries.fallback;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.hypertrace.core.query.timeseries.QueryEngineConfig.FallbackConfig;
import org.hypertrace.core.query.timeseries.QueryEngineTestConfigs;
import org.hypertrace.core.query.timeseries.api.StrategyOptions;
import org.junit.jupiter.api.Test;

class FallbackStrategyTest {
  private final FallbackConfig defaults =
      QueryEngineTestConfigs.queryEngineConfig().getFallbackConfig();

  @Test
  void usesConfiguredDefaultsWithoutOverrides() {
    FallbackStrategy strategy = FallbackStrategy.resolve(null, defaults);

    assertTrue(strategy.isEnableEmptyRangeFallback());
    assertEquals(List.of(86400L, 604800L), strategy.getFallbackWindowSeconds());
    assertEquals(604800L, strategy.getMaxFallbackRangeSeconds());
  }

  @Test
  void requestOverridesWinFieldByField() {
    FallbackStrategy strategy =
        FallbackStrategy.resolve(
            StrategyOptions.builder()
                .enableEmptyRangeFallback(false)
                .fallbackWindowSeconds(Arrays.asList(3600L, -5L, null, 0L, 3600L, 1800L))
                .build(),
            defaults);

    assertFalse(strategy.isEnableEmptyRangeFallback());
    assertEquals(List.of(1800L, 3600L), strategy.getFallbackWindowSeconds());
    assertEquals(604800L, strategy.getMaxFallbackRangeSeconds());
  }

  @Test
  void convertsToDebug() {
    FallbackStrategy strategy =
        FallbackStrategy.resolve(
            StrategyOptions.builder().maxFallbackRangeSeconds(86400L).build(), defaults);

    assertEquals(86400L, strategy.toDebug().getMaxFallbackRangeSeconds());
    assertEquals(List.of(86400L, 604800L), strategy.toDebug().getFallbackWindowSeconds());
    assertTrue(strategy.toDebug().isEnableEmptyRangeFallback());
  }
}
