package org.hypertrace.core.query.timeseries.merge;

import java.util.List;
import java.util.Map;
import javax.inject.Singleton;

/** Adds a {@code "<series> (%Δ)"} column for every current series with a previous-period twin. */
@Singleton
public class PercentChangeCalculator {

  static final String PERCENT_CHANGE_SUFFIX = " (%Δ)";

  public void append(
      List<Map<String, Object>> rows,
      Map<String, String> currentSeriesByStableKey,
      Map<String, String> previousSeriesByStableKey) {
    currentSeriesByStableKey.forEach(
        (stableKey, currentName) -> {
          String previousName = previousSeriesByStableKey.get(stableKey);
          if (previousName == null) {
            return;
          }
          String deltaName = currentName + PERCENT_CHANGE_SUFFIX;
          for (Map<String, Object> row : rows) {
            double current = finiteOrZero(row.get(currentName));
            double previous = finiteOrZero(row.get(previousName));
            row.put(deltaName, percentChange(current, previous));
          }
        });
  }

  static double percentChange(double current, double previous) {
    if (previous == 0) {
      return 0;
    }
    return (current - previous) / Math.abs(previous) * 100;
  }

  private static double finiteOrZero(Object value) {
    if (value instanceof Number) {
      double number = ((Number) value).doubleValue();
      return Double.isFinite(number) ? number : 0;
    }
    return 0;
  }
}
