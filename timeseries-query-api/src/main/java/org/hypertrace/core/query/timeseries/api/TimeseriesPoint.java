package org.hypertrace.core.query.timeseries.api;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Value;

/** One bucket of a normalized time series: ISO-8601 bucket start mapped to values per group. */
@Value
@AllArgsConstructor
public class TimeseriesPoint {
  String bucket;
  Map<String, Double> series;

  public boolean hasSeries() {
    return !series.isEmpty();
  }
}
