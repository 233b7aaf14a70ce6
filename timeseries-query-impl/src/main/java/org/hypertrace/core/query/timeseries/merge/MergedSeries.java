package org.hypertrace.core.query.timeseries.merge;

import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Rows of one merge pass keyed by bucket, plus the series names that pass introduced. Rows hold
 * {@code bucket} and one numeric column per series name.
 */
@Value
public class MergedSeries {
  Map<String, Map<String, Object>> rowsByBucket;

  /** {@code <queryId>::<group>} to the unique column name assigned in this pass. */
  Map<String, String> seriesNameByStableKey;

  List<String> seriesNames;
}
