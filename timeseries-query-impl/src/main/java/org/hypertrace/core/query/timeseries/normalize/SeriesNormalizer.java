package org.hypertrace.core.query.timeseries.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import org.hypertrace.core.query.timeseries.adapter.BackendRow;
import org.hypertrace.core.query.timeseries.api.BreakdownItem;
import org.hypertrace.core.query.timeseries.api.TimeseriesPoint;
import org.hypertrace.core.query.timeseries.bucket.BucketMath;

/** Shapes raw backend rows into per-bucket points or breakdown items. */
@Singleton
public class SeriesNormalizer {

  /**
   * Groups rows by normalized bucket label, one series entry per group name. With fill options the
   * result follows the bucket timeline of the window, buckets without rows carrying an empty
   * series; rows whose bucket falls outside the timeline follow it in arrival order. Without fill
   * options buckets appear in first-seen order. A repeated bucket and group keeps the last value.
   */
  public List<TimeseriesPoint> groupTimeSeriesRows(
      List<BackendRow> rows, ToDoubleFunction<BackendRow> valueExtractor, FillOptions fillOptions) {
    Map<String, Map<String, Double>> seriesByBucket = new LinkedHashMap<>();
    Set<String> bucketOrder = new LinkedHashSet<>();
    if (fillOptions != null) {
      bucketOrder.addAll(
          BucketMath.buildBucketTimeline(
              fillOptions.getStartTime(),
              fillOptions.getEndTime(),
              fillOptions.getBucketSeconds()));
    }

    for (BackendRow row : rows) {
      String bucket = BucketMath.normalizeBucketLabel(row.getBucket());
      bucketOrder.add(bucket);
      seriesByBucket
          .computeIfAbsent(bucket, unused -> new LinkedHashMap<>())
          .put(Objects.toString(row.getGroupName(), ""), valueExtractor.applyAsDouble(row));
    }

    List<TimeseriesPoint> points = new ArrayList<>(bucketOrder.size());
    for (String bucket : bucketOrder) {
      Map<String, Double> series = seriesByBucket.getOrDefault(bucket, Map.of());
      points.add(new TimeseriesPoint(bucket, Collections.unmodifiableMap(series)));
    }
    return points;
  }

  /** One item per row, in backend order. */
  public List<BreakdownItem> toBreakdownItems(
      List<BackendRow> rows, ToDoubleFunction<BackendRow> valueExtractor) {
    return rows.stream()
        .map(
            row ->
                new BreakdownItem(
                    Objects.toString(row.getName(), ""), valueExtractor.applyAsDouble(row)))
        .collect(Collectors.toUnmodifiableList());
  }
}
