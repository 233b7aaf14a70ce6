package org.hypertrace.core.query.timeseries.fallback;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.api.TimeWindow;
import org.hypertrace.core.query.timeseries.api.WindowKind;
import org.hypertrace.core.query.timeseries.bucket.BucketMath;
import org.hypertrace.core.query.timeseries.utils.TimeUtil;

/** Windows a query is tried over and the bucket size to use in each of them. */
public class ExecutionWindowPlanner {

  private ExecutionWindowPlanner() {}

  /**
   * The requested window first, then, when fallback is allowed and enabled, one window per
   * configured width ending at {@code endTime}. Widths not larger than the requested range or
   * larger than the maximum are skipped, as are windows with bounds already planned.
   */
  public static List<TimeWindow> buildExecutionWindows(
      String startTime, String endTime, FallbackStrategy strategy, boolean allowFallback) {
    List<TimeWindow> windows = new ArrayList<>();
    windows.add(new TimeWindow(startTime, endTime, WindowKind.PRIMARY));

    Optional<Instant> start = TimeUtil.parseWireTime(startTime);
    Optional<Instant> end = TimeUtil.parseWireTime(endTime);
    if (start.isEmpty()
        || end.isEmpty()
        || !end.get().isAfter(start.get())
        || !allowFallback
        || !strategy.isEnableEmptyRangeFallback()) {
      return windows;
    }

    double rangeSeconds = Math.max(Duration.between(start.get(), end.get()).toMillis() / 1000d, 1);
    Set<String> seen = new HashSet<>();
    seen.add(windows.get(0).boundsKey());
    for (long seconds : strategy.getFallbackWindowSeconds()) {
      if (seconds <= rangeSeconds || seconds > strategy.getMaxFallbackRangeSeconds()) {
        continue;
      }
      TimeWindow window =
          new TimeWindow(
              TimeUtil.formatWireTime(end.get().minusSeconds(seconds)),
              TimeUtil.formatWireTime(end.get()),
              WindowKind.FALLBACK);
      if (seen.add(window.boundsKey())) {
        windows.add(window);
      }
    }
    return windows;
  }

  /** Fills in an auto-sized bucket for timeseries specs without one. */
  public static QuerySpec resolveTimeseriesBucketSpec(
      QuerySpec spec, String startTime, String endTime) {
    if (!spec.isTimeseries() || spec.getBucketSeconds() != null) {
      return spec;
    }
    return spec.withBucketSeconds(BucketMath.computeAutoBucketSeconds(startTime, endTime));
  }

  /**
   * Spec to execute over the window. Fallback windows never use a finer bucket than auto-sizing
   * picks for them.
   */
  public static QuerySpec resolveExecutionSpecForWindow(QuerySpec spec, TimeWindow window) {
    QuerySpec resolved =
        resolveTimeseriesBucketSpec(spec, window.getStartTime(), window.getEndTime());
    if (!resolved.isTimeseries() || window.getKind() != WindowKind.FALLBACK) {
      return resolved;
    }
    int autoBucketSeconds =
        BucketMath.computeAutoBucketSeconds(window.getStartTime(), window.getEndTime());
    return resolved.withBucketSeconds(Math.max(resolved.getBucketSeconds(), autoBucketSeconds));
  }
}
