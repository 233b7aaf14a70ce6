package org.hypertrace.core.query.timeseries.fallback;

import io.reactivex.rxjava3.core.Single;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.timeseries.api.QueryExecutionAttempt;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.api.TimeWindow;
import org.hypertrace.core.query.timeseries.api.TimeseriesPoint;
import org.hypertrace.core.query.timeseries.api.WindowKind;

/**
 * Tries the planned windows one after another until one returns series data. A failure on the
 * primary window fails the execution; failures on fallback windows are recorded and the next
 * window is tried. When no window has data the points of the last successful window are returned
 * and the execution does not count as a fallback.
 */
@Slf4j
public class FallbackExecutor {

  private static final String DEFAULT_ERROR_MESSAGE = "Query execution failed";

  private FallbackExecutor() {}

  public static Single<FallbackExecution> executeWithFallback(
      String startTime,
      String endTime,
      QuerySpec spec,
      FallbackStrategy strategy,
      boolean allowFallback,
      WindowExecutor windowExecutor) {
    List<TimeWindow> windows =
        ExecutionWindowPlanner.buildExecutionWindows(startTime, endTime, strategy, allowFallback);
    return Single.defer(
        () -> attempt(windows, 0, spec, windowExecutor, new ArrayList<>(), List.of()));
  }

  private static Single<FallbackExecution> attempt(
      List<TimeWindow> windows,
      int index,
      QuerySpec spec,
      WindowExecutor windowExecutor,
      List<QueryExecutionAttempt> attempts,
      List<TimeseriesPoint> lastPoints) {
    if (index >= windows.size()) {
      return Single.just(new FallbackExecution(lastPoints, List.copyOf(attempts), false));
    }

    TimeWindow window = windows.get(index);
    QuerySpec windowSpec = ExecutionWindowPlanner.resolveExecutionSpecForWindow(spec, window);
    return Single.defer(() -> windowExecutor.execute(window, windowSpec))
        .map(WindowOutcome::success)
        .onErrorResumeNext(
            error ->
                window.getKind() == WindowKind.PRIMARY
                    ? Single.<WindowOutcome>error(error)
                    : Single.just(WindowOutcome.failure(error)))
        .flatMap(
            outcome -> {
              if (outcome.getError().isPresent()) {
                Throwable error = outcome.getError().get();
                log.debug("Fallback window {} failed", window, error);
                attempts.add(
                    new QueryExecutionAttempt(
                        window.getStartTime(),
                        window.getEndTime(),
                        window.getKind(),
                        windowSpec.getBucketSeconds(),
                        0,
                        false,
                        Optional.ofNullable(error.getMessage()).orElse(DEFAULT_ERROR_MESSAGE)));
                return attempt(windows, index + 1, spec, windowExecutor, attempts, lastPoints);
              }

              List<TimeseriesPoint> points = outcome.getPoints();
              boolean hasSeries = points.stream().anyMatch(TimeseriesPoint::hasSeries);
              log.debug(
                  "Window {} returned {} points, series data: {}", window, points.size(), hasSeries);
              attempts.add(
                  new QueryExecutionAttempt(
                      window.getStartTime(),
                      window.getEndTime(),
                      window.getKind(),
                      windowSpec.getBucketSeconds(),
                      points.size(),
                      hasSeries,
                      null));
              if (hasSeries) {
                return Single.just(
                    new FallbackExecution(points, List.copyOf(attempts), index > 0));
              }
              return attempt(windows, index + 1, spec, windowExecutor, attempts, points);
            });
  }

  private static class WindowOutcome {
    private final List<TimeseriesPoint> points;
    private final Throwable error;

    private WindowOutcome(List<TimeseriesPoint> points, Throwable error) {
      this.points = points;
      this.error = error;
    }

    static WindowOutcome success(List<TimeseriesPoint> points) {
      return new WindowOutcome(points, null);
    }

    static WindowOutcome failure(Throwable error) {
      return new WindowOutcome(List.of(), error);
    }

    List<TimeseriesPoint> getPoints() {
      return points;
    }

    Optional<Throwable> getError() {
      return Optional.ofNullable(error);
    }
  }
}
