package org.hypertrace.core.query.timeseries.validation;

import io.reactivex.rxjava3.core.Completable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.query.timeseries.QueryEngineConfig;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryEngineValidationException;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.bucket.BucketMath;
import org.hypertrace.core.query.timeseries.utils.TimeUtil;

/**
 * Rejects timeseries queries whose bucket count over the range exceeds the configured budget. An
 * unset bucket size is resolved the same way execution resolves it.
 */
class PointBudgetValidation implements QueryValidation {

  private final long maxTimeseriesPoints;

  @Inject
  PointBudgetValidation(QueryEngineConfig queryEngineConfig) {
    this.maxTimeseriesPoints = queryEngineConfig.getValidationConfig().getMaxTimeseriesPoints();
  }

  @Override
  public Completable validate(QueryEngineRequest request, String tenantId) {
    QuerySpec spec = request.getQuery();
    Optional<Instant> start = TimeUtil.parseWireTime(request.getStartTime());
    Optional<Instant> end = TimeUtil.parseWireTime(request.getEndTime());
    if (!spec.isTimeseries() || start.isEmpty() || end.isEmpty()) {
      return Completable.complete();
    }

    int bucketSeconds =
        spec.getBucketSeconds() != null
            ? spec.getBucketSeconds()
            : BucketMath.computeAutoBucketSeconds(start.get(), end.get());
    double rangeSeconds = Duration.between(start.get(), end.get()).toMillis() / 1000d;
    long pointCount = (long) Math.ceil(rangeSeconds / bucketSeconds);
    if (pointCount <= maxTimeseriesPoints) {
      return Completable.complete();
    }
    return Completable.error(
        new QueryEngineValidationException(
            "Timeseries query too expensive",
            List.of(
                String.format(
                    "Requested %d points, maximum is %d", pointCount, maxTimeseriesPoints),
                "Increase bucketSeconds or reduce the time range")));
  }
}
