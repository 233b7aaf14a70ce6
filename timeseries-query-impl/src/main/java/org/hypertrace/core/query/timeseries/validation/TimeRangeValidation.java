package org.hypertrace.core.query.timeseries.validation;

import io.reactivex.rxjava3.core.Completable;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.query.timeseries.QueryEngineConfig;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryEngineValidationException;
import org.hypertrace.core.query.timeseries.utils.TimeUtil;

class TimeRangeValidation implements QueryValidation {

  private static final String INVALID_TIME_RANGE = "Invalid time range";

  private final long maxRangeSeconds;

  @Inject
  TimeRangeValidation(QueryEngineConfig queryEngineConfig) {
    this.maxRangeSeconds = queryEngineConfig.getValidationConfig().getMaxRangeSeconds();
  }

  @Override
  public Completable validate(QueryEngineRequest request, String tenantId) {
    Optional<Instant> start = TimeUtil.parseWireTime(request.getStartTime());
    Optional<Instant> end = TimeUtil.parseWireTime(request.getEndTime());
    if (start.isEmpty() || end.isEmpty()) {
      return Completable.error(
          new QueryEngineValidationException(
              INVALID_TIME_RANGE, "startTime and endTime must be valid datetime strings"));
    }
    if (!end.get().isAfter(start.get())) {
      return Completable.error(
          new QueryEngineValidationException(
              INVALID_TIME_RANGE, "endTime must be greater than startTime"));
    }
    if (Duration.between(start.get(), end.get()).getSeconds() > maxRangeSeconds) {
      return Completable.error(
          new QueryEngineValidationException(
              "Time range too large",
              String.format("Maximum supported range is %d seconds", maxRangeSeconds)));
    }
    return Completable.complete();
  }
}
