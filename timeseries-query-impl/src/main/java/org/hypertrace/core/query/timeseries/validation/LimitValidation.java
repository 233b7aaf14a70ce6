package org.hypertrace.core.query.timeseries.validation;

import io.reactivex.rxjava3.core.Completable;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.timeseries.QueryEngineConfig;
import org.hypertrace.core.query.timeseries.QueryEngineConfig.LimitValidationConfig;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryEngineValidationException;
import org.hypertrace.core.query.timeseries.api.QuerySpec;

@Slf4j
class LimitValidation implements QueryValidation {

  LimitValidationConfig config;

  @Inject
  LimitValidation(QueryEngineConfig queryEngineConfig) {
    this.config = queryEngineConfig.getLimitValidationConfig();
  }

  @Override
  public Completable validate(QueryEngineRequest request, String tenantId) {
    QuerySpec spec = request.getQuery();
    if (spec.isTimeseries() || spec.getLimit() == null) {
      return Completable.complete();
    }
    int limit = spec.getLimit();

    switch (config.getMode()) {
      case ERROR:
        if (isInvalidLimit(limit)) {
          return Completable.error(
              new QueryEngineValidationException(
                  "Invalid breakdown limit", generateErrorMessageForLimit(limit)));
        }
        return Completable.complete();

      case WARN:
        if (isInvalidLimit(limit)) {
          log.warn(
              generateErrorMessageForLimit(limit) + ". Allowing due to warn mode.{}{}",
              System.lineSeparator(),
              request);
        }
        return Completable.complete();
      case DISABLED:
      default:
        return Completable.complete();
    }
  }

  private String generateErrorMessageForLimit(int limit) {
    return String.format(
        "Received invalid query limit of %s, required to be in range of [%s, %s]",
        limit, config.getMin(), config.getMax());
  }

  private boolean isInvalidLimit(int limit) {
    return limit < config.getMin() || limit > config.getMax();
  }
}
