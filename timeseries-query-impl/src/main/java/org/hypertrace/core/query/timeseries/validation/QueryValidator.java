package org.hypertrace.core.query.timeseries.validation;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import java.util.Set;
import javax.inject.Inject;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;

/**
 * Query validator invokes each registered validation in binding order and stops at the first
 * failure. Any failing validation is responsible for producing its own error which will be passed
 * to the caller.
 */
public class QueryValidator {
  private final Set<QueryValidation> validations;

  @Inject
  QueryValidator(Set<QueryValidation> validations) {
    this.validations = validations;
  }

  public Completable validate(QueryEngineRequest request, String tenantId) {
    return Observable.fromIterable(validations)
        .concatMapCompletable(queryValidation -> queryValidation.validate(request, tenantId));
  }
}
