package org.hypertrace.core.query.timeseries.validation;

import io.reactivex.rxjava3.core.Completable;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;

public interface QueryValidation {
  Completable validate(QueryEngineRequest request, String tenantId);
}
