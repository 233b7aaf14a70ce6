package org.hypertrace.core.query.timeseries.validation;

import io.reactivex.rxjava3.core.Completable;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryEngineValidationException;

class TenantValidation implements QueryValidation {
  @Override
  public Completable validate(QueryEngineRequest request, String tenantId) {
    if (tenantId == null || tenantId.isEmpty()) {
      return Completable.error(
          new QueryEngineValidationException(
              "Missing tenant", "Tenant ID is missing on request"));
    }
    return Completable.complete();
  }
}
