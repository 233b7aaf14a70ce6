package org.hypertrace.core.query.timeseries.validation;

import io.reactivex.rxjava3.core.Completable;
import java.util.ArrayList;
import java.util.List;
import org.hypertrace.core.query.timeseries.api.GroupBy;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryEngineValidationException;
import org.hypertrace.core.query.timeseries.api.QueryFilters;
import org.hypertrace.core.query.timeseries.api.QuerySource;
import org.hypertrace.core.query.timeseries.api.QuerySpec;

/** Traces attribute grouping and filtering both need an attribute key. */
class AttributeFilterValidation implements QueryValidation {

  @Override
  public Completable validate(QueryEngineRequest request, String tenantId) {
    QuerySpec spec = request.getQuery();
    if (spec.getSource() != QuerySource.TRACES) {
      return Completable.complete();
    }

    QueryFilters filters = spec.getFiltersOrEmpty();
    List<String> details = new ArrayList<>();
    if (spec.getGroupBy() == GroupBy.ATTRIBUTE && !filters.hasAttributeKey()) {
      details.add("groupBy=attribute requires filters.attributeKey");
    }
    if (!filters.hasAttributeKey()
        && filters.getAttributeValue() != null
        && !filters.getAttributeValue().isEmpty()) {
      details.add("filters.attributeValue requires filters.attributeKey");
    }

    if (!details.isEmpty()) {
      return Completable.error(
          new QueryEngineValidationException("Invalid traces attribute filters", details));
    }
    return Completable.complete();
  }
}
