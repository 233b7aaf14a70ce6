package org.hypertrace.core.query.timeseries.validation;

import static org.hypertrace.core.query.timeseries.validation.ValidationTestRequests.attributeGroupBy;
import static org.hypertrace.core.query.timeseries.validation.ValidationTestRequests.request;
import static org.hypertrace.core.query.timeseries.validation.ValidationTestRequests.tracesTimeseries;

import io.reactivex.rxjava3.observers.TestObserver;
import java.util.List;
import org.hypertrace.core.query.timeseries.api.GroupBy;
import org.hypertrace.core.query.timeseries.api.LogsMetric;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryEngineValidationException;
import org.hypertrace.core.query.timeseries.api.QueryFilters;
import org.hypertrace.core.query.timeseries.api.QueryKind;
import org.hypertrace.core.query.timeseries.api.QuerySource;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.junit.jupiter.api.Test;

class AttributeFilterValidationTest {
  AttributeFilterValidation validation = new AttributeFilterValidation();

  @Test
  void errorsOnAttributeGroupByWithoutKey() {
    assertInvalid(
        request(attributeGroupBy(QueryFilters.builder().serviceName("checkout").build())),
        List.of("groupBy=attribute requires filters.attributeKey"));
    assertInvalid(
        request(attributeGroupBy(null)), List.of("groupBy=attribute requires filters.attributeKey"));
  }

  @Test
  void errorsOnAttributeValueWithoutKey() {
    assertInvalid(
        request(
            tracesTimeseries()
                .groupBy(GroupBy.ATTRIBUTE)
                .filters(QueryFilters.builder().attributeValue("gold").build())
                .build()),
        List.of(
            "groupBy=attribute requires filters.attributeKey",
            "filters.attributeValue requires filters.attributeKey"));
  }

  @Test
  void allowsAttributeGroupByWithKey() {
    assertValid(request(attributeGroupBy(QueryFilters.builder().attributeKey("tier").build())));
  }

  @Test
  void ignoresOtherSources() {
    QuerySpec logsSpec =
        QuerySpec.builder()
            .kind(QueryKind.TIMESERIES)
            .source(QuerySource.LOGS)
            .metric(LogsMetric.COUNT)
            .groupBy(GroupBy.SEVERITY)
            .build();
    assertValid(request(logsSpec));
  }

  private void assertValid(QueryEngineRequest request) {
    TestObserver<Void> observer = new TestObserver<>();
    validation.validate(request, "tenant").blockingSubscribe(observer);
    observer.assertComplete();
  }

  private void assertInvalid(QueryEngineRequest request, List<String> details) {
    TestObserver<Void> observer = new TestObserver<>();
    validation.validate(request, "tenant").blockingSubscribe(observer);
    observer.assertError(
        error ->
            error instanceof QueryEngineValidationException
                && error.getMessage().equals("Invalid traces attribute filters")
                && ((QueryEngineValidationException) error).getDetails().equals(details));
  }
}
