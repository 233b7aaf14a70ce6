package org.hypertrace.core.query.timeseries;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.observers.TestObserver;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.query.timeseries.adapter.BackendField;
import org.hypertrace.core.query.timeseries.adapter.BackendFieldResolver;
import org.hypertrace.core.query.timeseries.adapter.BackendPipe;
import org.hypertrace.core.query.timeseries.adapter.BackendQuery;
import org.hypertrace.core.query.timeseries.adapter.BackendRow;
import org.hypertrace.core.query.timeseries.adapter.ExecutionAdapter;
import org.hypertrace.core.query.timeseries.adapter.QuerySpecToBackendQueryConverter;
import org.hypertrace.core.query.timeseries.api.BreakdownItem;
import org.hypertrace.core.query.timeseries.api.GroupBy;
import org.hypertrace.core.query.timeseries.api.QueryEngineExecutionException;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryEngineResult;
import org.hypertrace.core.query.timeseries.api.QueryEngineValidationException;
import org.hypertrace.core.query.timeseries.api.QueryKind;
import org.hypertrace.core.query.timeseries.api.QuerySource;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.api.TimeseriesPoint;
import org.hypertrace.core.query.timeseries.api.TracesMetric;
import org.hypertrace.core.query.timeseries.normalize.SeriesNormalizer;
import org.hypertrace.core.query.timeseries.validation.QueryValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryEngineServiceTest {
  private static final String TENANT_ID = "tenant-1";
  private static final String START = "2026-01-01 00:00:00";
  private static final String END = "2026-01-01 01:00:00";

  @Mock QueryValidator queryValidator;
  @Mock ExecutionAdapter executionAdapter;

  private MeterRegistry meterRegistry;
  private QueryEngineService queryEngineService;

  @BeforeEach
  void setup() {
    meterRegistry = new SimpleMeterRegistry();
    when(queryValidator.validate(any(), any())).thenReturn(Completable.complete());
    queryEngineService =
        new QueryEngineService(
            queryValidator,
            executionAdapter,
            new QuerySpecToBackendQueryConverter(),
            new BackendFieldResolver(),
            new SeriesNormalizer(),
            meterRegistry);
  }

  @Test
  void executesTimeseriesWithAutoBucketAndFill() {
    when(executionAdapter.execute(eq(TENANT_ID), any()))
        .thenReturn(
            Single.just(
                List.of(
                    BackendRow.builder()
                        .bucket("2026-01-01 00:10:00")
                        .groupName("checkout")
                        .value(BackendField.COUNT, 4d)
                        .build())));

    QueryEngineResult result =
        queryEngineService.execute(TENANT_ID, request(tracesTimeseries())).blockingGet();

    ArgumentCaptor<BackendQuery> captor = ArgumentCaptor.forClass(BackendQuery.class);
    verify(executionAdapter).execute(eq(TENANT_ID), captor.capture());
    assertEquals(BackendPipe.CUSTOM_TRACES_TIMESERIES, captor.getValue().getPipe());
    assertEquals("300", captor.getValue().getParameters().get("bucket_seconds"));

    assertEquals(QueryKind.TIMESERIES, result.getKind());
    assertEquals(13, result.getTimeseries().size());
    assertEquals(
        new TimeseriesPoint("2026-01-01T00:10:00.000Z", Map.of("checkout", 4d)),
        result.getTimeseries().get(2));
    assertEquals(1d, statusCount("false"));
  }

  @Test
  void executesBreakdown() {
    QuerySpec spec =
        QuerySpec.builder()
            .kind(QueryKind.BREAKDOWN)
            .source(QuerySource.TRACES)
            .metric(TracesMetric.AVG_DURATION)
            .groupBy(GroupBy.SPAN_NAME)
            .limit(10)
            .build();
    when(executionAdapter.execute(eq(TENANT_ID), any()))
        .thenReturn(
            Single.just(
                List.of(
                    BackendRow.builder()
                        .name("GET /cart")
                        .value(BackendField.AVG_DURATION, 12.5)
                        .build())));

    QueryEngineResult result = queryEngineService.execute(TENANT_ID, request(spec)).blockingGet();

    assertEquals(List.of(new BreakdownItem("GET /cart", 12.5)), result.getBreakdown());
    assertEquals(List.of(), result.getTimeseries());
  }

  @Test
  void wrapsAdapterFailures() {
    when(executionAdapter.execute(eq(TENANT_ID), any()))
        .thenReturn(Single.error(new IllegalStateException("backend unavailable")));

    TestObserver<QueryEngineResult> observer =
        queryEngineService.execute(TENANT_ID, request(tracesTimeseries())).test();

    observer.assertError(
        error ->
            error instanceof QueryEngineExecutionException
                && error
                    .getMessage()
                    .equals("Failed to execute traces timeseries query: backend unavailable")
                && ((QueryEngineExecutionException) error)
                    .getCauseTag()
                    .equals("IllegalStateException")
                && ((QueryEngineExecutionException) error)
                    .getPipe()
                    .equals("custom_traces_timeseries"));
    assertEquals(1d, statusCount("true"));
  }

  @Test
  void doesNotCallBackendWhenValidationFails() {
    when(queryValidator.validate(any(), any()))
        .thenReturn(Completable.error(new QueryEngineValidationException("Invalid", "bad")));

    queryEngineService
        .execute(TENANT_ID, request(tracesTimeseries()))
        .test()
        .assertError(QueryEngineValidationException.class);

    verify(executionAdapter, never()).execute(any(), any());
  }

  private double statusCount(String error) {
    return meterRegistry
        .get("hypertrace.timeseries.query.requests.status")
        .tag("error", error)
        .counter()
        .count();
  }

  private static QuerySpec tracesTimeseries() {
    return QuerySpec.builder()
        .kind(QueryKind.TIMESERIES)
        .source(QuerySource.TRACES)
        .metric(TracesMetric.COUNT)
        .groupBy(GroupBy.SERVICE)
        .build();
  }

  private static QueryEngineRequest request(QuerySpec spec) {
    return new QueryEngineRequest(START, END, spec);
  }
}
