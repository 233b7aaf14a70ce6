package org.hypertrace.core.query.timeseries;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Single;
import java.time.Instant;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.timeseries.adapter.BackendField;
import org.hypertrace.core.query.timeseries.adapter.BackendFieldResolver;
import org.hypertrace.core.query.timeseries.adapter.BackendQuery;
import org.hypertrace.core.query.timeseries.adapter.BackendRow;
import org.hypertrace.core.query.timeseries.adapter.ExecutionAdapter;
import org.hypertrace.core.query.timeseries.adapter.QuerySpecToBackendQueryConverter;
import org.hypertrace.core.query.timeseries.api.BreakdownItem;
import org.hypertrace.core.query.timeseries.api.QueryEngineExecutionException;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryEngineResult;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.bucket.BucketMath;
import org.hypertrace.core.query.timeseries.normalize.FillOptions;
import org.hypertrace.core.query.timeseries.normalize.SeriesNormalizer;
import org.hypertrace.core.query.timeseries.utils.TimeUtil;
import org.hypertrace.core.query.timeseries.validation.QueryValidator;

/**
 * Runs a single query spec over a single window: validation, bucket resolution, one backend call
 * through the {@link ExecutionAdapter} and normalization of the returned rows.
 */
@Singleton
@Slf4j
public class QueryEngineService {

  private static final String SERVICE_REQUESTS_STATUS_COUNTER =
      "hypertrace.timeseries.query.requests.status";

  private final QueryValidator queryValidator;
  private final ExecutionAdapter executionAdapter;
  private final QuerySpecToBackendQueryConverter backendQueryConverter;
  private final BackendFieldResolver backendFieldResolver;
  private final SeriesNormalizer seriesNormalizer;

  private final Counter requestStatusErrorCounter;
  private final Counter requestStatusSuccessCounter;

  @Inject
  public QueryEngineService(
      QueryValidator queryValidator,
      ExecutionAdapter executionAdapter,
      QuerySpecToBackendQueryConverter backendQueryConverter,
      BackendFieldResolver backendFieldResolver,
      SeriesNormalizer seriesNormalizer,
      MeterRegistry meterRegistry) {
    this.queryValidator = queryValidator;
    this.executionAdapter = executionAdapter;
    this.backendQueryConverter = backendQueryConverter;
    this.backendFieldResolver = backendFieldResolver;
    this.seriesNormalizer = seriesNormalizer;
    this.requestStatusErrorCounter = registerCounter(meterRegistry, "true");
    this.requestStatusSuccessCounter = registerCounter(meterRegistry, "false");
  }

  public Single<QueryEngineResult> execute(String tenantId, QueryEngineRequest request) {
    return this.queryValidator
        .validate(request, tenantId)
        .andThen(Single.defer(() -> this.executeValidated(tenantId, request)))
        .doOnError(
            error -> {
              log.error("Query failed: {}", request, error);
              requestStatusErrorCounter.increment();
            })
        .doOnSuccess(result -> requestStatusSuccessCounter.increment());
  }

  private Single<QueryEngineResult> executeValidated(String tenantId, QueryEngineRequest request) {
    QuerySpec spec = request.getQuery();
    Instant start = TimeUtil.parseWireTime(request.getStartTime()).orElseThrow();
    Instant end = TimeUtil.parseWireTime(request.getEndTime()).orElseThrow();
    Integer bucketSeconds =
        spec.isTimeseries()
            ? (spec.getBucketSeconds() != null
                ? spec.getBucketSeconds()
                : BucketMath.computeAutoBucketSeconds(start, end))
            : null;

    BackendQuery backendQuery = backendQueryConverter.convert(request, bucketSeconds);
    BackendField field = backendFieldResolver.resolve(spec);
    log.debug(
        "Executing pipe {} for tenant {} with {}",
        backendQuery.getPipe().getPipeName(),
        tenantId,
        backendQuery.getParameters());

    return executionAdapter
        .execute(tenantId, backendQuery)
        .onErrorResumeNext(error -> Single.error(toExecutionException(spec, backendQuery, error)))
        .map(
            rows ->
                spec.isTimeseries()
                    ? QueryEngineResult.ofTimeseries(
                        spec.getSource(),
                        seriesNormalizer.groupTimeSeriesRows(
                            rows,
                            row -> row.getValue(field),
                            new FillOptions(start, end, bucketSeconds)))
                    : QueryEngineResult.ofBreakdown(
                        spec.getSource(), toBreakdownItems(rows, field)));
  }

  private List<BreakdownItem> toBreakdownItems(List<BackendRow> rows, BackendField field) {
    return seriesNormalizer.toBreakdownItems(rows, row -> row.getValue(field));
  }

  private static QueryEngineExecutionException toExecutionException(
      QuerySpec spec, BackendQuery backendQuery, Throwable error) {
    return new QueryEngineExecutionException(
        String.format(
            "Failed to execute %s %s query: %s",
            spec.getSource().getValue(), spec.getKind().getValue(), error.getMessage()),
        error.getClass().getSimpleName(),
        backendQuery.getPipe().getPipeName(),
        error);
  }

  private static Counter registerCounter(MeterRegistry meterRegistry, String error) {
    return Counter.builder(SERVICE_REQUESTS_STATUS_COUNTER)
        .tag("error", error)
        .register(meterRegistry);
  }
}
