package org.hypertrace.core.query.timeseries;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.timeseries.api.ComparisonMode;
import org.hypertrace.core.query.timeseries.api.ComparisonOptions;
import org.hypertrace.core.query.timeseries.api.FormulaDraft;
import org.hypertrace.core.query.timeseries.api.QueryDraft;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryEngineResult;
import org.hypertrace.core.query.timeseries.api.QueryExecutionAttempt;
import org.hypertrace.core.query.timeseries.api.QueryExecutionDebug;
import org.hypertrace.core.query.timeseries.api.QueryRunResult;
import org.hypertrace.core.query.timeseries.api.QueryRunStatus;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.api.TimeWindow;
import org.hypertrace.core.query.timeseries.api.TimeseriesPoint;
import org.hypertrace.core.query.timeseries.api.TimeseriesQueryDebug;
import org.hypertrace.core.query.timeseries.api.TimeseriesQueryDebug.ComparisonDebug;
import org.hypertrace.core.query.timeseries.api.TimeseriesQueryRequest;
import org.hypertrace.core.query.timeseries.api.TimeseriesQueryResponse;
import org.hypertrace.core.query.timeseries.api.WindowKind;
import org.hypertrace.core.query.timeseries.bucket.BucketMath;
import org.hypertrace.core.query.timeseries.builder.BuildSpecResult;
import org.hypertrace.core.query.timeseries.builder.QuerySpecBuilder;
import org.hypertrace.core.query.timeseries.fallback.ExecutionWindowPlanner;
import org.hypertrace.core.query.timeseries.fallback.FallbackExecution;
import org.hypertrace.core.query.timeseries.fallback.FallbackExecutor;
import org.hypertrace.core.query.timeseries.fallback.FallbackStrategy;
import org.hypertrace.core.query.timeseries.formula.FormulaResultsBuilder;
import org.hypertrace.core.query.timeseries.merge.DisplayNames;
import org.hypertrace.core.query.timeseries.merge.MergedSeries;
import org.hypertrace.core.query.timeseries.merge.PercentChangeCalculator;
import org.hypertrace.core.query.timeseries.merge.SeriesMerger;
import org.hypertrace.core.query.timeseries.utils.TimeUtil;

/**
 * Entry point for a multi query timeseries request. Enabled queries are built and executed
 * concurrently on the query scheduler, formulas are evaluated over the joined results, and
 * everything is merged into one table, optionally alongside the previous period of the same
 * length.
 */
@Slf4j
@Singleton
public class TimeseriesQueryOrchestrator implements AutoCloseable {

  static final String NO_ENABLED_QUERIES = "No enabled queries to run";
  static final String NO_QUERY_DATA = "No query data found in selected time range";
  private static final String EXECUTION_FAILED = "Query execution failed";
  private static final String REQUEST_FAILED = "Failed to fetch query-builder timeseries";
  private static final String PREVIOUS_PERIOD_SUFFIX = " (prev)";

  private final QuerySpecBuilder querySpecBuilder;
  private final QueryEngineService queryEngineService;
  private final FormulaResultsBuilder formulaResultsBuilder;
  private final SeriesMerger seriesMerger;
  private final PercentChangeCalculator percentChangeCalculator;
  private final QueryEngineConfig queryEngineConfig;
  private final ExecutorService queryExecutor;
  private final Scheduler queryScheduler;

  @Inject
  public TimeseriesQueryOrchestrator(
      QuerySpecBuilder querySpecBuilder,
      QueryEngineService queryEngineService,
      FormulaResultsBuilder formulaResultsBuilder,
      SeriesMerger seriesMerger,
      PercentChangeCalculator percentChangeCalculator,
      QueryEngineConfig queryEngineConfig,
      ExecutorService queryExecutor,
      Scheduler queryScheduler) {
    this.querySpecBuilder = querySpecBuilder;
    this.queryEngineService = queryEngineService;
    this.formulaResultsBuilder = formulaResultsBuilder;
    this.seriesMerger = seriesMerger;
    this.percentChangeCalculator = percentChangeCalculator;
    this.queryEngineConfig = queryEngineConfig;
    this.queryExecutor = queryExecutor;
    this.queryScheduler = queryScheduler;
  }

  /** Stops the query pool. Requests already running finish; new ones are rejected. */
  @Override
  public void close() {
    log.debug("Shutting down timeseries query pool");
    this.queryExecutor.shutdown();
  }

  /** Never errors: failures are reported through {@link TimeseriesQueryResponse#getError()}. */
  public Single<TimeseriesQueryResponse> execute(String tenantId, TimeseriesQueryRequest request) {
    return Single.defer(() -> this.executeRequest(tenantId, request))
        .onErrorReturn(
            error -> {
              log.error("Timeseries request failed for tenant {}", tenantId, error);
              return TimeseriesQueryResponse.failure(
                  Optional.ofNullable(error.getMessage()).orElse(REQUEST_FAILED), null);
            });
  }

  private Single<TimeseriesQueryResponse> executeRequest(
      String tenantId, TimeseriesQueryRequest request) {
    List<QueryDraft> enabledQueries =
        request.getQueries().stream().filter(QueryDraft::isEnabled).collect(Collectors.toList());
    if (enabledQueries.isEmpty()) {
      return Single.just(TimeseriesQueryResponse.failure(NO_ENABLED_QUERIES, null));
    }

    List<FormulaDraft> formulas = Optional.ofNullable(request.getFormulas()).orElse(List.of());
    ComparisonOptions comparison =
        Optional.ofNullable(request.getComparison()).orElse(ComparisonOptions.NONE);
    FallbackStrategy strategy =
        FallbackStrategy.resolve(request.getStrategy(), queryEngineConfig.getFallbackConfig());

    return runQueryWindow(
            tenantId,
            request.getStartTime(),
            request.getEndTime(),
            enabledQueries,
            formulas,
            strategy,
            true)
        .flatMap(
            current -> {
              if (countQueriesWithSeries(current.getQueryResults()) == 0) {
                String error = noQueryDataMessage(current.getQueryResults());
                return Single.just(TimeseriesQueryResponse.failure(error, null));
              }
              PreviousPeriod previousPeriod =
                  PreviousPeriod.of(request.getStartTime(), request.getEndTime());
              boolean comparePrevious =
                  comparison.getMode() == ComparisonMode.PREVIOUS_PERIOD
                      && previousPeriod.isEnabled();
              Single<Optional<WindowRun>> previous =
                  comparePrevious
                      ? runQueryWindow(
                              tenantId,
                              previousPeriod.getStartTime(),
                              previousPeriod.getEndTime(),
                              enabledQueries,
                              formulas,
                              strategy,
                              false)
                          .map(Optional::of)
                      : Single.just(Optional.empty());
              return previous.map(
                  previousRun ->
                      buildResponse(
                          request,
                          enabledQueries,
                          formulas,
                          comparison,
                          strategy,
                          previousPeriod,
                          current,
                          previousRun));
            });
  }

  private TimeseriesQueryResponse buildResponse(
      TimeseriesQueryRequest request,
      List<QueryDraft> enabledQueries,
      List<FormulaDraft> formulas,
      ComparisonOptions comparison,
      FallbackStrategy strategy,
      PreviousPeriod previousPeriod,
      WindowRun current,
      Optional<WindowRun> previous) {
    Map<String, String> displayNameById = DisplayNames.byId(enabledQueries, formulas);
    Set<String> usedSeriesNames = new HashSet<>();
    MergedSeries mergedCurrent =
        seriesMerger.merge(current.getAllResults(), displayNameById, "", usedSeriesNames);
    List<MergedSeries> mergedSets = new ArrayList<>(List.of(mergedCurrent));

    Optional<MergedSeries> mergedPrevious =
        previous.map(
            previousRun ->
                seriesMerger.merge(
                    shiftResults(previousRun.getAllResults(), previousPeriod.getShift()),
                    displayNameById,
                    PREVIOUS_PERIOD_SUFFIX,
                    usedSeriesNames));
    mergedPrevious.ifPresent(mergedSets::add);

    List<Map<String, Object>> rows = seriesMerger.combineRows(mergedSets);
    if (comparison.isIncludePercentChange() && mergedPrevious.isPresent()) {
      percentChangeCalculator.append(
          rows,
          mergedCurrent.getSeriesNameByStableKey(),
          mergedPrevious.get().getSeriesNameByStableKey());
    }

    TimeseriesQueryDebug debug =
        TimeseriesQueryDebug.builder()
            .primaryWindow(
                new TimeWindow(request.getStartTime(), request.getEndTime(), WindowKind.PRIMARY))
            .comparison(
                new ComparisonDebug(
                    comparison.getMode(),
                    comparison.isIncludePercentChange(),
                    previousPeriod.getShift().toMillis(),
                    previous.isPresent() ? previousPeriod.getStartTime() : null,
                    previous.isPresent() ? previousPeriod.getEndTime() : null))
            .strategy(strategy.toDebug())
            .queries(current.getDebug())
            .previousQueries(previous.map(WindowRun::getDebug).orElse(List.of()))
            .build();

    if (!request.isDebug()) {
      return new TimeseriesQueryResponse(rows, null, null);
    }
    log.info("Timeseries execution: {}", debug);
    return new TimeseriesQueryResponse(rows, null, debug);
  }

  private Single<WindowRun> runQueryWindow(
      String tenantId,
      String startTime,
      String endTime,
      List<QueryDraft> queries,
      List<FormulaDraft> formulas,
      FallbackStrategy strategy,
      boolean allowFallback) {
    return Observable.fromIterable(queries)
        .concatMapEager(
            query ->
                Single.defer(
                        () ->
                            runQuery(tenantId, startTime, endTime, query, strategy, allowFallback))
                    .subscribeOn(queryScheduler)
                    .toObservable())
        .toList()
        .map(
            runs -> {
              List<QueryRunResult> queryResults =
                  runs.stream().map(QueryRun::getResult).collect(Collectors.toList());
              List<QueryRunResult> allResults = new ArrayList<>(queryResults);
              if (countQueriesWithSeries(queryResults) > 0) {
                allResults.addAll(
                    formulaResultsBuilder.buildFormulaResults(formulas, queryResults));
              }
              return new WindowRun(
                  queryResults,
                  allResults,
                  runs.stream().map(QueryRun::getDebug).collect(Collectors.toList()));
            });
  }

  private Single<QueryRun> runQuery(
      String tenantId,
      String startTime,
      String endTime,
      QueryDraft query,
      FallbackStrategy strategy,
      boolean allowFallback) {
    BuildSpecResult built = querySpecBuilder.buildTimeseriesQuerySpec(query);
    if (!built.isSuccess()) {
      return Single.just(
          new QueryRun(
              QueryRunResult.failure(
                  query.getId(),
                  query.getName(),
                  query.getDataSource(),
                  built.getError(),
                  built.getWarnings()),
              executionDebug(query, null, List.of(), false)));
    }

    QuerySpec querySpec =
        ExecutionWindowPlanner.resolveTimeseriesBucketSpec(built.getQuery(), startTime, endTime);
    return FallbackExecutor.executeWithFallback(
            startTime,
            endTime,
            querySpec,
            strategy,
            allowFallback,
            (window, windowSpec) ->
                queryEngineService
                    .execute(
                        tenantId,
                        new QueryEngineRequest(
                            window.getStartTime(), window.getEndTime(), windowSpec))
                    .map(QueryEngineResult::getTimeseries))
        .map(execution -> toQueryRun(query, querySpec, built, execution))
        .onErrorReturn(
            error -> {
              log.debug("Query {} failed", query.getId(), error);
              return new QueryRun(
                  QueryRunResult.failure(
                      query.getId(),
                      query.getName(),
                      query.getDataSource(),
                      Optional.ofNullable(error.getMessage()).orElse(EXECUTION_FAILED),
                      built.getWarnings()),
                  executionDebug(query, querySpec, List.of(), false));
            });
  }

  private static QueryRun toQueryRun(
      QueryDraft query, QuerySpec querySpec, BuildSpecResult built, FallbackExecution execution) {
    List<String> warnings = new ArrayList<>(built.getWarnings());
    if (execution.isFallbackUsed()) {
      QueryExecutionAttempt selected = execution.getLastAttempt();
      warnings.add(
          String.format(
              "No data in requested range; used fallback window %s -> %s",
              selected.getStartTime(), selected.getEndTime()));
    }
    QueryRunResult result =
        QueryRunResult.builder()
            .queryId(query.getId())
            .queryName(query.getName())
            .source(query.getDataSource())
            .status(QueryRunStatus.SUCCESS)
            .warnings(warnings)
            .data(execution.getPoints())
            .build();
    return new QueryRun(
        result,
        executionDebug(query, querySpec, execution.getAttempts(), execution.isFallbackUsed()));
  }

  private static QueryExecutionDebug executionDebug(
      QueryDraft query,
      QuerySpec spec,
      List<QueryExecutionAttempt> attempts,
      boolean fallbackUsed) {
    return new QueryExecutionDebug(
        query.getId(), query.getName(), query.getDataSource(), spec, attempts, fallbackUsed);
  }

  static long countQueriesWithSeries(List<QueryRunResult> results) {
    return results.stream().filter(result -> result.isSuccess() && result.hasSeriesData()).count();
  }

  static String noQueryDataMessage(List<QueryRunResult> results) {
    return results.stream()
        .map(QueryRunResult::getError)
        .filter(error -> error != null && !error.isEmpty())
        .findFirst()
        .orElse(NO_QUERY_DATA);
  }

  private static List<QueryRunResult> shiftResults(List<QueryRunResult> results, Duration shift) {
    return results.stream()
        .map(
            result ->
                result.toBuilder()
                    .clearData()
                    .data(
                        result.getData().stream()
                            .map(
                                point ->
                                    new TimeseriesPoint(
                                        BucketMath.shiftBucket(point.getBucket(), shift),
                                        point.getSeries()))
                            .collect(Collectors.toList()))
                    .build())
        .collect(Collectors.toList());
  }

  @Value
  private static class QueryRun {
    QueryRunResult result;
    QueryExecutionDebug debug;
  }

  @Value
  private static class WindowRun {
    List<QueryRunResult> queryResults;
    List<QueryRunResult> allResults;
    List<QueryExecutionDebug> debug;
  }

  /** The window of equal length right before the requested one, in wire format. */
  @Value
  private static class PreviousPeriod {
    String startTime;
    String endTime;
    Duration shift;

    static PreviousPeriod of(String startTime, String endTime) {
      Optional<Instant> start = TimeUtil.parseWireTime(startTime);
      Optional<Instant> end = TimeUtil.parseWireTime(endTime);
      if (start.isEmpty() || end.isEmpty() || !end.get().isAfter(start.get())) {
        return new PreviousPeriod(null, null, Duration.ZERO);
      }
      Duration shift = Duration.between(start.get(), end.get());
      return new PreviousPeriod(
          TimeUtil.formatWireTime(start.get().minus(shift)),
          TimeUtil.formatWireTime(end.get().minus(shift)),
          shift);
    }

    boolean isEnabled() {
      return !shift.isZero();
    }
  }
}
