package org.hypertrace.core.query.timeseries.adapter;

import java.util.List;
import org.hypertrace.core.query.timeseries.api.GroupBy;
import org.hypertrace.core.query.timeseries.api.QueryEngineRequest;
import org.hypertrace.core.query.timeseries.api.QueryFilters;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.api.QuerySpecVisitor;

/**
 * Maps a validated request onto the backend pipe serving its source and kind, with the pipe's
 * parameters. Group-by flags are sent as {@code "1"}, lists as comma separated values; parameters
 * without a value are left out.
 */
public class QuerySpecToBackendQueryConverter {

  static final String FLAG_SET = "1";

  /**
   * @param bucketSeconds resolved bucket size for timeseries requests, ignored for breakdowns
   */
  public BackendQuery convert(QueryEngineRequest request, Integer bucketSeconds) {
    return request.getQuery().accept(new ConvertingVisitor(request, bucketSeconds));
  }

  private static class ConvertingVisitor implements QuerySpecVisitor<BackendQuery> {
    private final QueryEngineRequest request;
    private final Integer bucketSeconds;

    private ConvertingVisitor(QueryEngineRequest request, Integer bucketSeconds) {
      this.request = request;
      this.bucketSeconds = bucketSeconds;
    }

    @Override
    public BackendQuery visitTracesTimeseries(QuerySpec spec) {
      BackendQueryParameters parameters =
          new BackendQueryParameters(BackendPipe.CUSTOM_TRACES_TIMESERIES)
              .put("start_time", request.getStartTime())
              .put("end_time", request.getEndTime())
              .put("bucket_seconds", bucketSeconds);
      addTracesFilters(parameters, spec);
      addTracesGroupBy(parameters, spec);
      addAttributeFilter(parameters, spec.getFiltersOrEmpty());
      return parameters.build();
    }

    @Override
    public BackendQuery visitLogsTimeseries(QuerySpec spec) {
      QueryFilters filters = spec.getFiltersOrEmpty();
      return new BackendQueryParameters(BackendPipe.CUSTOM_LOGS_TIMESERIES)
          .put("start_time", request.getStartTime())
          .put("end_time", request.getEndTime())
          .put("bucket_seconds", bucketSeconds)
          .put("service_name", filters.getServiceName())
          .put("severity", filters.getSeverity())
          .flag("group_by_service", spec.getGroupBy() == GroupBy.SERVICE)
          .flag("group_by_severity", spec.getGroupBy() == GroupBy.SEVERITY)
          .build();
    }

    @Override
    public BackendQuery visitMetricsTimeseries(QuerySpec spec) {
      QueryFilters filters = spec.getFiltersOrEmpty();
      return new BackendQueryParameters(metricTimeseriesPipe(filters))
          .put("metric_name", filters.getMetricName())
          .put("service", filters.getServiceName())
          .put("start_time", request.getStartTime())
          .put("end_time", request.getEndTime())
          .put("bucket_seconds", bucketSeconds)
          .build();
    }

    @Override
    public BackendQuery visitTracesBreakdown(QuerySpec spec) {
      BackendQueryParameters parameters =
          new BackendQueryParameters(BackendPipe.CUSTOM_TRACES_BREAKDOWN)
              .put("start_time", request.getStartTime())
              .put("end_time", request.getEndTime());
      addTracesFilters(parameters, spec);
      parameters.put("limit", spec.getLimit());
      addTracesGroupBy(parameters, spec);
      addAttributeFilter(parameters, spec.getFiltersOrEmpty());
      return parameters.build();
    }

    @Override
    public BackendQuery visitLogsBreakdown(QuerySpec spec) {
      QueryFilters filters = spec.getFiltersOrEmpty();
      return new BackendQueryParameters(BackendPipe.CUSTOM_LOGS_BREAKDOWN)
          .put("start_time", request.getStartTime())
          .put("end_time", request.getEndTime())
          .put("service_name", filters.getServiceName())
          .put("severity", filters.getSeverity())
          .put("limit", spec.getLimit())
          .flag("group_by_service", spec.getGroupBy() == GroupBy.SERVICE)
          .flag("group_by_severity", spec.getGroupBy() == GroupBy.SEVERITY)
          .build();
    }

    @Override
    public BackendQuery visitMetricsBreakdown(QuerySpec spec) {
      QueryFilters filters = spec.getFiltersOrEmpty();
      return new BackendQueryParameters(BackendPipe.CUSTOM_METRICS_BREAKDOWN)
          .put("metric_name", filters.getMetricName())
          .put("start_time", request.getStartTime())
          .put("end_time", request.getEndTime())
          .put("metric_type", filters.getMetricType().getValue())
          .put("limit", spec.getLimit())
          .build();
    }

    private void addTracesFilters(BackendQueryParameters parameters, QuerySpec spec) {
      QueryFilters filters = spec.getFiltersOrEmpty();
      parameters
          .put("service_name", filters.getServiceName())
          .put("span_name", filters.getSpanName())
          .flag("root_only", Boolean.TRUE.equals(filters.getRootSpansOnly()))
          .put("environments", joinCsv(filters.getEnvironments()))
          .put("commit_shas", joinCsv(filters.getCommitShas()));
    }

    private void addTracesGroupBy(BackendQueryParameters parameters, QuerySpec spec) {
      GroupBy groupBy = spec.getGroupBy();
      parameters
          .flag("group_by_service", groupBy == GroupBy.SERVICE)
          .flag("group_by_span_name", groupBy == GroupBy.SPAN_NAME)
          .flag("group_by_status_code", groupBy == GroupBy.STATUS_CODE)
          .flag("group_by_http_method", groupBy == GroupBy.HTTP_METHOD)
          .put(
              "group_by_attribute",
              groupBy == GroupBy.ATTRIBUTE ? spec.getFiltersOrEmpty().getAttributeKey() : null);
    }

    private void addAttributeFilter(BackendQueryParameters parameters, QueryFilters filters) {
      parameters
          .put("attribute_filter_key", filters.getAttributeKey())
          .put("attribute_filter_value", filters.getAttributeValue());
    }

    private static BackendPipe metricTimeseriesPipe(QueryFilters filters) {
      switch (filters.getMetricType()) {
        case SUM:
          return BackendPipe.METRIC_TIME_SERIES_SUM;
        case GAUGE:
          return BackendPipe.METRIC_TIME_SERIES_GAUGE;
        case HISTOGRAM:
          return BackendPipe.METRIC_TIME_SERIES_HISTOGRAM;
        case EXPONENTIAL_HISTOGRAM:
          return BackendPipe.METRIC_TIME_SERIES_EXP_HISTOGRAM;
        default:
          throw new IllegalArgumentException("Unknown metric type: " + filters.getMetricType());
      }
    }

    private static String joinCsv(List<String> values) {
      return values == null ? null : String.join(",", values);
    }
  }

  private static class BackendQueryParameters {
    private final BackendQuery.BackendQueryBuilder builder;

    private BackendQueryParameters(BackendPipe pipe) {
      this.builder = BackendQuery.builder().pipe(pipe);
    }

    BackendQueryParameters put(String name, Object value) {
      if (value != null) {
        builder.parameter(name, String.valueOf(value));
      }
      return this;
    }

    BackendQueryParameters flag(String name, boolean set) {
      return put(name, set ? FLAG_SET : null);
    }

    BackendQuery build() {
      return builder.build();
    }
  }
}
