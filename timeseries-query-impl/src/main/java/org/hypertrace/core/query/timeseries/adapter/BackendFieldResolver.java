package org.hypertrace.core.query.timeseries.adapter;

import org.hypertrace.core.query.timeseries.api.LogsMetric;
import org.hypertrace.core.query.timeseries.api.MetricsMetric;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.api.QuerySpecVisitor;
import org.hypertrace.core.query.timeseries.api.TracesMetric;

/** Selects the row column holding the requested metric for each source and kind. */
public class BackendFieldResolver implements QuerySpecVisitor<BackendField> {

  public BackendField resolve(QuerySpec spec) {
    return spec.accept(this);
  }

  @Override
  public BackendField visitTracesTimeseries(QuerySpec spec) {
    return tracesField((TracesMetric) spec.getMetric());
  }

  @Override
  public BackendField visitLogsTimeseries(QuerySpec spec) {
    return logsField((LogsMetric) spec.getMetric());
  }

  @Override
  public BackendField visitMetricsTimeseries(QuerySpec spec) {
    switch ((MetricsMetric) spec.getMetric()) {
      case AVG:
        return BackendField.AVG_VALUE;
      case SUM:
        return BackendField.SUM_VALUE;
      case MIN:
        return BackendField.MIN_VALUE;
      case MAX:
        return BackendField.MAX_VALUE;
      case COUNT:
        return BackendField.DATA_POINT_COUNT;
      default:
        throw new IllegalArgumentException("Unsupported metrics metric: " + spec.getMetric());
    }
  }

  @Override
  public BackendField visitTracesBreakdown(QuerySpec spec) {
    return tracesField((TracesMetric) spec.getMetric());
  }

  @Override
  public BackendField visitLogsBreakdown(QuerySpec spec) {
    return logsField((LogsMetric) spec.getMetric());
  }

  @Override
  public BackendField visitMetricsBreakdown(QuerySpec spec) {
    switch ((MetricsMetric) spec.getMetric()) {
      case AVG:
        return BackendField.AVG_VALUE;
      case SUM:
        return BackendField.SUM_VALUE;
      case COUNT:
        return BackendField.COUNT;
      default:
        throw new IllegalArgumentException(
            "Unsupported metrics breakdown metric: " + spec.getMetric());
    }
  }

  private static BackendField tracesField(TracesMetric metric) {
    switch (metric) {
      case COUNT:
        return BackendField.COUNT;
      case AVG_DURATION:
        return BackendField.AVG_DURATION;
      case P50_DURATION:
        return BackendField.P50_DURATION;
      case P95_DURATION:
        return BackendField.P95_DURATION;
      case P99_DURATION:
        return BackendField.P99_DURATION;
      case ERROR_RATE:
        return BackendField.ERROR_RATE;
      default:
        throw new IllegalArgumentException("Unsupported traces metric: " + metric);
    }
  }

  private static BackendField logsField(LogsMetric metric) {
    if (metric == LogsMetric.COUNT) {
      return BackendField.COUNT;
    }
    throw new IllegalArgumentException("Unsupported logs metric: " + metric);
  }
}
