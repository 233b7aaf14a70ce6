package org.hypertrace.core.query.timeseries.adapter;

public enum BackendPipe {
  CUSTOM_TRACES_TIMESERIES("custom_traces_timeseries"),
  CUSTOM_LOGS_TIMESERIES("custom_logs_timeseries"),
  METRIC_TIME_SERIES_SUM("metric_time_series_sum"),
  METRIC_TIME_SERIES_GAUGE("metric_time_series_gauge"),
  METRIC_TIME_SERIES_HISTOGRAM("metric_time_series_histogram"),
  METRIC_TIME_SERIES_EXP_HISTOGRAM("metric_time_series_exp_histogram"),
  CUSTOM_TRACES_BREAKDOWN("custom_traces_breakdown"),
  CUSTOM_LOGS_BREAKDOWN("custom_logs_breakdown"),
  CUSTOM_METRICS_BREAKDOWN("custom_metrics_breakdown");

  private final String pipeName;

  BackendPipe(String pipeName) {
    this.pipeName = pipeName;
  }

  public String getPipeName() {
    return pipeName;
  }
}
