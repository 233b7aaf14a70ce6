package org.hypertrace.core.query.timeseries.adapter;

/** Numeric columns a backend row may carry. */
public enum BackendField {
  COUNT("count"),
  AVG_DURATION("avgDuration"),
  P50_DURATION("p50Duration"),
  P95_DURATION("p95Duration"),
  P99_DURATION("p99Duration"),
  ERROR_RATE("errorRate"),
  AVG_VALUE("avgValue"),
  SUM_VALUE("sumValue"),
  MIN_VALUE("minValue"),
  MAX_VALUE("maxValue"),
  DATA_POINT_COUNT("dataPointCount");

  private final String columnName;

  BackendField(String columnName) {
    this.columnName = columnName;
  }

  public String getColumnName() {
    return columnName;
  }
}
