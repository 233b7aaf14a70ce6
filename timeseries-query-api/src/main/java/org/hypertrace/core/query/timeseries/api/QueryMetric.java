package org.hypertrace.core.query.timeseries.api;

/** Aggregation requested from the backend; implemented by one enum per {@link QuerySource}. */
public interface QueryMetric {

  String getValue();

  QuerySource getSource();
}
