package org.hypertrace.core.query.timeseries.api;

/** One callback per source and kind pairing of a {@link QuerySpec}. */
public interface QuerySpecVisitor<T> {

  T visitTracesTimeseries(QuerySpec spec);

  T visitLogsTimeseries(QuerySpec spec);

  T visitMetricsTimeseries(QuerySpec spec);

  T visitTracesBreakdown(QuerySpec spec);

  T visitLogsBreakdown(QuerySpec spec);

  T visitMetricsBreakdown(QuerySpec spec);
}
