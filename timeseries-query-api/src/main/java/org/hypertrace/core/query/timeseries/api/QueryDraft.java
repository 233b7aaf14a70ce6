package org.hypertrace.core.query.timeseries.api;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A query as typed into the query editor: free-form aggregation, group-by and step tokens plus a
 * where clause such as {@code service.name = "checkout" AND env = prod}. Drafts are turned into a
 * {@link QuerySpec} before anything is executed.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class QueryDraft {
  String id;
  String name;
  @Builder.Default boolean enabled = true;
  @Builder.Default String dataSource = "traces";
  @Builder.Default String metricName = "";
  @Builder.Default String metricType = "gauge";
  @Builder.Default String whereClause = "";
  @Builder.Default String aggregation = "count";
  @Builder.Default String stepInterval = "";
  @Builder.Default boolean groupByEnabled = false;
  @Builder.Default String groupBy = "";
  @Builder.Default String legend = "";
}
