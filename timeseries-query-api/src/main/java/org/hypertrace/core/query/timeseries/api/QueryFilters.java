package org.hypertrace.core.query.timeseries.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Optional filters narrowing a query. Which fields are meaningful depends on the query source, see
 * {@link #unsupportedFieldsFor(QuerySource)}. Unset fields are {@code null}.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryFilters {

  public static final QueryFilters EMPTY = QueryFilters.builder().build();

  String serviceName;
  String spanName;
  Boolean rootSpansOnly;
  List<String> environments;
  List<String> commitShas;
  String attributeKey;
  String attributeValue;
  String severity;
  String metricName;
  MetricType metricType;

  @JsonIgnore
  public boolean isEmpty() {
    return this.equals(EMPTY);
  }

  public boolean hasAttributeKey() {
    return attributeKey != null && !attributeKey.isEmpty();
  }

  /** Names of the fields that are set but cannot be applied to the given source. */
  public List<String> unsupportedFieldsFor(QuerySource source) {
    List<String> unsupported = new ArrayList<>();
    if (source != QuerySource.TRACES) {
      addIfSet(unsupported, "spanName", spanName);
      addIfSet(unsupported, "rootSpansOnly", rootSpansOnly);
      addIfSet(unsupported, "environments", environments);
      addIfSet(unsupported, "commitShas", commitShas);
      addIfSet(unsupported, "attributeKey", attributeKey);
      addIfSet(unsupported, "attributeValue", attributeValue);
    }
    if (source != QuerySource.LOGS) {
      addIfSet(unsupported, "severity", severity);
    }
    if (source != QuerySource.METRICS) {
      addIfSet(unsupported, "metricName", metricName);
      addIfSet(unsupported, "metricType", metricType);
    }
    return unsupported;
  }

  private static void addIfSet(List<String> names, String name, Object value) {
    if (value != null) {
      names.add(name);
    }
  }
}
