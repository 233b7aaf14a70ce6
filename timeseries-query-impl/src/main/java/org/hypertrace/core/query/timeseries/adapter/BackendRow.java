package org.hypertrace.core.query.timeseries.adapter;

import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A row as returned by the backend. {@code bucket} is either an {@link java.time.Instant} or the
 * backend's textual bucket label.
 */
@Value
@Builder
public class BackendRow {
  Object bucket;
  String groupName;
  String name;
  @Singular Map<BackendField, Double> values;

  /** Value of the field, {@link Double#NaN} when the row does not carry it. */
  public double getValue(BackendField field) {
    Double value = values.get(field);
    return value == null ? Double.NaN : value;
  }
}
