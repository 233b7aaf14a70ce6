package org.hypertrace.core.query.timeseries.api;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Arithmetic over other queries, e.g. {@code A / B}. The name is the alias later formulas use to
 * reference this one and is matched case-insensitively.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FormulaDraft {
  String id;
  String name;
  @Builder.Default String expression = "";
  @Builder.Default String legend = "";
}
