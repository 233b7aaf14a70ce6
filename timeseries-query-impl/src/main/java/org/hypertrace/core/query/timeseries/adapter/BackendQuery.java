package org.hypertrace.core.query.timeseries.adapter;

import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** A pipe plus its parameters in insertion order. Unset parameters are simply absent. */
@Value
@Builder
public class BackendQuery {
  @NonNull BackendPipe pipe;
  @Singular Map<String, String> parameters;
}
