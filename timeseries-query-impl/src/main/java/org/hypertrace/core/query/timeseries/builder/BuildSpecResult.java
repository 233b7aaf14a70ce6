package org.hypertrace.core.query.timeseries.builder;

import java.util.List;
import java.util.Optional;
import lombok.Value;
import org.hypertrace.core.query.timeseries.api.QuerySpec;

/** Either a built spec or an error, plus the warnings collected on the way in both cases. */
@Value
public class BuildSpecResult {
  QuerySpec query;
  List<String> warnings;
  String error;

  static BuildSpecResult success(QuerySpec query, List<String> warnings) {
    return new BuildSpecResult(query, List.copyOf(warnings), null);
  }

  static BuildSpecResult failure(String error, List<String> warnings) {
    return new BuildSpecResult(null, List.copyOf(warnings), error);
  }

  public Optional<QuerySpec> getQueryIfPresent() {
    return Optional.ofNullable(query);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
