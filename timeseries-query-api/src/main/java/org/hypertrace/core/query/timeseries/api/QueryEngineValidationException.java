package org.hypertrace.core.query.timeseries.api;

import java.util.List;

/** A request the caller has to fix: bad range, inconsistent filters or a query that is too costly. */
public class QueryEngineValidationException extends RuntimeException {

  private final List<String> details;

  public QueryEngineValidationException(String message, List<String> details) {
    super(message);
    this.details = List.copyOf(details);
  }

  public QueryEngineValidationException(String message, String detail) {
    this(message, List.of(detail));
  }

  public List<String> getDetails() {
    return details;
  }

  @Override
  public String toString() {
    return getMessage() + ": " + String.join("; ", details);
  }
}
