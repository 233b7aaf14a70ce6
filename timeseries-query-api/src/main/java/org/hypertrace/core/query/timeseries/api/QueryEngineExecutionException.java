package org.hypertrace.core.query.timeseries.api;

/** The execution adapter failed to serve a backend pipe. */
public class QueryEngineExecutionException extends RuntimeException {

  private final String causeTag;
  private final String pipe;

  public QueryEngineExecutionException(
      String message, String causeTag, String pipe, Throwable cause) {
    super(message, cause);
    this.causeTag = causeTag;
    this.pipe = pipe;
  }

  /** Simple name of the underlying failure, e.g. {@code TimeoutException}. */
  public String getCauseTag() {
    return causeTag;
  }

  public String getPipe() {
    return pipe;
  }
}
