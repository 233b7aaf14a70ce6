package org.hypertrace.core.query.timeseries.formula;

/** A formula that cannot be tokenized, compiled or evaluated. */
public class FormulaException extends RuntimeException {
  public FormulaException(String message) {
    super(message);
  }
}
