package org.hypertrace.core.query.timeseries.formula;

/** Division by zero for one set of operand values. Callers skip the bucket rather than fail. */
public class FormulaDivisionByZeroException extends FormulaException {
  public FormulaDivisionByZeroException() {
    super("Division by zero in formula");
  }
}
