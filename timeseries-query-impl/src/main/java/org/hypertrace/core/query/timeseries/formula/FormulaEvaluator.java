package org.hypertrace.core.query.timeseries.formula;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/** Runs a postfix plan against one value per identifier. */
public class FormulaEvaluator {

  private static final String INVALID_EXPRESSION = "Invalid formula expression";

  private FormulaEvaluator() {}

  /**
   * @throws FormulaDivisionByZeroException when a divisor is zero
   * @throws FormulaException for unknown identifiers, malformed plans or non-finite results
   */
  public static double evaluate(CompiledFormula formula, Map<String, Double> variableValues) {
    Deque<Double> stack = new ArrayDeque<>();
    for (FormulaToken token : formula.getPostfix()) {
      switch (token.getType()) {
        case NUMBER:
          stack.push(token.getNumber());
          break;
        case IDENTIFIER:
          Double value = variableValues.get(token.getIdentifier());
          if (value == null) {
            throw new FormulaException("Unknown reference: " + token.getIdentifier());
          }
          stack.push(value);
          break;
        case OPERATOR:
          if (stack.size() < 2) {
            throw new FormulaException(INVALID_EXPRESSION);
          }
          double right = stack.pop();
          double left = stack.pop();
          stack.push(token.getOperator().apply(left, right));
          break;
        default:
          throw new FormulaException("Invalid formula token");
      }
    }

    if (stack.size() != 1) {
      throw new FormulaException(INVALID_EXPRESSION);
    }
    double result = stack.pop();
    if (!Double.isFinite(result)) {
      throw new FormulaException("Formula result is not finite");
    }
    return result;
  }
}
