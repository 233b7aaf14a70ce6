package org.hypertrace.core.query.timeseries.formula;

import java.util.Arrays;
import java.util.Optional;

public enum FormulaOperator {
  PLUS('+', 1),
  MINUS('-', 1),
  MULTIPLY('*', 2),
  DIVIDE('/', 2);

  private final char symbol;
  private final int precedence;

  FormulaOperator(char symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  public char getSymbol() {
    return symbol;
  }

  public int getPrecedence() {
    return precedence;
  }

  double apply(double left, double right) {
    switch (this) {
      case PLUS:
        return left + right;
      case MINUS:
        return left - right;
      case MULTIPLY:
        return left * right;
      case DIVIDE:
        if (right == 0) {
          throw new FormulaDivisionByZeroException();
        }
        return left / right;
      default:
        throw new IllegalStateException("Unknown operator: " + this);
    }
  }

  static Optional<FormulaOperator> fromSymbol(String symbol) {
    return Arrays.stream(values())
        .filter(operator -> symbol.length() == 1 && operator.symbol == symbol.charAt(0))
        .findFirst();
  }
}
