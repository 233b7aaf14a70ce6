package org.hypertrace.core.query.timeseries.formula;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FormulaToken {

  public enum Type {
    NUMBER,
    IDENTIFIER,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN
  }

  private static final FormulaToken LEFT_PAREN_TOKEN =
      new FormulaToken(Type.LEFT_PAREN, 0, null, null);
  private static final FormulaToken RIGHT_PAREN_TOKEN =
      new FormulaToken(Type.RIGHT_PAREN, 0, null, null);

  Type type;
  double number;
  String identifier;
  FormulaOperator operator;

  public static FormulaToken number(double value) {
    return new FormulaToken(Type.NUMBER, value, null, null);
  }

  public static FormulaToken identifier(String name) {
    return new FormulaToken(Type.IDENTIFIER, 0, name, null);
  }

  public static FormulaToken operator(FormulaOperator operator) {
    return new FormulaToken(Type.OPERATOR, 0, null, operator);
  }

  public static FormulaToken leftParen() {
    return LEFT_PAREN_TOKEN;
  }

  public static FormulaToken rightParen() {
    return RIGHT_PAREN_TOKEN;
  }

  public boolean is(Type type) {
    return this.type == type;
  }
}
