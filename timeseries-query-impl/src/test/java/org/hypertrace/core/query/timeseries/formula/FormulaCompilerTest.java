package org.hypertrace.core.query.timeseries.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FormulaCompilerTest {

  @Test
  void respectsPrecedenceAndAssociativity() {
    assertEquals(7d, evaluate("1 + 2 * 3"));
    assertEquals(9d, evaluate("(1 + 2) * 3"));
    assertEquals(2d, evaluate("8 / 2 / 2"));
    assertEquals(-4d, evaluate("1 - 2 - 3"));
  }

  @Test
  void compilesUnaryMinusAsSubtractionFromZero() {
    assertEquals(-5d, evaluate("-5"));
    assertEquals(-1d, evaluate("1 + -2"));
    assertEquals(3d, evaluate("-(1 - 4)"));
  }

  @Test
  void collectsDistinctIdentifiersInOrder() {
    CompiledFormula compiled = FormulaCompiler.compile("(b + a) / B");
    assertEquals(List.of("B", "A"), compiled.getIdentifiers());
  }

  @Test
  void rejectsEmptyExpressions() {
    assertEquals(
        "Formula expression is empty",
        assertThrows(FormulaException.class, () -> FormulaCompiler.compile("   ")).getMessage());
    assertEquals(
        "Formula expression is empty",
        assertThrows(FormulaException.class, () -> FormulaCompiler.compile(null)).getMessage());
  }

  @Test
  void rejectsMismatchedParentheses() {
    assertEquals(
        "Mismatched parentheses in formula",
        assertThrows(FormulaException.class, () -> FormulaCompiler.compile("(A + B"))
            .getMessage());
    assertEquals(
        "Mismatched parentheses in formula",
        assertThrows(FormulaException.class, () -> FormulaCompiler.compile("A + B)"))
            .getMessage());
  }

  private static double evaluate(String expression) {
    return FormulaEvaluator.evaluate(FormulaCompiler.compile(expression), Map.of());
  }
}
