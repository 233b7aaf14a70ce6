package org.hypertrace.core.query.timeseries.formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.hypertrace.core.query.timeseries.formula.FormulaToken.Type;

/**
 * Shunting-yard compilation of infix formulas to postfix. {@code *} and {@code /} bind tighter
 * than {@code +} and {@code -}; all four are left associative. A minus at the start, after an
 * operator or after an opening parenthesis negates: {@code -X} compiles as {@code 0 - X}.
 */
public class FormulaCompiler {

  private static final String MISMATCHED_PARENTHESES = "Mismatched parentheses in formula";

  private FormulaCompiler() {}

  public static CompiledFormula compile(String expression) {
    String trimmed = expression == null ? "" : expression.trim();
    if (trimmed.isEmpty()) {
      throw new FormulaException("Formula expression is empty");
    }

    List<FormulaToken> output = new ArrayList<>();
    Deque<FormulaToken> operatorStack = new ArrayDeque<>();
    Set<String> identifiers = new LinkedHashSet<>();
    FormulaToken previous = null;

    for (FormulaToken token : FormulaTokenizer.tokenize(trimmed)) {
      switch (token.getType()) {
        case NUMBER:
          output.add(token);
          break;
        case IDENTIFIER:
          identifiers.add(token.getIdentifier());
          output.add(token);
          break;
        case LEFT_PAREN:
          operatorStack.push(token);
          break;
        case RIGHT_PAREN:
          popUntilLeftParen(operatorStack, output);
          break;
        case OPERATOR:
          if (token.getOperator() == FormulaOperator.MINUS
              && (previous == null || previous.is(Type.OPERATOR) || previous.is(Type.LEFT_PAREN))) {
            output.add(FormulaToken.number(0));
          }
          while (!operatorStack.isEmpty()
              && operatorStack.peek().is(Type.OPERATOR)
              && operatorStack.peek().getOperator().getPrecedence()
                  >= token.getOperator().getPrecedence()) {
            output.add(operatorStack.pop());
          }
          operatorStack.push(token);
          break;
        default:
          throw new FormulaException("Invalid formula token");
      }
      previous = token;
    }

    while (!operatorStack.isEmpty()) {
      FormulaToken top = operatorStack.pop();
      if (!top.is(Type.OPERATOR)) {
        throw new FormulaException(MISMATCHED_PARENTHESES);
      }
      output.add(top);
    }
    return new CompiledFormula(List.copyOf(output), List.copyOf(identifiers));
  }

  private static void popUntilLeftParen(
      Deque<FormulaToken> operatorStack, List<FormulaToken> output) {
    while (!operatorStack.isEmpty()) {
      FormulaToken top = operatorStack.pop();
      if (top.is(Type.LEFT_PAREN)) {
        return;
      }
      output.add(top);
    }
    throw new FormulaException(MISMATCHED_PARENTHESES);
  }
}
