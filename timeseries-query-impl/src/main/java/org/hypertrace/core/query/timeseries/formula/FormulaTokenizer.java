package org.hypertrace.core.query.timeseries.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a formula into numbers, identifiers, operators and parentheses, scanning left to right.
 * Identifiers start with a letter and are upper-cased; numbers are decimals such as {@code 2},
 * {@code 0.5} or {@code .5}.
 */
public class FormulaTokenizer {

  private static final Pattern TOKEN_PATTERN =
      Pattern.compile("\\s*([A-Za-z][A-Za-z0-9_]*|\\d+(?:\\.\\d+)?|\\.\\d+|[()+\\-*/])");
  private static final int ERROR_PREFIX_LENGTH = 16;

  private FormulaTokenizer() {}

  public static List<FormulaToken> tokenize(String expression) {
    List<FormulaToken> tokens = new ArrayList<>();
    Matcher matcher = TOKEN_PATTERN.matcher(expression);
    int index = 0;
    while (index < expression.length()) {
      matcher.region(index, expression.length());
      if (!matcher.lookingAt()) {
        String remaining = expression.substring(index).trim();
        if (remaining.isEmpty()) {
          break;
        }
        throw new FormulaException(
            "Invalid token near: "
                + remaining.substring(0, Math.min(ERROR_PREFIX_LENGTH, remaining.length())));
      }
      index = matcher.end();
      tokens.add(toToken(matcher.group(1)));
    }
    return tokens;
  }

  private static FormulaToken toToken(String rawToken) {
    if (rawToken.equals("(")) {
      return FormulaToken.leftParen();
    }
    if (rawToken.equals(")")) {
      return FormulaToken.rightParen();
    }
    char first = rawToken.charAt(0);
    if (Character.isDigit(first) || first == '.') {
      return FormulaToken.number(Double.parseDouble(rawToken));
    }
    if (Character.isLetter(first)) {
      return FormulaToken.identifier(rawToken.toUpperCase(Locale.ROOT));
    }
    return FormulaOperator.fromSymbol(rawToken)
        .map(FormulaToken::operator)
        .orElseThrow(() -> new FormulaException("Invalid token near: " + rawToken));
  }
}
