package org.hypertrace.core.query.timeseries.builder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;

/**
 * Parses the editor's filter language: clauses of the form {@code key = "value"}, {@code key =
 * 'value'} or {@code key = token}, joined with {@code AND} in any letter case. Clauses that do not
 * fit are dropped with a warning.
 */
public class WhereClauseParser {

  private static final Pattern AND_SEPARATOR =
      Pattern.compile("\\s+AND\\s+", Pattern.CASE_INSENSITIVE);
  private static final Pattern CLAUSE_PATTERN =
      Pattern.compile("^([a-zA-Z0-9_.-]+)\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s]+))$");

  private WhereClauseParser() {}

  public static ParsedWhereClause parse(String expression) {
    String trimmed = expression == null ? "" : expression.trim();
    if (trimmed.isEmpty()) {
      return new ParsedWhereClause(List.of(), List.of());
    }

    List<WhereClause> clauses = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    Arrays.stream(AND_SEPARATOR.split(trimmed))
        .map(String::trim)
        .filter(part -> !part.isEmpty())
        .forEach(
            part -> {
              Matcher matcher = CLAUSE_PATTERN.matcher(part);
              if (!matcher.matches()) {
                warnings.add("Unsupported clause syntax ignored: " + part);
                return;
              }
              clauses.add(
                  new WhereClause(
                      matcher.group(1).trim().toLowerCase(Locale.ROOT), clauseValue(matcher)));
            });
    return new ParsedWhereClause(clauses, warnings);
  }

  private static String clauseValue(Matcher matcher) {
    for (int group = 2; group <= 4; group++) {
      if (matcher.group(group) != null) {
        return matcher.group(group).trim();
      }
    }
    return "";
  }

  @Value
  public static class ParsedWhereClause {
    List<WhereClause> clauses;
    List<String> warnings;
  }
}
