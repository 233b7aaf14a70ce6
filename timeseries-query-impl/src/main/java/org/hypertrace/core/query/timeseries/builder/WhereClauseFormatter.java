package org.hypertrace.core.query.timeseries.builder;

import java.util.ArrayList;
import java.util.List;
import org.hypertrace.core.query.timeseries.api.QueryFilters;

/** Renders filters back into the where clause language understood by {@link WhereClauseParser}. */
public class WhereClauseFormatter {

  private WhereClauseFormatter() {}

  public static String format(QueryFilters filters) {
    if (filters == null) {
      return "";
    }
    List<String> clauses = new ArrayList<>();
    addQuoted(clauses, "service.name", filters.getServiceName());
    addQuoted(clauses, "span.name", filters.getSpanName());
    addQuoted(clauses, "severity", filters.getSeverity());
    if (Boolean.TRUE.equals(filters.getRootSpansOnly())) {
      clauses.add("root_only = true");
    }
    addQuoted(clauses, "deployment.environment", joinCsv(filters.getEnvironments()));
    addQuoted(clauses, "deployment.commit_sha", joinCsv(filters.getCommitShas()));
    if (filters.hasAttributeKey()
        && !filters.getAttributeKey().trim().isEmpty()
        && filters.getAttributeValue() != null) {
      clauses.add(
          String.format(
              "attr.%s = \"%s\"",
              filters.getAttributeKey().trim(), filters.getAttributeValue().trim()));
    }
    return String.join(" AND ", clauses);
  }

  private static void addQuoted(List<String> clauses, String key, String value) {
    if (value != null && !value.trim().isEmpty()) {
      clauses.add(String.format("%s = \"%s\"", key, value.trim()));
    }
  }

  private static String joinCsv(List<String> values) {
    return values == null ? null : String.join(",", values);
  }
}
