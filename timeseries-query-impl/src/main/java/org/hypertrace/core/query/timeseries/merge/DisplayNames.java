package org.hypertrace.core.query.timeseries.merge;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.query.timeseries.api.FormulaDraft;
import org.hypertrace.core.query.timeseries.api.QueryDraft;

public class DisplayNames {

  private DisplayNames() {}

  /** Trimmed legend, else name, for every enabled query and every formula. */
  public static Map<String, String> byId(List<QueryDraft> queries, List<FormulaDraft> formulas) {
    Map<String, String> displayNameById = new HashMap<>();
    queries.stream()
        .filter(QueryDraft::isEnabled)
        .forEach(
            query ->
                displayNameById.put(
                    query.getId(), displayName(query.getLegend(), query.getName())));
    formulas.forEach(
        formula ->
            displayNameById.put(
                formula.getId(), displayName(formula.getLegend(), formula.getName())));
    return displayNameById;
  }

  private static String displayName(String legend, String name) {
    return legend == null || legend.trim().isEmpty() ? name : legend.trim();
  }
}
