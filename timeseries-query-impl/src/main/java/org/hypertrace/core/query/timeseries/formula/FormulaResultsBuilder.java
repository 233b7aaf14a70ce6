package org.hypertrace.core.query.timeseries.formula;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.timeseries.api.FormulaDraft;
import org.hypertrace.core.query.timeseries.api.QueryRunResult;
import org.hypertrace.core.query.timeseries.api.QueryRunStatus;
import org.hypertrace.core.query.timeseries.api.TimeseriesPoint;

/**
 * Evaluates formulas bucket by bucket over the totals of successful query results. Each query
 * total is the sum of its finite group values in a bucket. Formulas run in order, and a formula
 * that succeeds can be referenced by the ones after it.
 */
@Slf4j
@Singleton
public class FormulaResultsBuilder {

  private static final int MAX_WARNING_EXAMPLES = 3;

  public List<QueryRunResult> buildFormulaResults(
      List<FormulaDraft> formulas, List<QueryRunResult> queryResults) {
    if (formulas.isEmpty()) {
      return List.of();
    }

    Map<String, Map<String, Double>> seriesByAlias = new HashMap<>();
    for (QueryRunResult result : queryResults) {
      if (result.isSuccess()) {
        seriesByAlias.put(toAlias(result.getQueryName()), aggregateByBucket(result.getData()));
      }
    }
    TreeSet<String> allBuckets = new TreeSet<>();
    seriesByAlias.values().forEach(series -> allBuckets.addAll(series.keySet()));

    List<QueryRunResult> formulaResults = new ArrayList<>();
    for (FormulaDraft formula : formulas) {
      QueryRunResult result = buildFormulaResult(formula, seriesByAlias, allBuckets);
      if (result.isSuccess()) {
        seriesByAlias.put(toAlias(formula.getName()), aggregateByBucket(result.getData()));
      } else {
        log.debug("Formula {} failed: {}", formula.getName(), result.getError());
      }
      formulaResults.add(result);
    }
    return formulaResults;
  }

  private QueryRunResult buildFormulaResult(
      FormulaDraft formula,
      Map<String, Map<String, Double>> seriesByAlias,
      TreeSet<String> allBuckets) {
    CompiledFormula compiled;
    try {
      compiled = FormulaCompiler.compile(formula.getExpression());
    } catch (FormulaException e) {
      return failure(formula, e.getMessage(), List.of());
    }

    String selfAlias = toAlias(formula.getName());
    if (compiled.getIdentifiers().contains(selfAlias)) {
      String error = String.format("Formula %s cannot reference itself", formula.getName());
      return failure(formula, error, List.of());
    }

    List<String> missingReferences =
        compiled.getIdentifiers().stream()
            .filter(identifier -> !seriesByAlias.containsKey(identifier))
            .collect(Collectors.toList());
    if (!missingReferences.isEmpty()) {
      return failure(
          formula, "Unknown references: " + String.join(", ", missingReferences), List.of());
    }

    if (allBuckets.isEmpty()) {
      return failure(
          formula, "No successful query data available for formula execution", List.of());
    }

    List<String> warnings = new ArrayList<>();
    List<String> eligibleBuckets = eligibleBuckets(compiled, seriesByAlias, allBuckets, warnings);

    String seriesName =
        formula.getLegend() == null || formula.getLegend().trim().isEmpty()
            ? formula.getName()
            : formula.getLegend().trim();

    List<TimeseriesPoint> points = new ArrayList<>();
    List<String> divisionByZeroBuckets = new ArrayList<>();
    for (String bucket : eligibleBuckets) {
      Map<String, Double> variables = new HashMap<>();
      for (String identifier : compiled.getIdentifiers()) {
        variables.put(identifier, seriesByAlias.get(identifier).get(bucket));
      }
      try {
        double value = FormulaEvaluator.evaluate(compiled, variables);
        points.add(new TimeseriesPoint(bucket, Map.of(seriesName, value)));
      } catch (FormulaDivisionByZeroException e) {
        divisionByZeroBuckets.add(bucket);
      } catch (FormulaException e) {
        return failure(formula, e.getMessage() + " at bucket " + bucket, warnings);
      }
    }

    if (!divisionByZeroBuckets.isEmpty()) {
      warnings.add(formatBucketWarning(divisionByZeroBuckets, "division by zero in formula"));
    }

    if (points.isEmpty()) {
      String error =
          divisionByZeroBuckets.isEmpty()
              ? "Formula produced no valid buckets"
              : "Formula produced no valid buckets due to division by zero";
      return failure(formula, error, warnings);
    }

    return QueryRunResult.builder()
        .queryId(formula.getId())
        .queryName(formula.getName())
        .source(QueryRunResult.FORMULA_SOURCE)
        .status(QueryRunStatus.SUCCESS)
        .warnings(warnings)
        .data(points)
        .build();
  }

  /**
   * A formula without references runs on every known bucket. Otherwise only buckets where every
   * operand has a value are eligible; buckets that only some operands have are reported as a
   * warning.
   */
  private List<String> eligibleBuckets(
      CompiledFormula compiled,
      Map<String, Map<String, Double>> seriesByAlias,
      TreeSet<String> allBuckets,
      List<String> warnings) {
    if (compiled.getIdentifiers().isEmpty()) {
      return new ArrayList<>(allBuckets);
    }
    TreeSet<String> referencedBuckets = new TreeSet<>();
    compiled
        .getIdentifiers()
        .forEach(identifier -> referencedBuckets.addAll(seriesByAlias.get(identifier).keySet()));

    List<String> eligible = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    for (String bucket : referencedBuckets) {
      boolean complete =
          compiled.getIdentifiers().stream()
              .allMatch(identifier -> seriesByAlias.get(identifier).containsKey(bucket));
      if (complete) {
        eligible.add(bucket);
      } else {
        skipped.add(bucket);
      }
    }
    if (!skipped.isEmpty()) {
      warnings.add(formatBucketWarning(skipped, "missing values for formula operands"));
    }
    return eligible;
  }

  static String formatBucketWarning(List<String> buckets, String reason) {
    String summary =
        String.format(
            "Skipped %d %s due to %s",
            buckets.size(),
            buckets.size() == 1 ? "bucket" : "buckets",
            reason);
    if (buckets.size() > MAX_WARNING_EXAMPLES) {
      return String.format(
          "%s (examples: %s, +%d more)",
          summary,
          String.join(", ", buckets.subList(0, MAX_WARNING_EXAMPLES)),
          buckets.size() - MAX_WARNING_EXAMPLES);
    }
    String label = buckets.size() == 1 ? "bucket" : "buckets";
    return String.format("%s (%s: %s)", summary, label, String.join(", ", buckets));
  }

  /** Bucket totals, ignoring buckets without any group and treating non-finite values as zero. */
  static Map<String, Double> aggregateByBucket(List<TimeseriesPoint> points) {
    Map<String, Double> totals = new LinkedHashMap<>();
    for (TimeseriesPoint point : points) {
      if (!point.hasSeries()) {
        continue;
      }
      double total =
          point.getSeries().values().stream()
              .filter(value -> value != null && Double.isFinite(value))
              .mapToDouble(Double::doubleValue)
              .sum();
      totals.put(point.getBucket(), total);
    }
    return totals;
  }

  private static String toAlias(String name) {
    return name == null ? "" : name.toUpperCase(Locale.ROOT);
  }

  private static QueryRunResult failure(FormulaDraft formula, String error, List<String> warnings) {
    return QueryRunResult.failure(
        formula.getId(), formula.getName(), QueryRunResult.FORMULA_SOURCE, error, warnings);
  }
}
