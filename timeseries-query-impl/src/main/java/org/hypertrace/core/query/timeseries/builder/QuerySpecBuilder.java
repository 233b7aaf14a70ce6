package org.hypertrace.core.query.timeseries.builder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import org.hypertrace.core.query.timeseries.api.GroupBy;
import org.hypertrace.core.query.timeseries.api.LogsMetric;
import org.hypertrace.core.query.timeseries.api.MetricType;
import org.hypertrace.core.query.timeseries.api.QueryDraft;
import org.hypertrace.core.query.timeseries.api.QueryFilters;
import org.hypertrace.core.query.timeseries.api.QueryKind;
import org.hypertrace.core.query.timeseries.api.QueryMetric;
import org.hypertrace.core.query.timeseries.api.QuerySource;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.builder.WhereClauseParser.ParsedWhereClause;

/**
 * Turns a {@link QueryDraft} into a timeseries {@link QuerySpec}. Unknown filter keys, malformed
 * clauses, unsupported group-by tokens and bad step intervals only produce warnings; an unsupported
 * aggregation, missing metric identity or an attribute grouping without attribute key fail the
 * build.
 */
@Singleton
public class QuerySpecBuilder {

  private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "y");
  private static final Set<String> FALSE_VALUES = Set.of("0", "false", "no", "n");
  private static final String ATTRIBUTE_PREFIX = "attr.";

  public BuildSpecResult buildTimeseriesQuerySpec(QueryDraft draft) {
    List<String> warnings = new ArrayList<>();
    ParsedWhereClause whereClause = WhereClauseParser.parse(draft.getWhereClause());
    warnings.addAll(whereClause.getWarnings());

    Optional<Integer> bucketSeconds = StepIntervalParser.parseBucketSeconds(draft.getStepInterval());
    if (!isBlank(draft.getStepInterval()) && bucketSeconds.isEmpty()) {
      warnings.add("Invalid step interval ignored; auto interval will be used");
    }

    Optional<QuerySource> source = QuerySource.fromValue(draft.getDataSource());
    if (source.isEmpty()) {
      return BuildSpecResult.failure("Unsupported data source: " + draft.getDataSource(), warnings);
    }
    switch (source.get()) {
      case TRACES:
        return buildTracesSpec(draft, whereClause, bucketSeconds.orElse(null), warnings);
      case LOGS:
        return buildLogsSpec(draft, whereClause, bucketSeconds.orElse(null), warnings);
      case METRICS:
        return buildMetricsSpec(draft, whereClause, bucketSeconds.orElse(null), warnings);
      default:
        throw new IllegalStateException("Unknown query source: " + source.get());
    }
  }

  private BuildSpecResult buildTracesSpec(
      QueryDraft draft, ParsedWhereClause whereClause, Integer bucketSeconds, List<String> warnings) {
    Optional<QueryMetric> metric = QuerySource.TRACES.findMetric(draft.getAggregation());
    if (metric.isEmpty()) {
      return BuildSpecResult.failure(
          "Unsupported traces metric: " + draft.getAggregation(), warnings);
    }

    QueryFilters.QueryFiltersBuilder filters = QueryFilters.builder();
    String attributeKey = null;
    for (WhereClause clause : whereClause.getClauses()) {
      String key = clause.getKey();
      String value = clause.getValue();
      if (key.equals("service") || key.equals("service.name")) {
        filters.serviceName(value);
      } else if (key.equals("span") || key.equals("span.name")) {
        filters.spanName(value);
      } else if (key.equals("deployment.environment")
          || key.equals("environment")
          || key.equals("env")) {
        filters.environments(splitCsv(value));
      } else if (key.equals("deployment.commit_sha") || key.equals("commit_sha")) {
        filters.commitShas(splitCsv(value));
      } else if (key.equals("root_only") || key.equals("root.only")) {
        Optional<Boolean> rootOnly = toBoolean(value);
        if (rootOnly.isPresent()) {
          filters.rootSpansOnly(rootOnly.get());
        } else {
          warnings.add("Invalid root_only value ignored: " + value);
        }
      } else if (key.startsWith(ATTRIBUTE_PREFIX)) {
        if (isBlank(attributeKey)) {
          attributeKey = key.substring(ATTRIBUTE_PREFIX.length());
          filters.attributeKey(attributeKey).attributeValue(value);
        } else {
          warnings.add("Multiple attr.* filters found; only " + attributeKey + " is used");
        }
      } else {
        warnings.add("Unsupported traces filter ignored: " + key);
      }
    }

    GroupBy groupBy = null;
    Optional<String> token = groupByToken(draft);
    if (token.isPresent()) {
      String value = token.get();
      if (value.equals("service") || value.equals("service.name")) {
        groupBy = GroupBy.SERVICE;
      } else if (value.equals("span") || value.equals("span.name")) {
        groupBy = GroupBy.SPAN_NAME;
      } else if (value.equals("status") || value.equals("status.code")) {
        groupBy = GroupBy.STATUS_CODE;
      } else if (value.equals("http.method")) {
        groupBy = GroupBy.HTTP_METHOD;
      } else if (value.equals("none") || value.equals("all")) {
        groupBy = GroupBy.NONE;
      } else if (value.startsWith(ATTRIBUTE_PREFIX)) {
        String groupAttributeKey = value.substring(ATTRIBUTE_PREFIX.length());
        if (groupAttributeKey.isEmpty()) {
          warnings.add("Invalid attr.* group by ignored");
        } else {
          groupBy = GroupBy.ATTRIBUTE;
          if (isBlank(attributeKey)) {
            attributeKey = groupAttributeKey;
            filters.attributeKey(attributeKey);
          }
        }
      } else {
        warnings.add("Unsupported traces group by ignored: " + draft.getGroupBy());
      }
    }

    if (groupBy == GroupBy.ATTRIBUTE && isBlank(attributeKey)) {
      return BuildSpecResult.failure(
          "groupBy=attribute requires attr.<key> in Group By or Where clause", warnings);
    }

    return BuildSpecResult.success(
        timeseriesSpec(QuerySource.TRACES, metric.get(), groupBy, filters.build(), bucketSeconds),
        warnings);
  }

  private BuildSpecResult buildLogsSpec(
      QueryDraft draft, ParsedWhereClause whereClause, Integer bucketSeconds, List<String> warnings) {
    if (!LogsMetric.COUNT.getValue().equals(draft.getAggregation())) {
      return BuildSpecResult.failure("Logs source currently supports only count metric", warnings);
    }

    QueryFilters.QueryFiltersBuilder filters = QueryFilters.builder();
    for (WhereClause clause : whereClause.getClauses()) {
      String key = clause.getKey();
      if (key.equals("service") || key.equals("service.name")) {
        filters.serviceName(clause.getValue());
      } else if (key.equals("severity")) {
        filters.severity(clause.getValue());
      } else {
        warnings.add("Unsupported logs filter ignored: " + key);
      }
    }

    GroupBy groupBy = null;
    Optional<String> token = groupByToken(draft);
    if (token.isPresent()) {
      String value = token.get();
      if (value.equals("service") || value.equals("service.name")) {
        groupBy = GroupBy.SERVICE;
      } else if (value.equals("severity")) {
        groupBy = GroupBy.SEVERITY;
      } else if (value.equals("none") || value.equals("all")) {
        groupBy = GroupBy.NONE;
      } else {
        warnings.add("Unsupported logs group by ignored: " + draft.getGroupBy());
      }
    }

    return BuildSpecResult.success(
        timeseriesSpec(QuerySource.LOGS, LogsMetric.COUNT, groupBy, filters.build(), bucketSeconds),
        warnings);
  }

  private BuildSpecResult buildMetricsSpec(
      QueryDraft draft, ParsedWhereClause whereClause, Integer bucketSeconds, List<String> warnings) {
    Optional<QueryMetric> metric = QuerySource.METRICS.findMetric(draft.getAggregation());
    if (metric.isEmpty()) {
      return BuildSpecResult.failure(
          "Unsupported metrics aggregation: " + draft.getAggregation(), warnings);
    }
    if (isBlank(draft.getMetricName()) || isBlank(draft.getMetricType())) {
      return BuildSpecResult.failure(
          "Metric source requires metric name and metric type", warnings);
    }

    QueryFilters.QueryFiltersBuilder filters =
        QueryFilters.builder().metricName(draft.getMetricName());
    Optional<MetricType> metricType = MetricType.fromValue(draft.getMetricType());
    for (WhereClause clause : whereClause.getClauses()) {
      String key = clause.getKey();
      if (key.equals("service") || key.equals("service.name")) {
        filters.serviceName(clause.getValue());
      } else if (key.equals("metric.type")) {
        Optional<MetricType> override = MetricType.fromValue(clause.getValue());
        if (override.isPresent()) {
          metricType = override;
        } else {
          warnings.add("Invalid metric.type ignored: " + clause.getValue());
        }
      } else {
        warnings.add("Unsupported metrics filter ignored: " + key);
      }
    }
    if (metricType.isEmpty()) {
      return BuildSpecResult.failure("Unsupported metric type: " + draft.getMetricType(), warnings);
    }
    filters.metricType(metricType.get());

    GroupBy groupBy = null;
    Optional<String> token = groupByToken(draft);
    if (token.isPresent()) {
      String value = token.get();
      if (value.equals("service") || value.equals("service.name")) {
        groupBy = GroupBy.SERVICE;
      } else if (value.equals("none") || value.equals("all")) {
        groupBy = GroupBy.NONE;
      } else {
        warnings.add("Unsupported metrics group by ignored: " + draft.getGroupBy());
      }
    }

    return BuildSpecResult.success(
        timeseriesSpec(QuerySource.METRICS, metric.get(), groupBy, filters.build(), bucketSeconds),
        warnings);
  }

  private static QuerySpec timeseriesSpec(
      QuerySource source,
      QueryMetric metric,
      GroupBy groupBy,
      QueryFilters filters,
      Integer bucketSeconds) {
    return QuerySpec.builder()
        .kind(QueryKind.TIMESERIES)
        .source(source)
        .metric(metric)
        .groupBy(groupBy)
        .filters(filters.isEmpty() ? null : filters)
        .bucketSeconds(bucketSeconds)
        .build();
  }

  /** Lower-cased group-by token, only when the draft's group-by is switched on and non-blank. */
  private static Optional<String> groupByToken(QueryDraft draft) {
    if (!draft.isGroupByEnabled() || isBlank(draft.getGroupBy())) {
      return Optional.empty();
    }
    return Optional.of(draft.getGroupBy().trim().toLowerCase(Locale.ROOT));
  }

  private static List<String> splitCsv(String value) {
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(item -> !item.isEmpty())
        .collect(Collectors.toUnmodifiableList());
  }

  private static Optional<Boolean> toBoolean(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (TRUE_VALUES.contains(normalized)) {
      return Optional.of(true);
    }
    if (FALSE_VALUES.contains(normalized)) {
      return Optional.of(false);
    }
    return Optional.empty();
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
