package org.hypertrace.core.query.timeseries.merge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import lombok.Value;
import org.hypertrace.core.query.timeseries.api.QueryRunResult;
import org.hypertrace.core.query.timeseries.api.TimeseriesPoint;

/**
 * Flattens query and formula results into chart rows. Every (query, group) pair becomes one column
 * whose name stays the same for the same stable key, and rows are densely filled with zeros.
 */
@Singleton
public class SeriesMerger {

  public static final String BUCKET_COLUMN = "bucket";

  private static final String ALL_GROUP = "all";
  private static final String ALL_GROUP_KEY = "__all__";
  private static final String UNNAMED_GROUP = "unnamed";

  /**
   * @param displayNameById preferred display name per query or formula id, falling back to the
   *     result's query name
   * @param suffix appended to every new series label, e.g. {@code " (prev)"}
   * @param usedNames names already taken by earlier passes of the same request; updated in place.
   *     {@value #BUCKET_COLUMN} is always taken.
   */
  public MergedSeries merge(
      List<QueryRunResult> results,
      Map<String, String> displayNameById,
      String suffix,
      Set<String> usedNames) {
    usedNames.add(BUCKET_COLUMN);
    Map<String, Map<String, Object>> rowsByBucket = new LinkedHashMap<>();
    Map<String, String> seriesNameByStableKey = new LinkedHashMap<>();
    List<String> seriesNames = new ArrayList<>();

    for (QueryRunResult result : results) {
      if (!result.isSuccess() || !result.hasSeriesData()) {
        continue;
      }
      String displayName =
          displayNameById.getOrDefault(result.getQueryId(), result.getQueryName());

      for (TimeseriesPoint point : result.getData()) {
        Map<String, Object> row =
            rowsByBucket.computeIfAbsent(point.getBucket(), SeriesMerger::newRow);
        for (Map.Entry<String, Double> entry : point.getSeries().entrySet()) {
          Double value = entry.getValue();
          if (value == null || !Double.isFinite(value)) {
            continue;
          }
          SeriesDescriptor descriptor = describe(result, displayName, entry.getKey());
          String stableKey = result.getQueryId() + "::" + descriptor.getStableGroupKey();
          String seriesName = seriesNameByStableKey.get(stableKey);
          if (seriesName == null) {
            seriesName = uniqueName(descriptor.getLabel() + suffix, usedNames);
            seriesNameByStableKey.put(stableKey, seriesName);
            seriesNames.add(seriesName);
          }
          row.put(seriesName, value);
        }
      }
    }

    rowsByBucket.values().forEach(row -> fillMissing(row, seriesNames));
    return new MergedSeries(rowsByBucket, seriesNameByStableKey, seriesNames);
  }

  /**
   * Unions rows of several passes by bucket. Later passes overwrite columns of earlier ones, every
   * row carries every series name, and rows are sorted by bucket label.
   */
  public List<Map<String, Object>> combineRows(List<MergedSeries> mergedSets) {
    Map<String, Map<String, Object>> rowsByBucket = new LinkedHashMap<>();
    Set<String> allSeriesNames = new LinkedHashSet<>();
    for (MergedSeries merged : mergedSets) {
      allSeriesNames.addAll(merged.getSeriesNames());
      merged
          .getRowsByBucket()
          .forEach(
              (bucket, row) ->
                  rowsByBucket.computeIfAbsent(bucket, SeriesMerger::newRow).putAll(row));
    }
    rowsByBucket.values().forEach(row -> fillMissing(row, allSeriesNames));
    return rowsByBucket.values().stream()
        .sorted(Comparator.comparing(row -> String.valueOf(row.get(BUCKET_COLUMN))))
        .collect(Collectors.toList());
  }

  private static SeriesDescriptor describe(
      QueryRunResult result, String displayName, String rawGroupName) {
    String groupName = rawGroupName.trim().isEmpty() ? UNNAMED_GROUP : rawGroupName.trim();
    boolean allGroup = groupName.toLowerCase(Locale.ROOT).equals(ALL_GROUP);
    boolean selfNamedFormula =
        QueryRunResult.FORMULA_SOURCE.equals(result.getSource()) && groupName.equals(displayName);
    if (allGroup || selfNamedFormula) {
      return new SeriesDescriptor(ALL_GROUP_KEY, displayName);
    }
    return new SeriesDescriptor(groupName, displayName + ": " + groupName);
  }

  private static String uniqueName(String base, Set<String> usedNames) {
    if (usedNames.add(base)) {
      return base;
    }
    int counter = 2;
    while (usedNames.contains(base + " (" + counter + ")")) {
      counter++;
    }
    String name = base + " (" + counter + ")";
    usedNames.add(name);
    return name;
  }

  private static Map<String, Object> newRow(String bucket) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put(BUCKET_COLUMN, bucket);
    return row;
  }

  private static void fillMissing(Map<String, Object> row, Iterable<String> seriesNames) {
    for (String seriesName : seriesNames) {
      if (!(row.get(seriesName) instanceof Number)) {
        row.put(seriesName, 0d);
      }
    }
  }

  @Value
  private static class SeriesDescriptor {
    String stableGroupKey;
    String label;
  }
}
