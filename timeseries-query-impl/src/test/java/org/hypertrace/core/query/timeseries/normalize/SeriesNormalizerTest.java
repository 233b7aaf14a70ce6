package org.hypertrace.core.query.timeseries.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.query.timeseries.adapter.BackendField;
import org.hypertrace.core.query.timeseries.adapter.BackendRow;
import org.hypertrace.core.query.timeseries.api.BreakdownItem;
import org.hypertrace.core.query.timeseries.api.TimeseriesPoint;
import org.junit.jupiter.api.Test;

class SeriesNormalizerTest {
  private final SeriesNormalizer normalizer = new SeriesNormalizer();

  @Test
  void fillsEveryBucketOfTheWindow() {
    List<BackendRow> rows =
        List.of(countRow("2026-01-01 00:00:00", "checkout", 2), countRow("2026-01-01 00:10:00", "checkout", 5));

    List<TimeseriesPoint> points =
        normalizer.groupTimeSeriesRows(
            rows,
            row -> row.getValue(BackendField.COUNT),
            new FillOptions(
                Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:15:00Z"), 300));

    assertEquals(
        List.of(
            new TimeseriesPoint("2026-01-01T00:00:00.000Z", Map.of("checkout", 2d)),
            new TimeseriesPoint("2026-01-01T00:05:00.000Z", Map.of()),
            new TimeseriesPoint("2026-01-01T00:10:00.000Z", Map.of("checkout", 5d)),
            new TimeseriesPoint("2026-01-01T00:15:00.000Z", Map.of())),
        points);
  }

  @Test
  void groupsRowsByBucketWithoutFill() {
    List<BackendRow> rows =
        List.of(
            countRow("2026-01-01 00:05:00", "cart", 1),
            countRow("2026-01-01 00:00:00", "cart", 3),
            countRow("2026-01-01 00:05:00", "checkout", 4),
            countRow("2026-01-01 00:05:00", "cart", 7),
            countRow("2026-01-01 00:00:00", null, 9));

    List<TimeseriesPoint> points =
        normalizer.groupTimeSeriesRows(rows, row -> row.getValue(BackendField.COUNT), null);

    assertEquals(
        List.of(
            new TimeseriesPoint("2026-01-01T00:05:00.000Z", Map.of("cart", 7d, "checkout", 4d)),
            new TimeseriesPoint("2026-01-01T00:00:00.000Z", Map.of("cart", 3d, "", 9d))),
        points);
  }

  @Test
  void appendsRowsOutsideTheTimeline() {
    List<BackendRow> rows = List.of(countRow("2026-01-01 02:00:00", "cart", 1));

    List<TimeseriesPoint> points =
        normalizer.groupTimeSeriesRows(
            rows,
            row -> row.getValue(BackendField.COUNT),
            new FillOptions(
                Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:01:00Z"), 60));

    assertEquals(3, points.size());
    assertEquals("2026-01-01T02:00:00.000Z", points.get(2).getBucket());
    assertEquals(Map.of("cart", 1d), points.get(2).getSeries());
  }

  @Test
  void convertsBreakdownRowsInOrder() {
    List<BackendRow> rows =
        List.of(
            BackendRow.builder().name("checkout").value(BackendField.COUNT, 12d).build(),
            BackendRow.builder().name("cart").build());

    assertEquals(
        List.of(new BreakdownItem("checkout", 12d), new BreakdownItem("cart", Double.NaN)),
        normalizer.toBreakdownItems(rows, row -> row.getValue(BackendField.COUNT)));
  }

  private static BackendRow countRow(String bucket, String group, double count) {
    return BackendRow.builder()
        .bucket(bucket)
        .groupName(group)
        .value(BackendField.COUNT, count)
        .build();
  }
}
