package org.hypertrace.core.query.timeseries.bucket;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.hypertrace.core.query.timeseries.utils.TimeUtil;

/**
 * Bucket sizing and bucket timelines. Buckets are aligned to multiples of the bucket size since the
 * epoch and identified by their start instant rendered as an ISO-8601 UTC string.
 */
public class BucketMath {

  public static final int DEFAULT_BUCKET_SECONDS = 60;
  static final List<Integer> BUCKET_LADDER = List.of(60, 300, 900, 3600, 14400, 86400);
  static final int TARGET_POINTS = 40;

  private static final Pattern BACKEND_DATETIME_PATTERN =
      Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d{2}:\\d{2}:\\d{2})(\\.\\d+)?$");

  // zone-less labels are UTC
  private static final List<Function<String, Instant>> LABEL_PARSERS =
      List.of(
          value -> OffsetDateTime.parse(value).toInstant(),
          value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
          value -> LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC));

  private BucketMath() {}

  /**
   * Picks the smallest ladder step giving at most about 40 buckets over the range. Unparsable or
   * empty ranges get {@link #DEFAULT_BUCKET_SECONDS}.
   */
  public static int computeAutoBucketSeconds(String startTime, String endTime) {
    Optional<Instant> start = TimeUtil.parseWireTime(startTime);
    Optional<Instant> end = TimeUtil.parseWireTime(endTime);
    if (start.isEmpty() || end.isEmpty()) {
      return DEFAULT_BUCKET_SECONDS;
    }
    return computeAutoBucketSeconds(start.get(), end.get());
  }

  public static int computeAutoBucketSeconds(Instant start, Instant end) {
    if (start == null || end == null || !end.isAfter(start)) {
      return DEFAULT_BUCKET_SECONDS;
    }
    double rangeSeconds = Math.max(Duration.between(start, end).toMillis() / 1000d, 1);
    long raw = (long) Math.ceil(rangeSeconds / TARGET_POINTS);
    return BUCKET_LADDER.stream()
        .filter(step -> raw <= step)
        .findFirst()
        .orElse(BUCKET_LADDER.get(BUCKET_LADDER.size() - 1));
  }

  /** Every bucket from the floor of {@code start} to the floor of {@code end}, both inclusive. */
  public static List<String> buildBucketTimeline(
      String startTime, String endTime, int bucketSeconds) {
    Optional<Instant> start = TimeUtil.parseWireTime(startTime);
    Optional<Instant> end = TimeUtil.parseWireTime(endTime);
    if (start.isEmpty() || end.isEmpty()) {
      return List.of();
    }
    return buildBucketTimeline(start.get(), end.get(), bucketSeconds);
  }

  public static List<String> buildBucketTimeline(Instant start, Instant end, int bucketSeconds) {
    if (start == null || end == null || end.isBefore(start) || bucketSeconds <= 0) {
      return List.of();
    }
    long bucketMillis = bucketSeconds * 1000L;
    long first = floorToBucket(start.toEpochMilli(), bucketMillis);
    long last = floorToBucket(end.toEpochMilli(), bucketMillis);
    List<String> buckets = new ArrayList<>();
    for (long cursor = first; cursor <= last; cursor += bucketMillis) {
      buckets.add(TimeUtil.formatIsoBucket(Instant.ofEpochMilli(cursor)));
    }
    return buckets;
  }

  /**
   * Renders a backend bucket label as an ISO-8601 UTC string. Accepts instants, the backend's
   * {@code yyyy-MM-dd HH:mm:ss[.fraction]} form and ISO date-times. Anything else is returned
   * trimmed but otherwise untouched.
   */
  public static String normalizeBucketLabel(Object label) {
    if (label instanceof Instant) {
      return TimeUtil.formatIsoBucket((Instant) label);
    }
    String raw = String.valueOf(label).trim();
    return parseBucketLabel(raw).map(TimeUtil::formatIsoBucket).orElse(raw);
  }

  /** Moves a bucket label by {@code shift}. Unparsable labels are returned unchanged. */
  public static String shiftBucket(String label, Duration shift) {
    return parseBucketLabel(label.trim())
        .map(instant -> TimeUtil.formatIsoBucket(instant.plus(shift)))
        .orElse(label);
  }

  public static Optional<Instant> parseBucketLabel(String raw) {
    Matcher matcher = BACKEND_DATETIME_PATTERN.matcher(raw);
    String normalized =
        matcher.matches()
            ? matcher.group(1)
                + "T"
                + matcher.group(2)
                + (matcher.group(3) == null ? "" : matcher.group(3))
                + "Z"
            : raw;
    return LABEL_PARSERS.stream()
        .map(parser -> tryParse(parser, normalized))
        .flatMap(Optional::stream)
        .findFirst();
  }

  private static Optional<Instant> tryParse(Function<String, Instant> parser, String value) {
    try {
      return Optional.of(parser.apply(value));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static long floorToBucket(long epochMillis, long bucketMillis) {
    return Math.floorDiv(epochMillis, bucketMillis) * bucketMillis;
  }
}
