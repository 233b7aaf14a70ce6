package org.hypertrace.core.query.timeseries.utils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/** Conversions between instants, the {@code yyyy-MM-dd HH:mm:ss} wire format and ISO buckets. */
public class TimeUtil {

  private static final DateTimeFormatter WIRE_FORMATTER =
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
          .withResolverStyle(ResolverStyle.STRICT)
          .withZone(ZoneOffset.UTC);

  private static final DateTimeFormatter ISO_BUCKET_FORMATTER =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private TimeUtil() {}

  public static Optional<Instant> parseWireTime(String value) {
    if (value == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          LocalDateTime.parse(value.trim(), WIRE_FORMATTER).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  public static String formatWireTime(Instant instant) {
    return WIRE_FORMATTER.format(instant);
  }

  /** ISO-8601 UTC with millisecond precision, e.g. {@code 2026-01-01T00:05:00.000Z}. */
  public static String formatIsoBucket(Instant instant) {
    return ISO_BUCKET_FORMATTER.format(instant);
  }
}
