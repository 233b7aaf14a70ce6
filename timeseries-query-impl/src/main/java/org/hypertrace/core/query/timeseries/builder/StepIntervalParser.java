package org.hypertrace.core.query.timeseries.builder;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses step intervals like {@code 30}, {@code 5m}, {@code 1 hour} or {@code 2days} to seconds. */
public class StepIntervalParser {

  private static final Pattern STEP_PATTERN =
      Pattern.compile(
          "^(\\d+)\\s*(s|sec|secs|second|seconds|m|min|mins|minute|minutes"
              + "|h|hr|hrs|hour|hours|d|day|days)?$");

  private StepIntervalParser() {}

  /** Empty when the input is blank, malformed, not positive or too large for a bucket size. */
  public static Optional<Integer> parseBucketSeconds(String raw) {
    String trimmed = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }
    Matcher matcher = STEP_PATTERN.matcher(trimmed);
    if (!matcher.matches()) {
      return Optional.empty();
    }

    long amount;
    try {
      amount = Long.parseLong(matcher.group(1));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    if (amount <= 0) {
      return Optional.empty();
    }

    long seconds = unitOf(matcher.group(2)).toSeconds(amount);
    if (seconds > Integer.MAX_VALUE) {
      return Optional.empty();
    }
    return Optional.of((int) seconds);
  }

  private static TimeUnit unitOf(String unit) {
    if (unit == null || unit.startsWith("s")) {
      return TimeUnit.SECONDS;
    }
    if (unit.startsWith("m")) {
      return TimeUnit.MINUTES;
    }
    if (unit.startsWith("h")) {
      return TimeUnit.HOURS;
    }
    return TimeUnit.DAYS;
  }
}
