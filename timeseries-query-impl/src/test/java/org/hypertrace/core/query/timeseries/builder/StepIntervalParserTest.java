package org.hypertrace.core.query.timeseries.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class StepIntervalParserTest {

  @Test
  void parsesUnitsToSeconds() {
    assertEquals(Optional.of(30), StepIntervalParser.parseBucketSeconds("30"));
    assertEquals(Optional.of(45), StepIntervalParser.parseBucketSeconds("45s"));
    assertEquals(Optional.of(300), StepIntervalParser.parseBucketSeconds("5m"));
    assertEquals(Optional.of(600), StepIntervalParser.parseBucketSeconds(" 10 Minutes "));
    assertEquals(Optional.of(3600), StepIntervalParser.parseBucketSeconds("1 hour"));
    assertEquals(Optional.of(7200), StepIntervalParser.parseBucketSeconds("2hrs"));
    assertEquals(Optional.of(172800), StepIntervalParser.parseBucketSeconds("2days"));
  }

  @Test
  void rejectsInvalidSteps() {
    assertTrue(StepIntervalParser.parseBucketSeconds("").isEmpty());
    assertTrue(StepIntervalParser.parseBucketSeconds(null).isEmpty());
    assertTrue(StepIntervalParser.parseBucketSeconds("0").isEmpty());
    assertTrue(StepIntervalParser.parseBucketSeconds("-5m").isEmpty());
    assertTrue(StepIntervalParser.parseBucketSeconds("1.5h").isEmpty());
    assertTrue(StepIntervalParser.parseBucketSeconds("5 weeks").isEmpty());
    assertTrue(StepIntervalParser.parseBucketSeconds("99999999999999999999").isEmpty());
    assertTrue(StepIntervalParser.parseBucketSeconds("100000 days").isEmpty());
  }
}
