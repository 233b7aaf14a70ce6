package org.hypertrace.core.query.timeseries.normalize;

import java.time.Instant;
import lombok.Value;

/** Window and bucket size whose full timeline a normalized series must cover. */
@Value
public class FillOptions {
  Instant startTime;
  Instant endTime;
  int bucketSeconds;
}
