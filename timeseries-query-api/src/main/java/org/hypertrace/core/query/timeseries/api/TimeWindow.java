package org.hypertrace.core.query.timeseries.api;

import lombok.Value;

/** Half open {@code [startTime, endTime)} window, both bounds in {@code yyyy-MM-dd HH:mm:ss} UTC. */
@Value
public class TimeWindow {
  String startTime;
  String endTime;
  WindowKind kind;

  /** Key identifying the window by its bounds only. */
  public String boundsKey() {
    return startTime + "|" + endTime;
  }
}
