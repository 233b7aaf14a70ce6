package org.hypertrace.core.query.timeseries.api;

import lombok.Value;

@Value
public class BreakdownItem {
  String name;
  double value;
}
