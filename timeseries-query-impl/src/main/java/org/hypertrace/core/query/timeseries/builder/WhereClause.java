package org.hypertrace.core.query.timeseries.builder;

import lombok.Value;

/** One {@code key = value} clause. The key is lower-cased, the value trimmed and unquoted. */
@Value
public class WhereClause {
  String key;
  String value;
}
