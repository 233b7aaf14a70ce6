package org.hypertrace.core.query.timeseries.fallback;

import io.reactivex.rxjava3.core.Single;
import java.util.List;
import org.hypertrace.core.query.timeseries.api.QuerySpec;
import org.hypertrace.core.query.timeseries.api.TimeWindow;
import org.hypertrace.core.query.timeseries.api.TimeseriesPoint;

/** Runs a spec, already resolved for the window, over that window. */
@FunctionalInterface
public interface WindowExecutor {
  Single<List<TimeseriesPoint>> execute(TimeWindow window, QuerySpec windowSpec);
}
