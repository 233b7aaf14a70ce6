package org.hypertrace.core.query.timeseries.adapter;

import io.reactivex.rxjava3.core.Single;
import java.util.List;

/**
 * Handle to the analytical backend. Implementations are supplied by the embedding service and run
 * one fully parameterized pipe per call, scoped to the given tenant.
 *
 * <p>Timeseries pipes return rows carrying a bucket and a group name; breakdown pipes return rows
 * carrying a name. Backend failures are signalled through the returned {@link Single}.
 */
public interface ExecutionAdapter {
  Single<List<BackendRow>> execute(String tenantId, BackendQuery query);
}
