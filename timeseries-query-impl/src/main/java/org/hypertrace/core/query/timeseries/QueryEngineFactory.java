package org.hypertrace.core.query.timeseries;

import com.google.inject.Guice;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.hypertrace.core.query.timeseries.adapter.ExecutionAdapter;

public class QueryEngineFactory {
  public static final String QUERY_ENGINE_CONFIG = "service.config";

  private QueryEngineFactory() {}

  /**
   * @param config the engine section, i.e. the contents of {@value #QUERY_ENGINE_CONFIG}
   */
  public static TimeseriesQueryOrchestrator build(Config config, ExecutionAdapter adapter) {
    return build(config, adapter, new SimpleMeterRegistry());
  }

  public static TimeseriesQueryOrchestrator build(
      Config config, ExecutionAdapter adapter, MeterRegistry meterRegistry) {
    return Guice.createInjector(new QueryEngineModule(config, adapter, meterRegistry))
        .getInstance(TimeseriesQueryOrchestrator.class);
  }
}
