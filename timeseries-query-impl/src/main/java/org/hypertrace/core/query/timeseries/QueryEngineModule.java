package org.hypertrace.core.query.timeseries;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.inject.Singleton;
import org.hypertrace.core.query.timeseries.adapter.ExecutionAdapter;
import org.hypertrace.core.query.timeseries.validation.QueryValidationModule;

class QueryEngineModule extends AbstractModule {

  private static final String QUERY_THREAD_NAME_FORMAT = "timeseries-query-%d";

  private final QueryEngineConfig config;
  private final ExecutionAdapter executionAdapter;
  private final MeterRegistry meterRegistry;

  QueryEngineModule(Config config, ExecutionAdapter executionAdapter, MeterRegistry meterRegistry) {
    this.config = new QueryEngineConfig(config);
    this.executionAdapter = executionAdapter;
    this.meterRegistry = meterRegistry;
  }

  @Override
  protected void configure() {
    bind(QueryEngineConfig.class).toInstance(this.config);
    bind(ExecutionAdapter.class).toInstance(this.executionAdapter);
    bind(MeterRegistry.class).toInstance(this.meterRegistry);
    install(new QueryValidationModule());
  }

  /** Pool the per-query branches of a request run on, shut down by the orchestrator. */
  @Provides
  @Singleton
  ExecutorService provideQueryExecutor(QueryEngineConfig queryEngineConfig) {
    return Executors.newFixedThreadPool(
        queryEngineConfig.getExecutionConfig().getParallelism(),
        new ThreadFactoryBuilder().setNameFormat(QUERY_THREAD_NAME_FORMAT).setDaemon(true).build());
  }

  @Provides
  @Singleton
  Scheduler provideQueryScheduler(ExecutorService queryExecutor) {
    return Schedulers.from(queryExecutor);
  }
}
