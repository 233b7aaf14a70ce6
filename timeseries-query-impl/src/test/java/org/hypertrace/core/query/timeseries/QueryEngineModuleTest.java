package org.hypertrace.core.query.timeseries;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.ExecutorService;
import org.hypertrace.core.query.timeseries.adapter.ExecutionAdapter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryEngineModuleTest {

  @Mock ExecutionAdapter mockAdapter;

  @Test
  void closingOrchestratorShutsDownQueryPool() {
    Injector injector =
        Guice.createInjector(
            new QueryEngineModule(
                QueryEngineTestConfigs.engineConfig(), this.mockAdapter, new SimpleMeterRegistry()));
    TimeseriesQueryOrchestrator orchestrator =
        injector.getInstance(TimeseriesQueryOrchestrator.class);
    ExecutorService queryExecutor = injector.getInstance(ExecutorService.class);

    assertSame(orchestrator, injector.getInstance(TimeseriesQueryOrchestrator.class));
    assertFalse(queryExecutor.isShutdown());

    orchestrator.close();

    assertTrue(queryExecutor.isShutdown());
  }
}
