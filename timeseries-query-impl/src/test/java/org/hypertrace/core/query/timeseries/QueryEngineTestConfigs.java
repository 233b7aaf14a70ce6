package org.hypertrace.core.query.timeseries;

import static java.util.Objects.requireNonNull;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

public class QueryEngineTestConfigs {

  private QueryEngineTestConfigs() {}

  public static Config appConfig() {
    return ConfigFactory.parseURL(
        requireNonNull(
            QueryEngineTestConfigs.class.getClassLoader().getResource("application.conf")));
  }

  public static Config engineConfig() {
    return appConfig().getConfig(QueryEngineFactory.QUERY_ENGINE_CONFIG);
  }

  public static QueryEngineConfig queryEngineConfig() {
    return new QueryEngineConfig(engineConfig());
  }
}
