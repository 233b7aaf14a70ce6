package org.hypertrace.core.query.timeseries;

import com.typesafe.config.Config;
import java.util.List;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class QueryEngineConfig {

  private static final String CONFIG_PATH_VALIDATION = "validation";
  private static final String CONFIG_PATH_FALLBACK = "fallback";
  private static final String CONFIG_PATH_EXECUTION = "execution";

  ValidationConfig validationConfig;
  FallbackConfig fallbackConfig;
  ExecutionConfig executionConfig;

  public QueryEngineConfig(Config config) {
    Config resolved = config.resolve();
    this.validationConfig = new ValidationConfig(resolved.getConfig(CONFIG_PATH_VALIDATION));
    this.fallbackConfig = new FallbackConfig(resolved.getConfig(CONFIG_PATH_FALLBACK));
    this.executionConfig = new ExecutionConfig(resolved.getConfig(CONFIG_PATH_EXECUTION));
  }

  public LimitValidationConfig getLimitValidationConfig() {
    return validationConfig.getLimitValidationConfig();
  }

  @Value
  @NonFinal
  public static class ValidationConfig {
    private static final String CONFIG_PATH_MAX_RANGE_SECONDS = "maxRangeSeconds";
    private static final String CONFIG_PATH_MAX_TIMESERIES_POINTS = "maxTimeseriesPoints";
    private static final String CONFIG_PATH_LIMIT = "limit";

    long maxRangeSeconds;
    long maxTimeseriesPoints;
    LimitValidationConfig limitValidationConfig;

    private ValidationConfig(Config config) {
      this.maxRangeSeconds = config.getLong(CONFIG_PATH_MAX_RANGE_SECONDS);
      this.maxTimeseriesPoints = config.getLong(CONFIG_PATH_MAX_TIMESERIES_POINTS);
      this.limitValidationConfig = new LimitValidationConfig(config.getConfig(CONFIG_PATH_LIMIT));
    }
  }

  @Value
  @NonFinal
  public static class LimitValidationConfig {
    private static final String CONFIG_PATH_MIN = "min";
    private static final String CONFIG_PATH_MAX = "max";
    private static final String CONFIG_PATH_MODE = "mode";
    int min;
    int max;
    LimitValidationMode mode;

    private LimitValidationConfig(Config config) {
      this.min = config.getInt(CONFIG_PATH_MIN);
      this.max = config.getInt(CONFIG_PATH_MAX);
      this.mode = config.getEnum(LimitValidationMode.class, CONFIG_PATH_MODE);
    }

    public enum LimitValidationMode {
      DISABLED,
      WARN,
      ERROR
    }
  }

  /** Empty range fallback defaults, overridable per request. */
  @Value
  @NonFinal
  public static class FallbackConfig {
    private static final String CONFIG_PATH_ENABLED = "enabled";
    private static final String CONFIG_PATH_WINDOW_SECONDS = "windowSeconds";
    private static final String CONFIG_PATH_MAX_RANGE_SECONDS = "maxRangeSeconds";
    boolean enabled;
    List<Long> windowSeconds;
    long maxRangeSeconds;

    private FallbackConfig(Config config) {
      this.enabled = config.getBoolean(CONFIG_PATH_ENABLED);
      this.windowSeconds = List.copyOf(config.getLongList(CONFIG_PATH_WINDOW_SECONDS));
      this.maxRangeSeconds = config.getLong(CONFIG_PATH_MAX_RANGE_SECONDS);
    }
  }

  @Value
  @NonFinal
  public static class ExecutionConfig {
    private static final String CONFIG_PATH_PARALLELISM = "parallelism";
    int parallelism;

    private ExecutionConfig(Config config) {
      this.parallelism = config.getInt(CONFIG_PATH_PARALLELISM);
    }
  }
}
