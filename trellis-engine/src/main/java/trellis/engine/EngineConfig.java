package trellis.engine;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;
import trellis.core.internal.executor.ExecutionSettings;

/**
 * Immutable engine configuration.
 *
 * <p>{@link #load()} layers, lowest precedence first: built-in defaults, a {@code
 * trellis.properties} resource on the classpath, JVM system properties.
 *
 * <table>
 *   <tr><th>Key</th><th>Default</th></tr>
 *   <tr><td>{@code trellis.workers}</td><td>available processors</td></tr>
 *   <tr><td>{@code trellis.timeout}</td><td>none</td></tr>
 *   <tr><td>{@code trellis.retries}</td><td>0</td></tr>
 *   <tr><td>{@code trellis.retry.timeouts}</td><td>false</td></tr>
 *   <tr><td>{@code trellis.retry.delay}</td><td>0</td></tr>
 *   <tr><td>{@code trellis.fail-fast}</td><td>false</td></tr>
 *   <tr><td>{@code trellis.sinks.discover}</td><td>false</td></tr>
 * </table>
 *
 * Durations are ISO-8601 ({@code PT5S}) or plain milliseconds.
 */
public final class EngineConfig {
  public static final String RESOURCE = "trellis.properties";

  public static final String WORKERS = "trellis.workers";
  public static final String TIMEOUT = "trellis.timeout";
  public static final String RETRIES = "trellis.retries";
  public static final String RETRY_TIMEOUTS = "trellis.retry.timeouts";
  public static final String RETRY_DELAY = "trellis.retry.delay";
  public static final String FAIL_FAST = "trellis.fail-fast";
  public static final String DISCOVER_SINKS = "trellis.sinks.discover";

  private final int workers;
  private final Duration defaultTimeout;
  private final int defaultRetries;
  private final boolean retryTimeouts;
  private final Duration retryDelay;
  private final boolean failFast;
  private final boolean discoverSinks;

  private EngineConfig(Builder builder) {
    this.workers = builder.workers;
    this.defaultTimeout = builder.defaultTimeout;
    this.defaultRetries = builder.defaultRetries;
    this.retryTimeouts = builder.retryTimeouts;
    this.retryDelay = builder.retryDelay;
    this.failFast = builder.failFast;
    this.discoverSinks = builder.discoverSinks;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static EngineConfig defaults() {
    return builder().build();
  }

  /** Defaults, then {@value #RESOURCE} from the classpath, then system properties. */
  public static EngineConfig load() {
    Properties layered = new Properties();
    try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in != null) {
        layered.load(in);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
    for (String key : System.getProperties().stringPropertyNames()) {
      if (key.startsWith("trellis.")) {
        layered.setProperty(key, System.getProperty(key));
      }
    }
    return fromProperties(layered);
  }

  /**
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static EngineConfig fromProperties(Properties properties) {
    Builder builder = builder();
    String value;
    if ((value = valueOf(properties, WORKERS)) != null) {
      builder.workers(parseInt(WORKERS, value));
    }
    if ((value = valueOf(properties, TIMEOUT)) != null) {
      builder.defaultTimeout(parseDuration(TIMEOUT, value));
    }
    if ((value = valueOf(properties, RETRIES)) != null) {
      builder.defaultRetries(parseInt(RETRIES, value));
    }
    if ((value = valueOf(properties, RETRY_TIMEOUTS)) != null) {
      builder.retryTimeouts(parseBoolean(RETRY_TIMEOUTS, value));
    }
    if ((value = valueOf(properties, RETRY_DELAY)) != null) {
      builder.retryDelay(parseDuration(RETRY_DELAY, value));
    }
    if ((value = valueOf(properties, FAIL_FAST)) != null) {
      builder.failFast(parseBoolean(FAIL_FAST, value));
    }
    if ((value = valueOf(properties, DISCOVER_SINKS)) != null) {
      builder.discoverSinks(parseBoolean(DISCOVER_SINKS, value));
    }
    return builder.build();
  }

  public int getWorkers() {
    return workers;
  }

  public Duration getDefaultTimeout() {
    return defaultTimeout;
  }

  public int getDefaultRetries() {
    return defaultRetries;
  }

  public boolean isRetryTimeouts() {
    return retryTimeouts;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public boolean isFailFast() {
    return failFast;
  }

  public boolean isDiscoverSinks() {
    return discoverSinks;
  }

  ExecutionSettings toExecutionSettings() {
    return new ExecutionSettings(defaultTimeout, defaultRetries, retryTimeouts, retryDelay);
  }

  public Builder toBuilder() {
    return builder()
        .workers(workers)
        .defaultTimeout(defaultTimeout)
        .defaultRetries(defaultRetries)
        .retryTimeouts(retryTimeouts)
        .retryDelay(retryDelay)
        .failFast(failFast)
        .discoverSinks(discoverSinks);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("workers", workers)
        .add("defaultTimeout", defaultTimeout)
        .add("defaultRetries", defaultRetries)
        .add("retryTimeouts", retryTimeouts)
        .add("retryDelay", retryDelay)
        .add("failFast", failFast)
        .add("discoverSinks", discoverSinks)
        .toString();
  }

  private static String valueOf(Properties properties, String key) {
    return Strings.emptyToNull(Strings.nullToEmpty(properties.getProperty(key)).trim());
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Invalid integer for %s: '%s'", key, value), e);
    }
  }

  private static boolean parseBoolean(String key, String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException(String.format("Invalid boolean for %s: '%s'", key, value));
  }

  @VisibleForTesting
  static Duration parseDuration(String key, String value) {
    if (value.chars().allMatch(Character::isDigit)) {
      return Duration.ofMillis(Long.parseLong(value));
    }
    try {
      return Duration.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(
          String.format("Invalid duration for %s: '%s'", key, value), e);
    }
  }

  public static final class Builder {
    private int workers = Runtime.getRuntime().availableProcessors();
    private Duration defaultTimeout = Duration.ZERO;
    private int defaultRetries;
    private boolean retryTimeouts;
    private Duration retryDelay = Duration.ZERO;
    private boolean failFast;
    private boolean discoverSinks;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder workers(int workers) {
      checkArgument(workers > 0, "workers must be positive, got %s", workers);
      this.workers = workers;
      return this;
    }

    /** Body timeout of tests declaring none; {@link Duration#ZERO} disables it. */
    @CanIgnoreReturnValue
    public Builder defaultTimeout(Duration defaultTimeout) {
      checkArgument(!defaultTimeout.isNegative(), "timeout must not be negative");
      this.defaultTimeout = defaultTimeout;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder defaultRetries(int defaultRetries) {
      checkArgument(defaultRetries >= 0, "retries must not be negative, got %s", defaultRetries);
      this.defaultRetries = defaultRetries;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder retryTimeouts(boolean retryTimeouts) {
      this.retryTimeouts = retryTimeouts;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder retryDelay(Duration retryDelay) {
      checkArgument(!retryDelay.isNegative(), "retry delay must not be negative");
      this.retryDelay = retryDelay;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder failFast(boolean failFast) {
      this.failFast = failFast;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder discoverSinks(boolean discoverSinks) {
      this.discoverSinks = discoverSinks;
      return this;
    }

    public EngineConfig build() {
      return new EngineConfig(this);
    }
  }
}
