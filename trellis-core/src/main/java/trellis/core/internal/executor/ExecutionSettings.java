package trellis.core.internal.executor;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import trellis.api.descriptor.TestDescriptor;

/**
 * Engine-wide defaults applied to every attempt.
 *
 * @param defaultTimeout body timeout of tests declaring none, {@link Duration#ZERO} for none
 * @param defaultRetries retries of tests declaring no retry limit
 * @param retryTimeouts whether a timed out attempt may be retried
 * @param retryDelay pause between two attempts of a test
 */
public record ExecutionSettings(
    Duration defaultTimeout, int defaultRetries, boolean retryTimeouts, Duration retryDelay) {

  public static final ExecutionSettings DEFAULTS =
      new ExecutionSettings(Duration.ZERO, 0, false, Duration.ZERO);

  public ExecutionSettings {
    checkArgument(!defaultTimeout.isNegative(), "timeout must not be negative");
    checkArgument(defaultRetries >= 0, "retries must not be negative");
    checkArgument(!retryDelay.isNegative(), "retry delay must not be negative");
  }

  Duration timeoutOf(TestDescriptor test) {
    return test.getTimeout().orElse(defaultTimeout);
  }

  int retriesOf(TestDescriptor test) {
    return test.getRetryLimit().orElse(defaultRetries);
  }
}
