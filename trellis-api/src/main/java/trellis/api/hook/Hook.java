package trellis.api.hook;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import trellis.api.Invocation;

/**
 * A named lifecycle callback.
 *
 * @param name display name used in failures and logs
 * @param invocation the callback
 * @param timeout independent timeout, {@link Duration#ZERO} for none
 */
public record Hook(String name, Invocation invocation, Duration timeout) {

  public Hook {
    checkArgument(name != null && !name.isEmpty(), "hook name must not be empty");
    Objects.requireNonNull(invocation, "invocation");
    timeout = timeout == null ? Duration.ZERO : timeout;
    checkArgument(!timeout.isNegative(), "hook timeout must not be negative");
  }

  public static Hook of(String name, Invocation invocation) {
    return new Hook(name, invocation, Duration.ZERO);
  }

  public static Hook sync(String name, Invocation.Body body) {
    return new Hook(name, Invocation.sync(body), Duration.ZERO);
  }

  public Hook withTimeout(Duration timeout) {
    return new Hook(name, invocation, timeout);
  }

  public Optional<Duration> getTimeout() {
    return timeout.isZero() ? Optional.empty() : Optional.of(timeout);
  }
}
