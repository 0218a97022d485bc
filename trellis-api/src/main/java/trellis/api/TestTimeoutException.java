package trellis.api;

import java.time.Duration;

public class TestTimeoutException extends TrellisException {
  private final Duration timeout;

  public TestTimeoutException(Duration timeout) {
    super(String.format("Execution did not complete within %d ms", timeout.toMillis()));
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
