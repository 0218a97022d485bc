package trellis.api;

/**
 * Thrown from a test body to skip the running test. The test is reported as skipped and is not
 * retried.
 */
public class TestSkippedException extends TrellisException {

  public TestSkippedException(String reason) {
    super(reason);
  }
}
