package trellis.api;

import trellis.api.result.ExclusionReason;

/**
 * Raised at discovery time for a test that can never be scheduled. Such a test is reported with
 * an {@link trellis.api.result.Outcome.Excluded} outcome and is never dispatched.
 */
public class DiscoveryException extends TrellisException {
  private final ExclusionReason reason;

  public DiscoveryException(ExclusionReason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ExclusionReason getReason() {
    return reason;
  }
}
