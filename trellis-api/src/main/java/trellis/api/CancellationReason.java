package trellis.api;

public enum CancellationReason {
  /** The declared timeout of the running test or hook elapsed. */
  TIMEOUT,
  /** The whole session is being shut down. */
  SHUTDOWN
}
