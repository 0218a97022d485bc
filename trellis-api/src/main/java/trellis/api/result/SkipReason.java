package trellis.api.result;

public enum SkipReason {
  /** A gating predecessor did not pass. */
  DEPENDENCY_FAILED,
  /** The descriptor carries a static skip reason. */
  STATIC,
  /** The body threw {@link trellis.api.TestSkippedException}. */
  DYNAMIC,
  /** The remaining tests could never be admitted by the scheduler. */
  SCHEDULING_CONFLICT
}
