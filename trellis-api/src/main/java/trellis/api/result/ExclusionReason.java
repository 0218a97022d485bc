package trellis.api.result;

/** Why a test was removed from the run before scheduling. */
public enum ExclusionReason {
  CYCLIC_DEPENDENCY,
  UNRESOLVED_DEPENDENCY,
  DUPLICATE_ID,
  ORDER_CONFLICT
}
