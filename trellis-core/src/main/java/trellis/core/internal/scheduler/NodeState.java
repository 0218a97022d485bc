package trellis.core.internal.scheduler;

public enum NodeState {
  /** Waiting for predecessors. */
  WAITING,
  /** Ready and waiting for admission. */
  QUEUED,
  RUNNING,
  /** Outcome decided, terminal event not yet published. */
  SETTLING,
  TERMINAL
}
