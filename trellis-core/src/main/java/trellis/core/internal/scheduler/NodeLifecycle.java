package trellis.core.internal.scheduler;

import trellis.api.result.Outcome;

/** Callbacks of the scheduler into the session owning it. */
public interface NodeLifecycle {

  /**
   * Called once per node, after its outcome is decided and before its terminal event is
   * published, whether the node ran or not. Closes the scopes the node was the last test of.
   *
   * @return the outcome to publish, possibly extended with scope closure failures
   */
  Outcome beforeTerminal(ExecutionNode node, Outcome outcome);

  /** Called once per node after its terminal event was published and its dependents released. */
  default void afterTerminal(ExecutionNode node, Outcome outcome) {}

  NodeLifecycle NONE = (node, outcome) -> outcome;
}
