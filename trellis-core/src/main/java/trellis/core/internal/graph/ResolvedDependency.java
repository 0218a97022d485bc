package trellis.core.internal.graph;

import trellis.api.descriptor.DependencyRef;

/**
 * An edge of the dependency graph: the dependent waits for {@code testId}.
 *
 * @param ref the declaration that produced the edge; when several declarations produce the same
 *     edge, a gating one wins
 */
public record ResolvedDependency(String testId, DependencyRef ref) {

  public boolean gatesExecution() {
    return ref.gatesExecution();
  }
}
