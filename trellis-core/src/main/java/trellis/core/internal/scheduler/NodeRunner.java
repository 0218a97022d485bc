package trellis.core.internal.scheduler;

import trellis.api.result.Outcome;

/** Executes an admitted node on a worker thread, with all its attempts. */
@FunctionalInterface
public interface NodeRunner {

  Outcome run(ExecutionNode node);
}
