package trellis.core.internal.scheduler;

import com.google.common.base.MoreObjects;
import com.google.common.base.Stopwatch;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import trellis.api.descriptor.ConcurrencyConstraint;
import trellis.api.descriptor.TestDescriptor;
import trellis.api.result.Outcome;

/**
 * Runtime state of one schedulable test. Scheduling fields are guarded by the scheduler lock;
 * attempt bookkeeping is written by the worker running the node.
 */
public final class ExecutionNode {
  private final TestDescriptor descriptor;
  private final long sequence;
  private final AtomicInteger attempts = new AtomicInteger();
  private final Stopwatch stopwatch = Stopwatch.createUnstarted();

  // Guarded by the scheduler lock.
  NodeState state = NodeState.WAITING;
  int pendingPredecessors;
  String failedPredecessor;
  boolean cancelledPredecessor;

  private volatile Outcome outcome;

  /**
   * @param sequence registration order, breaks ties between tests of equal priority
   */
  public ExecutionNode(TestDescriptor descriptor, long sequence) {
    this.descriptor = descriptor;
    this.sequence = sequence;
  }

  public TestDescriptor getDescriptor() {
    return descriptor;
  }

  public String getId() {
    return descriptor.getId();
  }

  long sequence() {
    return sequence;
  }

  int priority() {
    return descriptor.getPriority();
  }

  ConcurrencyConstraint constraint() {
    return descriptor.getConstraint();
  }

  /** Records the start of attempt {@code attempt}; the first attempt starts the clock. */
  public synchronized void attemptStarted(int attempt) {
    attempts.set(attempt);
    if (!stopwatch.isRunning() && attempt == 1) {
      stopwatch.start();
    }
  }

  /**
   * @return the number of attempts started, 0 if the test never ran
   */
  public int getAttempts() {
    return attempts.get();
  }

  public boolean wasExecuted() {
    return attempts.get() > 0;
  }

  public synchronized Duration getElapsed() {
    return stopwatch.elapsed();
  }

  synchronized void stopClock() {
    if (stopwatch.isRunning()) {
      stopwatch.stop();
    }
  }

  public Optional<Outcome> getOutcome() {
    return Optional.ofNullable(outcome);
  }

  void setOutcome(Outcome outcome) {
    this.outcome = outcome;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", descriptor.getId())
        .add("sequence", sequence)
        .add("attempts", attempts.get())
        .toString();
  }
}
