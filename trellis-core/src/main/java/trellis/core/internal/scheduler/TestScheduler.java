package trellis.core.internal.scheduler;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trellis.api.descriptor.ConcurrencyConstraint;
import trellis.api.descriptor.ParallelLimit;
import trellis.api.descriptor.TestDescriptor;
import trellis.api.result.Outcome;
import trellis.api.result.SkipReason;
import trellis.api.result.TestEvent;
import trellis.core.internal.EventPublisher;
import trellis.core.internal.graph.DependencyGraph;
import trellis.core.internal.graph.ResolvedDependency;

/**
 * Dispatches the included tests of a {@link DependencyGraph} onto a bounded worker pool.
 *
 * <p>A test becomes ready once all its predecessors are terminal. A ready test is admitted, in
 * priority order then catalog order, as soon as:
 *
 * <ul>
 *   <li>fewer than {@code workerLimit} tests are in flight,
 *   <li>none of its exclusive keys is held,
 *   <li>its parallel limiter has room,
 *   <li>its order is the lowest unfinished order of its parallel group.
 * </ul>
 *
 * <p>A test whose gating predecessor did not pass is skipped, or cancelled when that predecessor
 * was cancelled.
 *
 * <p>All scheduling state lives behind one lock. Decisions are taken under the lock; tests are
 * run, and terminal events published, outside of it. The terminal event of a test is always
 * published before any of its dependents is released.
 */
@ThreadSafe
public final class TestScheduler {
  private static final Logger log = LoggerFactory.getLogger(TestScheduler.class);

  private static final Comparator<ExecutionNode> ADMISSION_ORDER =
      Comparator.comparingInt(ExecutionNode::priority)
          .reversed()
          .thenComparingLong(ExecutionNode::sequence);

  private final DependencyGraph graph;
  private final int workerLimit;
  private final Executor workers;
  private final NodeRunner runner;
  private final NodeLifecycle lifecycle;
  private final EventPublisher publisher;

  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  private final Map<String, ExecutionNode> nodes = new LinkedHashMap<>();

  @GuardedBy("lock")
  private final TreeSet<ExecutionNode> admission = new TreeSet<>(ADMISSION_ORDER);

  @GuardedBy("lock")
  private final Set<String> heldKeys = new HashSet<>();

  @GuardedBy("lock")
  private final Map<String, Integer> limiterUsage = new HashMap<>();

  /** Unsettled members per order, per parallel group. */
  @GuardedBy("lock")
  private final Map<String, TreeMap<Integer, Integer>> groups = new HashMap<>();

  @GuardedBy("lock")
  private int inFlight;

  /** Nodes whose outcome was decided without running them and whose terminal is pending. */
  @GuardedBy("lock")
  private int settling;

  @GuardedBy("lock")
  private boolean cancelled;

  @GuardedBy("lock")
  private boolean started;

  private final AtomicInteger unsettled;
  private final CompletableFuture<Void> completion = new CompletableFuture<>();

  public TestScheduler(
      DependencyGraph graph,
      int workerLimit,
      Executor workers,
      NodeRunner runner,
      NodeLifecycle lifecycle,
      EventPublisher publisher) {
    checkArgument(workerLimit > 0, "worker limit must be positive, got %s", workerLimit);
    this.graph = graph;
    this.workerLimit = workerLimit;
    this.workers = workers;
    this.runner = runner;
    this.lifecycle = lifecycle;
    this.publisher = publisher;

    long sequence = 0;
    for (TestDescriptor test : graph.included()) {
      ExecutionNode node = new ExecutionNode(test, sequence++);
      node.pendingPredecessors = graph.predecessors(test.getId()).size();
      nodes.put(test.getId(), node);
      if (test.getConstraint() instanceof ConcurrencyConstraint.ParallelGroup group) {
        groups
            .computeIfAbsent(group.name(), name -> new TreeMap<>())
            .merge(group.order(), 1, Integer::sum);
      }
    }
    this.unsettled = new AtomicInteger(nodes.size());
  }

  /**
   * Starts dispatching.
   *
   * @return a future completed once every included test published its terminal event
   */
  public CompletableFuture<Void> start() {
    Transition transition = new Transition();
    lock.lock();
    try {
      checkState(!started, "scheduler already started");
      started = true;
      log.debug("Scheduling {} tests on {} workers", nodes.size(), workerLimit);
      for (ExecutionNode node : nodes.values()) {
        if (node.pendingPredecessors == 0) {
          becomeReady(node, transition);
        }
      }
      admit(transition);
    } finally {
      lock.unlock();
    }
    if (unsettled.get() == 0) {
      completion.complete(null);
    }
    drive(transition);
    return completion;
  }

  /**
   * Settles every test not yet dispatched as {@link Outcome.Cancelled}. Tests in flight finish on
   * their own, through the cancellation of their scopes.
   */
  public void cancelPending() {
    Transition transition = new Transition();
    lock.lock();
    try {
      if (cancelled) {
        return;
      }
      cancelled = true;
      for (ExecutionNode node : nodes.values()) {
        if (node.state == NodeState.WAITING || node.state == NodeState.QUEUED) {
          admission.remove(node);
          settleWithoutRunning(node, Outcome.CANCELLED, transition);
        }
      }
      log.debug("Cancelled {} pending tests", transition.settlements.size());
    } finally {
      lock.unlock();
    }
    drive(transition);
  }

  public CompletableFuture<Void> completion() {
    return completion;
  }

  public ImmutableList<ExecutionNode> nodes() {
    lock.lock();
    try {
      return ImmutableList.copyOf(nodes.values());
    } finally {
      lock.unlock();
    }
  }

  private void drive(Transition transition) {
    Deque<Settlement> pending = new ArrayDeque<>(transition.settlements);
    List<ExecutionNode> dispatch = new ArrayList<>(transition.dispatch);
    while (!pending.isEmpty()) {
      Settlement settlement = pending.poll();
      Transition next = settle(settlement.node(), settlement.outcome(), false);
      pending.addAll(next.settlements);
      dispatch.addAll(next.dispatch);
    }
    for (ExecutionNode node : dispatch) {
      submit(node);
    }
  }

  private void submit(ExecutionNode node) {
    try {
      workers.execute(() -> run(node));
    } catch (RejectedExecutionException e) {
      log.warn("Worker pool rejected test [{}]", node.getId(), e);
      drive(settle(node, Outcome.CANCELLED, true));
    }
  }

  private void run(ExecutionNode node) {
    Outcome outcome;
    try {
      outcome = runner.run(node);
    } catch (Throwable e) {
      log.error("Unexpected failure while running test [{}]", node.getId(), e);
      outcome = Outcome.failed(e);
    }
    drive(settle(node, outcome, true));
  }

  /**
   * Publishes the terminal event of {@code node}, then releases its constraints and dependents.
   *
   * @param dispatched whether the node held a worker slot
   */
  private Transition settle(ExecutionNode node, Outcome outcome, boolean dispatched) {
    node.stopClock();
    Outcome terminal;
    try {
      terminal = lifecycle.beforeTerminal(node, outcome);
    } catch (RuntimeException e) {
      log.error("Failed to close the scopes of test [{}]", node.getId(), e);
      terminal = outcome.withAdditionalFailures(ImmutableList.of(e));
    }
    node.setOutcome(terminal);
    publisher.publish(
        new TestEvent.Terminal(node.getId(), terminal, node.getAttempts(), node.getElapsed()));

    Transition transition = new Transition();
    lock.lock();
    try {
      node.state = NodeState.TERMINAL;
      if (dispatched) {
        inFlight--;
        releaseConstraints(node);
      } else {
        settling--;
      }
      leaveGroup(node);
      for (ResolvedDependency edge : graph.successors(node.getId())) {
        ExecutionNode successor = nodes.get(edge.testId());
        if (successor.state != NodeState.WAITING) {
          continue;
        }
        if (edge.gatesExecution() && !terminal.satisfiesDependents()) {
          if (successor.failedPredecessor == null) {
            successor.failedPredecessor = node.getId();
          }
          successor.cancelledPredecessor |= terminal instanceof Outcome.Cancelled;
        }
        if (--successor.pendingPredecessors == 0) {
          becomeReady(successor, transition);
        }
      }
      admit(transition);
    } finally {
      lock.unlock();
    }
    try {
      lifecycle.afterTerminal(node, terminal);
    } catch (RuntimeException e) {
      log.error("Post-terminal callback failed for test [{}]", node.getId(), e);
    }
    if (unsettled.decrementAndGet() == 0) {
      completion.complete(null);
    }
    return transition;
  }

  @GuardedBy("lock")
  private void becomeReady(ExecutionNode node, Transition transition) {
    TestDescriptor test = node.getDescriptor();
    if (cancelled || node.cancelledPredecessor) {
      settleWithoutRunning(node, Outcome.CANCELLED, transition);
    } else if (node.failedPredecessor != null) {
      settleWithoutRunning(
          node,
          Outcome.skipped(
              SkipReason.DEPENDENCY_FAILED,
              String.format("Dependency [%s] did not pass", node.failedPredecessor)),
          transition);
    } else if (test.getSkipReason().isPresent()) {
      settleWithoutRunning(
          node, Outcome.skipped(SkipReason.STATIC, test.getSkipReason().get()), transition);
    } else {
      node.state = NodeState.QUEUED;
      admission.add(node);
    }
  }

  @GuardedBy("lock")
  private void settleWithoutRunning(ExecutionNode node, Outcome outcome, Transition transition) {
    node.state = NodeState.SETTLING;
    settling++;
    transition.settlements.add(new Settlement(node, outcome));
  }

  @GuardedBy("lock")
  private void admit(Transition transition) {
    if (cancelled) {
      return;
    }
    Iterator<ExecutionNode> queued = admission.iterator();
    while (inFlight < workerLimit && queued.hasNext()) {
      ExecutionNode node = queued.next();
      if (isAdmissible(node)) {
        queued.remove();
        acquireConstraints(node);
        node.state = NodeState.RUNNING;
        inFlight++;
        transition.dispatch.add(node);
        log.debug("Admitted test [{}], {} in flight", node.getId(), inFlight);
      }
    }
    if (inFlight == 0 && settling == 0 && !admission.isEmpty()) {
      log.warn(
          "Scheduling stalled: {} ready tests can never be admitted, skipping them",
          admission.size());
      for (ExecutionNode node : admission) {
        settleWithoutRunning(
            node,
            Outcome.skipped(
                SkipReason.SCHEDULING_CONFLICT,
                "The constraints of the test can never be satisfied"),
            transition);
      }
      admission.clear();
    }
  }

  @GuardedBy("lock")
  private boolean isAdmissible(ExecutionNode node) {
    ConcurrencyConstraint constraint = node.constraint();
    if (constraint instanceof ConcurrencyConstraint.ExclusiveKey exclusive) {
      for (String key : exclusive.keys()) {
        if (heldKeys.contains(key)) {
          return false;
        }
      }
    } else if (constraint instanceof ConcurrencyConstraint.ParallelGroup group) {
      TreeMap<Integer, Integer> orders = groups.get(group.name());
      if (orders == null || orders.firstKey() != group.order()) {
        return false;
      }
    }
    ParallelLimit limit = node.getDescriptor().getParallelLimit().orElse(null);
    return limit == null || limiterUsage.getOrDefault(limit.name(), 0) < limit.limit();
  }

  @GuardedBy("lock")
  private void acquireConstraints(ExecutionNode node) {
    if (node.constraint() instanceof ConcurrencyConstraint.ExclusiveKey exclusive) {
      heldKeys.addAll(exclusive.keys());
    }
    node.getDescriptor()
        .getParallelLimit()
        .ifPresent(limit -> limiterUsage.merge(limit.name(), 1, Integer::sum));
  }

  @GuardedBy("lock")
  private void releaseConstraints(ExecutionNode node) {
    if (node.constraint() instanceof ConcurrencyConstraint.ExclusiveKey exclusive) {
      heldKeys.removeAll(exclusive.keys());
    }
    node.getDescriptor()
        .getParallelLimit()
        .ifPresent(limit -> limiterUsage.computeIfPresent(limit.name(), (name, used) -> used - 1));
  }

  @GuardedBy("lock")
  private void leaveGroup(ExecutionNode node) {
    if (node.constraint() instanceof ConcurrencyConstraint.ParallelGroup group) {
      TreeMap<Integer, Integer> orders = groups.get(group.name());
      orders.computeIfPresent(group.order(), (order, left) -> left == 1 ? null : left - 1);
      if (orders.isEmpty()) {
        groups.remove(group.name());
      }
    }
  }

  private record Settlement(ExecutionNode node, Outcome outcome) {}

  private static final class Transition {
    final List<Settlement> settlements = new ArrayList<>();
    final List<ExecutionNode> dispatch = new ArrayList<>();
  }
}
