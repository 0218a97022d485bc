package trellis.engine;

import com.google.common.base.Stopwatch;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trellis.api.CancellationReason;
import trellis.api.DiscoveryException;
import trellis.api.TrellisException;
import trellis.api.descriptor.TestCatalog;
import trellis.api.descriptor.TestDescriptor;
import trellis.api.hook.HookBindings;
import trellis.api.hook.HookLevel;
import trellis.api.result.Outcome;
import trellis.api.result.RunSummary;
import trellis.api.result.TestEvent;
import trellis.core.internal.EventPublisher;
import trellis.core.internal.cancel.CancellationScope;
import trellis.core.internal.executor.TestExecutor;
import trellis.core.internal.graph.DependencyGraph;
import trellis.core.internal.graph.DependencyGraphBuilder;
import trellis.core.internal.hook.HookOrchestrator;
import trellis.core.internal.resource.DisposalFailure;
import trellis.core.internal.resource.SharedResourceManager;
import trellis.core.internal.scheduler.ExecutionNode;
import trellis.core.internal.scheduler.NodeLifecycle;
import trellis.core.internal.scheduler.TestScheduler;
import trellis.core.internal.scope.ScopeInstance;
import trellis.core.internal.scope.ScopeTracker;

/**
 * One run of a catalog. Owns every piece of per-run state: the root cancellation scope, the
 * shared resources, the hook scopes and the scheduler. Nothing outlives the session.
 */
final class EngineSession implements NodeLifecycle {
  private static final Logger log = LoggerFactory.getLogger(EngineSession.class);

  private final TestCatalog catalog;
  private final EngineConfig config;
  private final Executor workers;
  private final ScheduledExecutorService timers;
  private final EventPublisher sinks;

  private final CancellationScope root = CancellationScope.root();
  private final SharedResourceManager resources = new SharedResourceManager();
  private final HookOrchestrator hooks;
  private final Map<String, Outcome> outcomes = new ConcurrentHashMap<>();
  private final Queue<Throwable> unattributed = new ConcurrentLinkedQueue<>();

  private volatile ScopeTracker tracker;
  private volatile TestScheduler scheduler;
  private volatile boolean cancelRequested;

  EngineSession(
      TestCatalog catalog,
      EngineConfig config,
      Executor workers,
      ScheduledExecutorService timers,
      EventPublisher sinks) {
    this.catalog = catalog;
    this.config = config;
    this.workers = workers;
    this.timers = timers;
    this.sinks = sinks;
    this.hooks = new HookOrchestrator(catalog.hooks(), root, timers);
  }

  RunSummary run() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    DependencyGraph graph = new DependencyGraphBuilder().build(catalog);
    log.info(
        "Starting run: {} tests, {} excluded, {} workers",
        graph.tests().size(),
        graph.exclusions().size(),
        config.getWorkers());

    for (TestDescriptor test : graph.tests().values()) {
      publish(new TestEvent.Discovered(test.getId(), test));
    }
    for (Map.Entry<String, DiscoveryException> exclusion : graph.exclusions().entrySet()) {
      publish(
          new TestEvent.Terminal(
              exclusion.getKey(), new Outcome.Excluded(exclusion.getValue()), 0, Duration.ZERO));
    }

    tracker = new ScopeTracker(graph.included());
    TestExecutor executor =
        new TestExecutor(
            config.toExecutionSettings(), resources, hooks, root, timers, this::publish);
    scheduler =
        new TestScheduler(graph, config.getWorkers(), workers, executor, this, this::publish);
    try {
      Future<Void> completion = scheduler.start();
      if (cancelRequested) {
        scheduler.cancelPending();
      }
      awaitCompletion(completion);
    } finally {
      finish();
    }

    Map<String, Outcome> ordered = new LinkedHashMap<>();
    for (String id : graph.tests().keySet()) {
      ordered.put(id, outcomes.get(id));
    }
    RunSummary summary = RunSummary.of(ordered, unattributed, stopwatch.elapsed());
    log.info("Run finished: {}", summary);
    return summary;
  }

  void cancel() {
    cancelRequested = true;
    TestScheduler current = scheduler;
    if (current != null) {
      current.cancelPending();
    }
    if (root.cancel(CancellationReason.SHUTDOWN)) {
      log.info("Cancelling the session");
    }
  }

  @Override
  public Outcome beforeTerminal(ExecutionNode node, Outcome outcome) {
    List<Throwable> errors = new ArrayList<>();
    for (ScopeInstance scope : tracker.settle(node.getDescriptor())) {
      if (scope.kind() == ScopeInstance.Kind.UNIT) {
        errors.addAll(hooks.exitScope(HookLevel.CLASS, scope.id()));
      } else if (scope.kind() == ScopeInstance.Kind.MODULE) {
        errors.addAll(hooks.exitScope(HookLevel.MODULE, scope.id()));
      }
      resources.closeScope(scope);
    }
    if (errors.isEmpty()) {
      return outcome;
    }
    boolean attachable = outcome instanceof Outcome.Passed || outcome instanceof Outcome.Failed;
    if (node.wasExecuted() && attachable) {
      return outcome.withAdditionalFailures(errors);
    }
    unattributed.addAll(errors);
    return outcome;
  }

  @Override
  public void afterTerminal(ExecutionNode node, Outcome outcome) {
    if (config.isFailFast() && outcome instanceof Outcome.Failed && !cancelRequested) {
      log.info("Test [{}] failed, stopping the run", node.getId());
      cancel();
    }
  }

  private void publish(TestEvent event) {
    if (event instanceof TestEvent.Terminal terminal) {
      outcomes.put(terminal.testId(), terminal.outcome());
    }
    sinks.publish(event);
  }

  private void awaitCompletion(Future<Void> completion) {
    boolean interrupted = false;
    while (true) {
      try {
        completion.get();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
        cancel();
      } catch (ExecutionException e) {
        throw new TrellisException("The scheduler failed", e.getCause());
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void finish() {
    unattributed.addAll(hooks.exitScope(HookLevel.SESSION, HookBindings.SESSION_SCOPE));
    resources.close();
    for (DisposalFailure failure : resources.disposalFailures()) {
      unattributed.add(failure.asException());
    }
    root.close();
  }
}
