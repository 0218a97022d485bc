package trellis.core.internal.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static trellis.core.internal.Descriptors.catalog;
import static trellis.core.internal.Descriptors.test;

import com.google.common.util.concurrent.Uninterruptibles;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.InOrder;
import trellis.api.descriptor.ConcurrencyConstraint;
import trellis.api.descriptor.DependencyRef;
import trellis.api.descriptor.ParallelLimit;
import trellis.api.descriptor.TestCatalog;
import trellis.api.descriptor.TestDescriptor;
import trellis.api.result.Outcome;
import trellis.api.result.SkipReason;
import trellis.api.result.TestEvent;
import trellis.core.internal.EventPublisher;
import trellis.core.internal.graph.DependencyGraph;
import trellis.core.internal.graph.DependencyGraphBuilder;

@Timeout(20)
class TestSchedulerTest {
  private final ExecutorService workers = Executors.newFixedThreadPool(8);
  private final Map<String, Outcome> outcomes = new ConcurrentHashMap<>();
  private final List<String> trace = new CopyOnWriteArrayList<>();
  private final EventPublisher publisher =
      event -> {
        if (event instanceof TestEvent.Terminal terminal) {
          trace.add("terminal:" + terminal.testId());
          outcomes.put(terminal.testId(), terminal.outcome());
        }
      };

  @AfterEach
  void tearDown() {
    workers.shutdownNow();
  }

  @Test
  void emptyGraphCompletesImmediately() {
    TestScheduler scheduler = scheduler(catalog(), 4, node -> Outcome.PASSED);

    assertThat(scheduler.start()).isCompleted();
  }

  @Test
  @DisplayName("A dependent starts only after the terminal event of its predecessor")
  void dependentRunsAfterPredecessorTerminal() throws Exception {
    TestScheduler scheduler =
        scheduler(
            catalog(test("a"), test("b").dependsOn(DependencyRef.onTest("a"))),
            8,
            tracing(node -> Outcome.PASSED));

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(trace).containsExactly("run:a", "terminal:a", "run:b", "terminal:b");
    assertThat(outcomes).containsEntry("a", Outcome.PASSED).containsEntry("b", Outcome.PASSED);
  }

  @Test
  void failedPredecessorSkipsGatedDependentsOnly() throws Exception {
    TestScheduler scheduler =
        scheduler(
            catalog(
                test("a"),
                test("gated").dependsOn(DependencyRef.onTest("a")),
                test("transitive").dependsOn(DependencyRef.onTest("gated")),
                test("optional").dependsOn(DependencyRef.onTest("a").asOptional()),
                test("ordered").dependsOn(DependencyRef.onTest("a").proceedingOnFailure())),
            8,
            tracing(
                node ->
                    node.getId().equals("a")
                        ? Outcome.failed(new AssertionError("a"))
                        : Outcome.PASSED));

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(outcomes.get("gated"))
        .isEqualTo(Outcome.skipped(SkipReason.DEPENDENCY_FAILED, "Dependency [a] did not pass"));
    assertThat(outcomes.get("transitive"))
        .isEqualTo(
            Outcome.skipped(SkipReason.DEPENDENCY_FAILED, "Dependency [gated] did not pass"));
    assertThat(outcomes.get("optional")).isEqualTo(Outcome.PASSED);
    assertThat(outcomes.get("ordered")).isEqualTo(Outcome.PASSED);
    assertThat(trace).doesNotContain("run:gated", "run:transitive");
  }

  @Test
  void cancelledPredecessorCancelsItsDependents() throws Exception {
    TestScheduler scheduler =
        scheduler(
            catalog(test("a"), test("b").dependsOn(DependencyRef.onTest("a"))),
            8,
            tracing(node -> Outcome.CANCELLED));

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(outcomes)
        .containsEntry("a", Outcome.CANCELLED)
        .containsEntry("b", Outcome.CANCELLED);
    assertThat(trace).doesNotContain("run:b");
  }

  @Test
  void staticSkipNeverRuns() throws Exception {
    TestScheduler scheduler =
        scheduler(
            catalog(test("a").skip("not on this platform"), test("b")),
            8,
            tracing(node -> Outcome.PASSED));

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(outcomes.get("a"))
        .isEqualTo(Outcome.skipped(SkipReason.STATIC, "not on this platform"));
    assertThat(trace).doesNotContain("run:a").contains("run:b");
  }

  @Test
  @DisplayName("Ten tests on one exclusive key never overlap on eight workers")
  void exclusiveKeyIsHeldByOneTestAtATime() throws Exception {
    List<TestDescriptor> tests = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      tests.add(test("db-" + i).constraint(ConcurrencyConstraint.exclusive("db")).build());
    }
    ConcurrencyProbe probe = new ConcurrencyProbe();
    TestScheduler scheduler = scheduler(TestCatalog.of(tests), 8, probe::run);

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(probe.max).hasValue(1);
    assertThat(outcomes)
        .hasSize(10)
        .allSatisfy((id, outcome) -> assertThat(outcome.isPassed()).isTrue());
  }

  @Test
  void disjointKeysRunInParallel() throws Exception {
    CountDownLatch both = new CountDownLatch(2);
    TestScheduler scheduler =
        scheduler(
            catalog(
                test("x").constraint(ConcurrencyConstraint.exclusive("x")),
                test("y").constraint(ConcurrencyConstraint.exclusive("y"))),
            8,
            node -> {
              both.countDown();
              return Uninterruptibles.awaitUninterruptibly(both, 5, TimeUnit.SECONDS)
                  ? Outcome.PASSED
                  : Outcome.failed(new AssertionError("ran alone"));
            });

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(outcomes.values()).containsOnly(Outcome.PASSED);
  }

  @Test
  void inFlightTestsNeverExceedTheWorkerLimit() throws Exception {
    List<TestDescriptor> tests = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      tests.add(test("t-" + i).build());
    }
    ConcurrencyProbe probe = new ConcurrencyProbe();
    TestScheduler scheduler = scheduler(TestCatalog.of(tests), 3, probe::run);

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(probe.max.get()).isBetween(1, 3);
    assertThat(outcomes).hasSize(20);
  }

  @Test
  void parallelLimitCapsTestsSharingTheLimiter() throws Exception {
    List<TestDescriptor> tests = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      tests.add(test("api-" + i).parallelLimit(new ParallelLimit("api", 2)).build());
    }
    ConcurrencyProbe probe = new ConcurrencyProbe();
    TestScheduler scheduler = scheduler(TestCatalog.of(tests), 8, probe::run);

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(probe.max.get()).isBetween(1, 2);
  }

  @Test
  void parallelGroupRunsOrdersInSequence() throws Exception {
    TestScheduler scheduler =
        scheduler(
            catalog(
                test("late").constraint(ConcurrencyConstraint.group("migrations", 2)),
                test("early-1").constraint(ConcurrencyConstraint.group("migrations", 1)),
                test("early-2").constraint(ConcurrencyConstraint.group("migrations", 1))),
            8,
            tracing(node -> Outcome.PASSED));

    scheduler.start().get(10, TimeUnit.SECONDS);

    int late = trace.indexOf("run:late");
    assertThat(late).isGreaterThan(trace.indexOf("terminal:early-1"));
    assertThat(late).isGreaterThan(trace.indexOf("terminal:early-2"));
  }

  @Test
  void higherPriorityIsAdmittedFirst() throws Exception {
    TestScheduler scheduler =
        scheduler(
            catalog(test("low"), test("high").priority(10), test("mid").priority(5)),
            1,
            tracing(node -> Outcome.PASSED));

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(trace)
        .containsExactly(
            "run:high", "terminal:high", "run:mid", "terminal:mid", "run:low", "terminal:low");
  }

  @Test
  void unsatisfiableConstraintsAreSkippedInsteadOfHanging() throws Exception {
    // c waits for d, d waits for its group predecessor a, a waits for c.
    TestScheduler scheduler =
        scheduler(
            catalog(
                test("a")
                    .constraint(ConcurrencyConstraint.group("g", 1))
                    .dependsOn(DependencyRef.onTest("c")),
                test("c")
                    .constraint(ConcurrencyConstraint.group("h", 1))
                    .dependsOn(DependencyRef.onTest("d")),
                test("d").constraint(ConcurrencyConstraint.group("g", 2))),
            8,
            tracing(node -> Outcome.PASSED));

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(outcomes.get("d"))
        .isInstanceOfSatisfying(
            Outcome.Skipped.class,
            skipped -> assertThat(skipped.reason()).isEqualTo(SkipReason.SCHEDULING_CONFLICT));
    assertThat(outcomes.get("c"))
        .isEqualTo(Outcome.skipped(SkipReason.DEPENDENCY_FAILED, "Dependency [d] did not pass"));
    assertThat(outcomes.get("a"))
        .isEqualTo(Outcome.skipped(SkipReason.DEPENDENCY_FAILED, "Dependency [c] did not pass"));
    assertThat(trace).noneMatch(entry -> entry.startsWith("run:"));
  }

  @Test
  void cancelPendingSettlesUndispatchedTestsAsCancelled() throws Exception {
    CountDownLatch running = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    TestScheduler scheduler =
        scheduler(
            catalog(
                test("first"),
                test("second").dependsOn(DependencyRef.onTest("first")),
                test("third")),
            1,
            node -> {
              if (node.getId().equals("first")) {
                running.countDown();
                Uninterruptibles.awaitUninterruptibly(release);
              }
              return Outcome.PASSED;
            });

    scheduler.start();
    running.await();
    scheduler.cancelPending();
    release.countDown();
    scheduler.completion().get(10, TimeUnit.SECONDS);

    assertThat(outcomes)
        .containsEntry("first", Outcome.PASSED)
        .containsEntry("second", Outcome.CANCELLED)
        .containsEntry("third", Outcome.CANCELLED);
  }

  @Test
  void rejectedDispatchSettlesAsCancelled() throws Exception {
    DependencyGraph graph = new DependencyGraphBuilder().build(catalog(test("a")));
    TestScheduler scheduler =
        new TestScheduler(
            graph,
            4,
            task -> {
              throw new RejectedExecutionException("pool is shut down");
            },
            node -> Outcome.PASSED,
            NodeLifecycle.NONE,
            publisher);

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(outcomes).containsEntry("a", Outcome.CANCELLED);
  }

  @Test
  void lifecycleFailureIsAttachedToTheOutcome() throws Exception {
    IllegalStateException closeFailure = new IllegalStateException("scope close failed");
    DependencyGraph graph = new DependencyGraphBuilder().build(catalog(test("a")));
    TestScheduler scheduler =
        new TestScheduler(
            graph,
            4,
            workers,
            node -> Outcome.PASSED,
            (node, outcome) -> {
              throw closeFailure;
            },
            publisher);

    scheduler.start().get(10, TimeUnit.SECONDS);

    assertThat(outcomes.get("a"))
        .isInstanceOfSatisfying(
            Outcome.Failed.class,
            failed -> assertThat(failed.causes()).containsExactly(closeFailure));
  }

  @Test
  void terminalEventsArePublishedInDependencyOrder() throws Exception {
    EventPublisher events = mock(EventPublisher.class);
    DependencyGraph graph =
        new DependencyGraphBuilder()
            .build(
                catalog(
                    test("c").dependsOn(DependencyRef.onTest("b")),
                    test("b").dependsOn(DependencyRef.onTest("a")),
                    test("a")));
    TestScheduler scheduler =
        new TestScheduler(graph, 8, workers, node -> Outcome.PASSED, NodeLifecycle.NONE, events);

    scheduler.start().get(10, TimeUnit.SECONDS);

    InOrder order = inOrder(events);
    order.verify(events).publish(argThat(event -> terminalOf(event, "a")));
    order.verify(events).publish(argThat(event -> terminalOf(event, "b")));
    order.verify(events).publish(argThat(event -> terminalOf(event, "c")));
    assertThat(scheduler.nodes()).allSatisfy(node -> assertThat(node.getAttempts()).isZero());
  }

  private static boolean terminalOf(TestEvent event, String id) {
    return event instanceof TestEvent.Terminal && event.testId().equals(id);
  }

  private TestScheduler scheduler(TestCatalog catalog, int workerLimit, NodeRunner runner) {
    DependencyGraph graph = new DependencyGraphBuilder().build(catalog);
    return new TestScheduler(graph, workerLimit, workers, runner, NodeLifecycle.NONE, publisher);
  }

  private NodeRunner tracing(NodeRunner runner) {
    return node -> {
      trace.add("run:" + node.getId());
      return runner.run(node);
    };
  }

  /** Body that records the highest number of concurrently running tests. */
  private static final class ConcurrencyProbe {
    final AtomicInteger current = new AtomicInteger();
    final AtomicInteger max = new AtomicInteger();

    Outcome run(ExecutionNode node) {
      max.accumulateAndGet(current.incrementAndGet(), Math::max);
      try {
        Thread.sleep(20);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return Outcome.CANCELLED;
      } finally {
        current.decrementAndGet();
      }
      return Outcome.PASSED;
    }
  }

}
