package trellis.core.internal.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static trellis.core.internal.Descriptors.test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import trellis.api.CancellationReason;
import trellis.api.HookException;
import trellis.api.Invocation;
import trellis.api.ResourceInitializationException;
import trellis.api.TestSkippedException;
import trellis.api.TestTimeoutException;
import trellis.api.descriptor.ResourceRequest;
import trellis.api.descriptor.SharingScope;
import trellis.api.descriptor.TestDescriptor;
import trellis.api.hook.Hook;
import trellis.api.hook.HookBindings;
import trellis.api.result.Outcome;
import trellis.api.result.SkipReason;
import trellis.api.result.TestEvent;
import trellis.core.internal.Descriptors;
import trellis.core.internal.cancel.CancellationScope;
import trellis.core.internal.hook.HookOrchestrator;
import trellis.core.internal.resource.SharedResourceManager;
import trellis.core.internal.scheduler.ExecutionNode;

@Timeout(20)
class TestExecutorTest {
  private final CancellationScope session = CancellationScope.root();
  private final ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor();
  private final SharedResourceManager resources = new SharedResourceManager();
  private final List<TestEvent> events = new CopyOnWriteArrayList<>();

  @AfterEach
  void tearDown() {
    timers.shutdownNow();
  }

  @Test
  void passingBodyRunsOnce() {
    ExecutionNode node = node(test("ok"));

    Outcome outcome = executor(ExecutionSettings.DEFAULTS).run(node);

    assertThat(outcome).isEqualTo(Outcome.PASSED);
    assertThat(node.getAttempts()).isEqualTo(1);
    assertThat(events).containsExactly(new TestEvent.Started("ok", 1));
  }

  @Test
  @DisplayName("A failing attempt is retried and every retry is announced")
  void retriesUntilTheBodyPasses() {
    AtomicInteger calls = new AtomicInteger();
    List<Integer> seenAttempts = new CopyOnWriteArrayList<>();
    ExecutionNode node =
        node(
            test("flaky")
                .retryLimit(3)
                .body(
                    Invocation.sync(
                        ctx -> {
                          seenAttempts.add(ctx.getAttempt());
                          if (calls.incrementAndGet() < 3) {
                            throw new AssertionError("attempt " + calls.get());
                          }
                        })));

    Outcome outcome = executor(ExecutionSettings.DEFAULTS).run(node);

    assertThat(outcome).isEqualTo(Outcome.PASSED);
    assertThat(seenAttempts).containsExactly(1, 2, 3);
    assertThat(node.getAttempts()).isEqualTo(3);
    assertThat(events)
        .filteredOn(TestEvent.Retrying.class::isInstance)
        .extracting(event -> ((TestEvent.Retrying) event).attempt())
        .containsExactly(2, 3);
    assertThat(events)
        .filteredOn(TestEvent.Retrying.class::isInstance)
        .first()
        .satisfies(
            event ->
                assertThat(((TestEvent.Retrying) event).previousCauses())
                    .singleElement()
                    .satisfies(cause -> assertThat(cause).hasMessage("attempt 1")));
  }

  @Test
  void exhaustedRetriesReportTheLastFailure() {
    AtomicInteger calls = new AtomicInteger();
    ExecutionNode node =
        node(
            test("broken")
                .body(
                    Invocation.sync(
                        ctx -> {
                          throw new AssertionError("call " + calls.incrementAndGet());
                        })));

    ExecutionSettings settings = new ExecutionSettings(Duration.ZERO, 2, false, Duration.ZERO);

    Outcome outcome = executor(settings).run(node);

    assertThat(outcome)
        .isInstanceOfSatisfying(
            Outcome.Failed.class,
            failed -> assertThat(failed.primaryCause()).hasMessage("call 3"));
    assertThat(node.getAttempts()).isEqualTo(3);
  }

  @Test
  void resourceFailureIsNeverRetried() {
    AtomicInteger created = new AtomicInteger();
    AtomicBoolean bodyRan = new AtomicBoolean();
    ExecutionNode node =
        node(
            test("needs-db")
                .retryLimit(3)
                .resource(
                    ResourceRequest.of(
                        "db",
                        SharingScope.GLOBAL,
                        () -> {
                          created.incrementAndGet();
                          throw new IllegalStateException("no database");
                        }))
                .body(Invocation.sync(ctx -> bodyRan.set(true))));

    Outcome outcome = executor(ExecutionSettings.DEFAULTS).run(node);

    assertThat(outcome)
        .isInstanceOfSatisfying(
            Outcome.Failed.class,
            failed ->
                assertThat(failed.primaryCause())
                    .isInstanceOf(ResourceInitializationException.class));
    assertThat(created).hasValue(1);
    assertThat(bodyRan).isFalse();
    assertThat(node.getAttempts()).isEqualTo(1);
  }

  @Test
  void resourcesAreVisibleToTheBodyAndReleasedAfterTheAttempt() {
    List<String> seen = new CopyOnWriteArrayList<>();
    ExecutionNode node =
        node(
            test("uses-db")
                .resource(ResourceRequest.of("db", SharingScope.PER_DECLARING_UNIT, () -> "conn"))
                .body(Invocation.sync(ctx -> seen.add(ctx.getResource("db", String.class)))));

    executor(ExecutionSettings.DEFAULTS).run(node);

    assertThat(seen).containsExactly("conn");
    assertThat(resources.liveHandles())
        .singleElement()
        .satisfies(handle -> assertThat(handle.getRefCount()).isZero());
  }

  @Test
  void timeoutIsNotRetriedByDefault() {
    ExecutionNode node =
        node(
            test("slow")
                .retryLimit(2)
                .timeout(Duration.ofMillis(50))
                .body(Invocation.sync(ctx -> Thread.sleep(10_000))));

    Outcome outcome = executor(ExecutionSettings.DEFAULTS).run(node);

    assertThat(outcome)
        .isInstanceOfSatisfying(
            Outcome.Failed.class,
            failed -> assertThat(failed.primaryCause()).isInstanceOf(TestTimeoutException.class));
    assertThat(node.getAttempts()).isEqualTo(1);
    assertThat(session.isCancelled()).isFalse();
  }

  @Test
  void timeoutIsRetriedWhenConfigured() {
    ExecutionNode node =
        node(test("slow").retryLimit(2).body(Invocation.sync(ctx -> Thread.sleep(10_000))));
    ExecutionSettings settings =
        new ExecutionSettings(Duration.ofMillis(50), 0, true, Duration.ZERO);

    Outcome outcome = executor(settings).run(node);

    assertThat(outcome).isInstanceOf(Outcome.Failed.class);
    assertThat(node.getAttempts()).isEqualTo(3);
  }

  @Test
  void bodyCanSkipItself() {
    ExecutionNode node =
        node(
            test("conditional")
                .retryLimit(2)
                .body(
                    Invocation.sync(
                        ctx -> {
                          throw new TestSkippedException("feature flag off");
                        })));

    Outcome outcome = executor(ExecutionSettings.DEFAULTS).run(node);

    assertThat(outcome).isEqualTo(Outcome.skipped(SkipReason.DYNAMIC, "feature flag off"));
    assertThat(node.getAttempts()).isEqualTo(1);
  }

  @Test
  @DisplayName("Exit hooks run after a failing body; the body error comes first")
  void bodyErrorPrecedesExitHookErrors() {
    AssertionError bodyError = new AssertionError("body");
    HookBindings bindings =
        HookBindings.builder()
            .afterTest(
                Descriptors.SUITE,
                Hook.sync(
                    "cleanup",
                    ctx -> {
                      throw new IllegalStateException("cleanup");
                    }))
            .build();
    ExecutionNode node =
        node(
            test("t")
                .body(
                    Invocation.sync(
                        ctx -> {
                          throw bodyError;
                        })));

    Outcome outcome = executor(ExecutionSettings.DEFAULTS, bindings).run(node);

    assertThat(outcome)
        .isInstanceOfSatisfying(
            Outcome.Failed.class,
            failed -> {
              assertThat(failed.causes()).hasSize(2);
              assertThat(failed.causes().get(0)).isSameAs(bodyError);
              assertThat(failed.causes().get(1))
                  .isInstanceOf(HookException.class)
                  .hasRootCauseMessage("cleanup");
            });
  }

  @Test
  void failingEntryHookSkipsTheBodyButNotTheExitHooks() {
    AtomicBoolean bodyRan = new AtomicBoolean();
    AtomicBoolean exitRan = new AtomicBoolean();
    HookBindings bindings =
        HookBindings.builder()
            .beforeTest(
                Descriptors.SUITE,
                Hook.sync(
                    "login",
                    ctx -> {
                      throw new IllegalStateException("login");
                    }))
            .afterTest(Descriptors.SUITE, Hook.sync("logout", ctx -> exitRan.set(true)))
            .build();
    ExecutionNode node = node(test("t").body(Invocation.sync(ctx -> bodyRan.set(true))));

    Outcome outcome = executor(ExecutionSettings.DEFAULTS, bindings).run(node);

    assertThat(bodyRan).isFalse();
    assertThat(exitRan).isTrue();
    assertThat(outcome)
        .isInstanceOfSatisfying(
            Outcome.Failed.class,
            failed ->
                assertThat(failed.primaryCause())
                    .isInstanceOf(HookException.class)
                    .hasRootCauseMessage("login"));
  }

  @Test
  void sharedEntryFailureFailsWithoutRetry() {
    AtomicInteger calls = new AtomicInteger();
    HookBindings bindings =
        HookBindings.builder()
            .beforeClass(
                Descriptors.SUITE,
                Hook.sync(
                    "seed",
                    ctx -> {
                      calls.incrementAndGet();
                      throw new IllegalStateException("seed");
                    }))
            .build();
    ExecutionNode node = node(test("t").retryLimit(3));

    Outcome outcome = executor(ExecutionSettings.DEFAULTS, bindings).run(node);

    assertThat(outcome).isInstanceOf(Outcome.Failed.class);
    assertThat(node.getAttempts()).isEqualTo(1);
    assertThat(calls).hasValue(1);
  }

  @Test
  void sessionCancellationEndsTheAttemptAsCancelled() {
    AtomicBoolean exitRan = new AtomicBoolean();
    HookBindings bindings =
        HookBindings.builder()
            .afterTest(Descriptors.SUITE, Hook.sync("cleanup", ctx -> exitRan.set(true)))
            .build();
    ExecutionNode node =
        node(
            test("long")
                .retryLimit(3)
                .resource(ResourceRequest.of("db", SharingScope.GLOBAL, () -> "conn"))
                .body(Invocation.sync(ctx -> Thread.sleep(10_000))));
    timers.schedule(
        () -> {
          session.cancel(CancellationReason.SHUTDOWN);
        },
        50,
        TimeUnit.MILLISECONDS);

    Outcome outcome = executor(ExecutionSettings.DEFAULTS, bindings).run(node);

    assertThat(outcome).isEqualTo(Outcome.CANCELLED);
    assertThat(node.getAttempts()).isEqualTo(1);
    assertThat(exitRan).isTrue();
    assertThat(resources.liveHandles())
        .allSatisfy(handle -> assertThat(handle.getRefCount()).isZero());
  }

  @Test
  void cancelledSessionStartsNoAttempt() {
    session.cancel(CancellationReason.SHUTDOWN);
    ExecutionNode node = node(test("never"));

    assertThat(executor(ExecutionSettings.DEFAULTS).run(node)).isEqualTo(Outcome.CANCELLED);
    assertThat(node.wasExecuted()).isFalse();
    assertThat(events).isEmpty();
  }

  private TestExecutor executor(ExecutionSettings settings) {
    return executor(settings, HookBindings.empty());
  }

  private TestExecutor executor(ExecutionSettings settings, HookBindings bindings) {
    return new TestExecutor(
        settings,
        resources,
        new HookOrchestrator(bindings, session, timers),
        session,
        timers,
        events::add);
  }

  private static ExecutionNode node(TestDescriptor.Builder builder) {
    return new ExecutionNode(builder.build(), 0);
  }
}
