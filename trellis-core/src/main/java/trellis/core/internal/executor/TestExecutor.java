package trellis.core.internal.executor;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;
import dev.failsafe.RetryPolicyBuilder;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trellis.api.HookException;
import trellis.api.ResourceInitializationException;
import trellis.api.SessionCancelledException;
import trellis.api.TestSkippedException;
import trellis.api.TestTimeoutException;
import trellis.api.descriptor.ResourceRequest;
import trellis.api.descriptor.TestDescriptor;
import trellis.api.result.Outcome;
import trellis.api.result.SkipReason;
import trellis.api.result.TestEvent;
import trellis.core.internal.EventPublisher;
import trellis.core.internal.cancel.CancellationScope;
import trellis.core.internal.hook.HookOrchestrator;
import trellis.core.internal.invoke.DefaultInvocationContext;
import trellis.core.internal.invoke.InvocationRunner;
import trellis.core.internal.resource.SharedResourceHandle;
import trellis.core.internal.resource.SharedResourceManager;
import trellis.core.internal.scheduler.ExecutionNode;
import trellis.core.internal.scheduler.NodeRunner;

/**
 * Runs the attempts of an admitted test.
 *
 * <p>One attempt:
 *
 * <ol>
 *   <li>acquire the shared resources; a failure fails the test without retry,
 *   <li>enter the session, module and class scopes, then run the test entry hooks,
 *   <li>run the body under a cancellation scope bounded by the test timeout,
 *   <li>run the test exit hooks, whatever happened before,
 *   <li>release the resources.
 * </ol>
 *
 * Retries are driven by a Failsafe {@link RetryPolicy} over the attempt results.
 */
@ThreadSafe
public final class TestExecutor implements NodeRunner {
  private static final Logger log = LoggerFactory.getLogger(TestExecutor.class);

  private final ExecutionSettings settings;
  private final SharedResourceManager resources;
  private final HookOrchestrator hooks;
  private final CancellationScope session;
  private final ScheduledExecutorService timers;
  private final EventPublisher publisher;

  public TestExecutor(
      ExecutionSettings settings,
      SharedResourceManager resources,
      HookOrchestrator hooks,
      CancellationScope session,
      ScheduledExecutorService timers,
      EventPublisher publisher) {
    this.settings = settings;
    this.resources = resources;
    this.hooks = hooks;
    this.session = session;
    this.timers = timers;
    this.publisher = publisher;
  }

  @Override
  public Outcome run(ExecutionNode node) {
    TestDescriptor test = node.getDescriptor();
    RetryPolicyBuilder<AttemptResult> retryPolicy =
        RetryPolicy.<AttemptResult>builder()
            .handleResultIf(AttemptResult::retryable)
            .withMaxRetries(settings.retriesOf(test))
            .onRetry(
                event -> {
                  int next = event.getAttemptCount() + 1;
                  log.info("Retrying test [{}], attempt {}", test.getId(), next);
                  publisher.publish(
                      new TestEvent.Retrying(
                          test.getId(), next, event.getLastResult().causes()));
                });
    if (!settings.retryDelay().isZero()) {
      retryPolicy.withDelay(settings.retryDelay());
    }
    try {
      AttemptResult result =
          Failsafe.with(retryPolicy.build())
              .get(context -> attempt(node, context.getAttemptCount() + 1));
      return result.outcome();
    } catch (FailsafeException e) {
      // Only raised when the retry delay is interrupted.
      if (session.isCancelled()) {
        return Outcome.CANCELLED;
      }
      return Outcome.failed(e.getCause() == null ? e : e.getCause());
    }
  }

  private AttemptResult attempt(ExecutionNode node, int attempt) {
    TestDescriptor test = node.getDescriptor();
    if (session.isCancelled()) {
      return AttemptResult.terminal(Outcome.CANCELLED);
    }
    node.attemptStarted(attempt);
    publisher.publish(new TestEvent.Started(test.getId(), attempt));

    List<SharedResourceHandle> held = new ArrayList<>();
    try {
      AttemptResult result = runAttempt(test, attempt, held);
      log.debug("Test [{}] attempt {} finished: {}", test.getId(), attempt, result.outcome());
      return result;
    } finally {
      for (SharedResourceHandle handle : held) {
        resources.release(handle);
      }
    }
  }

  private AttemptResult runAttempt(
      TestDescriptor test, int attempt, List<SharedResourceHandle> held) {
    Map<String, SharedResourceHandle> byName = new HashMap<>();
    try {
      for (ResourceRequest request : test.getResources()) {
        SharedResourceHandle handle = resources.acquire(request, test, session);
        held.add(handle);
        byName.putIfAbsent(request.name(), handle);
      }
    } catch (ResourceInitializationException e) {
      return AttemptResult.terminal(Outcome.failed(e));
    } catch (SessionCancelledException e) {
      return AttemptResult.terminal(Outcome.CANCELLED);
    }

    try {
      hooks.enterShared(test, session);
    } catch (HookException e) {
      return AttemptResult.terminal(session.isCancelled() ? Outcome.CANCELLED : Outcome.failed(e));
    } catch (SessionCancelledException e) {
      return AttemptResult.terminal(Outcome.CANCELLED);
    }

    DefaultInvocationContext context =
        DefaultInvocationContext.forTest(test.getId(), attempt, session, byName);
    Throwable error = null;
    try {
      hooks.enterTest(test, context);
      try (CancellationScope scope = session.childWithTimeout(settings.timeoutOf(test), timers)) {
        InvocationRunner.run(test.getBody(), context.withCancellation(scope), scope);
      }
    } catch (Throwable e) {
      error = e;
    }
    ImmutableList<Throwable> exitErrors = hooks.exitTest(test, context);
    return classify(error, exitErrors);
  }

  private AttemptResult classify(Throwable error, List<Throwable> exitErrors) {
    if (error instanceof SessionCancelledException || (error != null && session.isCancelled())) {
      return AttemptResult.terminal(Outcome.CANCELLED);
    }
    boolean skipped = error instanceof TestSkippedException;
    if (skipped && exitErrors.isEmpty()) {
      return AttemptResult.terminal(Outcome.skipped(SkipReason.DYNAMIC, error.getMessage()));
    }
    if (error == null && exitErrors.isEmpty()) {
      return AttemptResult.terminal(Outcome.PASSED);
    }
    ImmutableList.Builder<Throwable> causes = ImmutableList.builder();
    if (error != null && !skipped) {
      causes.add(error);
    }
    Outcome failed = new Outcome.Failed(causes.addAll(exitErrors).build());
    if (skipped || (error instanceof TestTimeoutException && !settings.retryTimeouts())) {
      return AttemptResult.terminal(failed);
    }
    return AttemptResult.retryable(failed);
  }
}
