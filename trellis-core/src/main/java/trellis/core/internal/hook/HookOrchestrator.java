package trellis.core.internal.hook;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trellis.api.CancellationToken;
import trellis.api.HookException;
import trellis.api.SessionCancelledException;
import trellis.api.descriptor.DeclaringUnit;
import trellis.api.descriptor.TestDescriptor;
import trellis.api.hook.Hook;
import trellis.api.hook.HookBindings;
import trellis.api.hook.HookLevel;
import trellis.core.internal.cancel.CancellationScope;
import trellis.core.internal.invoke.DefaultInvocationContext;
import trellis.core.internal.invoke.InvocationRunner;

/**
 * Runs the entry and exit hooks of every level.
 *
 * <p>Session, module and class entry hooks run once per scope instance: the first test entering
 * the scope runs them, concurrent entrants wait for the result. A failure is cached and replayed
 * to every later entrant without invoking the hooks again. Test-level hooks run around every
 * attempt.
 *
 * <p>Exit hooks always run to completion under a detached cancellation scope and never stop at
 * the first failure.
 */
@ThreadSafe
public final class HookOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(HookOrchestrator.class);

  private final HookBindings bindings;
  private final CancellationScope session;
  private final ScheduledExecutorService timers;
  private final ConcurrentHashMap<HookScope.Key, HookScope> scopes = new ConcurrentHashMap<>();

  public HookOrchestrator(
      HookBindings bindings, CancellationScope session, ScheduledExecutorService timers) {
    this.bindings = bindings;
    this.session = session;
    this.timers = timers;
  }

  /**
   * Enters the session, module and class scopes of {@code test}, outermost first.
   *
   * @param waiter cancels the wait for another test's entry hooks
   * @throws HookException if an entry hook of any of the scopes failed
   * @throws SessionCancelledException if {@code waiter} was cancelled while waiting
   */
  public void enterShared(TestDescriptor test, CancellationToken waiter) {
    DeclaringUnit unit = test.getUnit();
    enter(HookLevel.SESSION, HookBindings.SESSION_SCOPE, waiter);
    enter(HookLevel.MODULE, unit.module(), waiter);
    enter(HookLevel.CLASS, unit.className(), waiter);
  }

  /**
   * Runs the test-level entry hooks of one attempt, stopping at the first failure.
   *
   * @throws HookException if a hook failed
   */
  public void enterTest(TestDescriptor test, DefaultInvocationContext context) {
    String className = test.getUnit().className();
    HookException failure =
        runEntryHooks(HookLevel.TEST, bindings.entryHooks(HookLevel.TEST, className), context);
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Runs every test-level exit hook of one attempt.
   *
   * @return the hook failures, in hook order
   */
  public ImmutableList<Throwable> exitTest(TestDescriptor test, DefaultInvocationContext context) {
    return runExitHooks(
        HookLevel.TEST, bindings.exitHooks(HookLevel.TEST, test.getUnit().className()), context);
  }

  /**
   * Runs the exit hooks of a shared scope instance, once, if its entry was attempted.
   *
   * @return the hook failures, in hook order
   */
  public ImmutableList<Throwable> exitScope(HookLevel level, String scopeId) {
    HookScope scope = scopes.get(new HookScope.Key(level, scopeId));
    if (scope == null || !scope.claimExit()) {
      return ImmutableList.of();
    }
    log.debug("Running {} exit hooks of [{}]", level, scopeId);
    return runExitHooks(
        level,
        bindings.exitHooks(level, scopeId),
        DefaultInvocationContext.forScope(scopeId, CancellationScope.root()));
  }

  private void enter(HookLevel level, String scopeId, CancellationToken waiter) {
    HookScope scope =
        scopes.computeIfAbsent(
            new HookScope.Key(level, scopeId), key -> new HookScope(key.level(), key.scopeId()));
    if (scope.claimEntry()) {
      ImmutableList<Hook> hooks = bindings.entryHooks(level, scopeId);
      if (!hooks.isEmpty()) {
        log.debug("Running {} entry hooks of [{}]", level, scopeId);
      }
      HookException failure =
          runEntryHooks(level, hooks, DefaultInvocationContext.forScope(scopeId, session));
      if (failure == null) {
        scope.entry().complete(null);
      } else {
        log.warn("{} entry hooks of [{}] failed", level, scopeId, failure);
        scope.entry().completeExceptionally(failure);
      }
    }
    CompletableFuture<Void> waiting = scope.entry().copy();
    try (CancellationToken.Registration registration =
        waiter.onCancel(() -> waiting.cancel(false))) {
      waiting.get();
    } catch (ExecutionException e) {
      throw (HookException) e.getCause();
    } catch (CancellationException e) {
      throw new SessionCancelledException(
          String.format("Cancelled while waiting for %s entry hooks of [%s]", level, scopeId));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SessionCancelledException(
          String.format("Interrupted while waiting for %s entry hooks of [%s]", level, scopeId));
    }
  }

  private HookException runEntryHooks(
      HookLevel level, List<Hook> hooks, DefaultInvocationContext context) {
    for (Hook hook : hooks) {
      try (CancellationScope scope = session.childWithTimeout(hook.timeout(), timers)) {
        InvocationRunner.run(hook.invocation(), context.withCancellation(scope), scope);
      } catch (Throwable e) {
        return new HookException(level, hook.name(), true, e);
      }
    }
    return null;
  }

  private ImmutableList<Throwable> runExitHooks(
      HookLevel level, List<Hook> hooks, DefaultInvocationContext context) {
    ImmutableList.Builder<Throwable> failures = ImmutableList.builder();
    CancellationScope detached = CancellationScope.root();
    for (Hook hook : hooks) {
      try (CancellationScope scope = detached.childWithTimeout(hook.timeout(), timers)) {
        InvocationRunner.run(hook.invocation(), context.withCancellation(scope), scope);
      } catch (Throwable e) {
        log.warn("{} exit hook [{}] failed", level, hook.name(), e);
        failures.add(new HookException(level, hook.name(), false, e));
      }
    }
    return failures.build();
  }
}
