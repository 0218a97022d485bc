package trellis.core.internal.cancel;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import trellis.api.CancellationReason;
import trellis.api.CancellationToken;
import trellis.api.SessionCancelledException;
import trellis.api.TestTimeoutException;

/**
 * A node of the cancellation tree. Cancelling a scope cancels every child scope created from it;
 * cancelling a child never affects its parent.
 *
 * <p>The session owns the root scope. Every attempt of a test and every hook runs under a child
 * scope, optionally bounded by a timeout. Exit hooks run under a fresh {@link #root()} so that a
 * session shutdown cannot abort cleanup.
 */
@ThreadSafe
public final class CancellationScope implements CancellationToken, AutoCloseable {

  private final AtomicReference<Cancellation> state = new AtomicReference<>();
  private final Set<Callback> callbacks = ConcurrentHashMap.newKeySet();

  private final Registration parentRegistration;
  private volatile ScheduledFuture<?> timer;

  private CancellationScope(CancellationScope parent) {
    if (parent == null) {
      this.parentRegistration = () -> {};
    } else {
      this.parentRegistration =
          parent.onCancel(() -> cancel(parent.state.get()));
    }
  }

  public static CancellationScope root() {
    return new CancellationScope(null);
  }

  public CancellationScope child() {
    return new CancellationScope(this);
  }

  /**
   * Creates a child that cancels itself with {@link CancellationReason#TIMEOUT} once {@code
   * timeout} elapsed. A zero timeout means no timeout.
   */
  public CancellationScope childWithTimeout(Duration timeout, ScheduledExecutorService timers) {
    CancellationScope child = new CancellationScope(this);
    if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
      child.timer =
          timers.schedule(
              () -> child.cancel(new Cancellation(CancellationReason.TIMEOUT, timeout)),
              timeout.toNanos(),
              TimeUnit.NANOSECONDS);
    }
    return child;
  }

  /**
   * Cancels this scope and every descendant. Only the first cancellation counts.
   *
   * @return true if this call cancelled the scope
   */
  @CanIgnoreReturnValue
  public boolean cancel(CancellationReason cancellationReason) {
    return cancel(new Cancellation(cancellationReason, null));
  }

  private boolean cancel(Cancellation cancellation) {
    if (!state.compareAndSet(null, cancellation)) {
      return false;
    }
    RuntimeException failure = null;
    for (Callback callback : callbacks) {
      try {
        callback.fire();
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    callbacks.clear();
    if (failure != null) {
      throw failure;
    }
    return true;
  }

  @Override
  public boolean isCancelled() {
    return state.get() != null;
  }

  @Override
  public Optional<CancellationReason> getReason() {
    return Optional.ofNullable(state.get()).map(Cancellation::reason);
  }

  @Override
  public void throwIfCancelled() {
    Cancellation current = state.get();
    if (current == null) {
      return;
    }
    if (current.reason() == CancellationReason.TIMEOUT) {
      throw new TestTimeoutException(current.timeout() == null ? Duration.ZERO : current.timeout());
    }
    throw new SessionCancelledException("The session was cancelled");
  }

  @Override
  public Registration onCancel(Runnable runnable) {
    Callback callback = new Callback(runnable);
    callbacks.add(callback);
    if (isCancelled()) {
      // Raced with cancel(): fire() is idempotent, whoever comes first runs the callback.
      callbacks.remove(callback);
      callback.fire();
    }
    return () -> callbacks.remove(callback);
  }

  /**
   * Interrupts {@code thread} when this scope is cancelled, until the registration is closed. No
   * interrupt is delivered after {@code close()} returned.
   */
  public Registration interruptOnCancel(Thread thread) {
    InterruptRegistration interrupt = new InterruptRegistration(thread);
    Registration registration = onCancel(interrupt::interrupt);
    return () -> {
      registration.close();
      interrupt.close();
    };
  }

  /** Detaches this scope from its parent and stops its timer. A cancelled scope stays cancelled. */
  @Override
  public void close() {
    parentRegistration.close();
    ScheduledFuture<?> scheduled = timer;
    if (scheduled != null) {
      scheduled.cancel(false);
    }
  }

  @VisibleForTesting
  int callbackCount() {
    return callbacks.size();
  }

  /**
   * @param timeout the elapsed timeout for {@link CancellationReason#TIMEOUT}, inherited by
   *     children of the scope that timed out
   */
  private record Cancellation(CancellationReason reason, Duration timeout) {}

  private static final class Callback {
    private final Runnable runnable;
    private final AtomicBoolean fired = new AtomicBoolean();

    Callback(Runnable runnable) {
      this.runnable = runnable;
    }

    void fire() {
      if (fired.compareAndSet(false, true)) {
        runnable.run();
      }
    }
  }

  private static final class InterruptRegistration {
    private final Thread thread;

    @GuardedBy("this")
    private boolean closed;

    InterruptRegistration(Thread thread) {
      this.thread = thread;
    }

    synchronized void interrupt() {
      if (!closed) {
        thread.interrupt();
      }
    }

    synchronized void close() {
      closed = true;
    }
  }
}
