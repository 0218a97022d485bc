package trellis.core.internal.invoke;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import trellis.api.CancellationToken;
import trellis.api.Invocation;
import trellis.api.InvocationContext;
import trellis.api.SessionCancelledException;
import trellis.core.internal.cancel.CancellationScope;

/**
 * Runs a body or hook under a cancellation scope.
 *
 * <p>The calling thread is interrupted when the scope is cancelled while the synchronous part
 * runs; the returned stage is cancelled when the scope is cancelled while it is pending. Once the
 * scope is cancelled, whatever the invocation threw is reported as the cancellation ({@link
 * trellis.api.TestTimeoutException} or {@link SessionCancelledException}).
 */
public final class InvocationRunner {

  private InvocationRunner() {}

  public static void run(Invocation invocation, InvocationContext context, CancellationScope scope)
      throws Throwable {
    scope.throwIfCancelled();
    try {
      try (CancellationToken.Registration interrupt =
          scope.interruptOnCancel(Thread.currentThread())) {
        CompletionStage<?> stage = invocation.invoke(context);
        CompletableFuture<?> future =
            stage == null ? CompletableFuture.completedFuture(null) : stage.toCompletableFuture();
        try (CancellationToken.Registration cancel = scope.onCancel(() -> future.cancel(true))) {
          future.get();
        }
      }
    } catch (ExecutionException e) {
      rethrowIfCancelled(scope);
      throw e.getCause();
    } catch (InterruptedException e) {
      rethrowIfCancelled(scope);
      Thread.currentThread().interrupt();
      throw new SessionCancelledException("Interrupted while running an invocation");
    } catch (Throwable e) {
      rethrowIfCancelled(scope);
      throw e;
    } finally {
      if (scope.isCancelled()) {
        Thread.interrupted();
      }
    }
  }

  private static void rethrowIfCancelled(CancellationScope scope) {
    if (scope.isCancelled()) {
      // Our own interrupt, not the caller's.
      Thread.interrupted();
      scope.throwIfCancelled();
    }
  }
}
