package trellis.api;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * An opaque callable supplied by the discovery collaborator: a test body or a hook.
 *
 * <p>Asynchronous invocations return a stage that completes when the work is done; the engine
 * cancels the stage when the invocation's token is cancelled. Synchronous code is adapted with
 * {@link #sync(Body)}.
 */
@FunctionalInterface
public interface Invocation {

  CompletionStage<?> invoke(InvocationContext context) throws Exception;

  static Invocation sync(Body body) {
    return context -> {
      body.run(context);
      return CompletableFuture.completedFuture(null);
    };
  }

  static Invocation noop() {
    return context -> CompletableFuture.completedFuture(null);
  }

  @FunctionalInterface
  interface Body {
    void run(InvocationContext context) throws Exception;
  }
}
