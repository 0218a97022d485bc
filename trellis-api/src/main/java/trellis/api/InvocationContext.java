package trellis.api;

import java.util.Optional;

/** What a running test body or hook can see of the engine. */
public interface InvocationContext {

  /**
   * @return the id of the test on whose behalf the invocation runs; empty for session, module
   *     and class hooks, which run on behalf of a whole scope
   */
  Optional<String> getTestId();

  /**
   * @return the scope instance the invocation belongs to (test id, class name, module name or
   *     the session id)
   */
  String getScopeId();

  /**
   * @return the 1-based attempt number; always 1 outside of test-level invocations
   */
  int getAttempt();

  CancellationToken getCancellation();

  /**
   * Looks up a shared resource acquired for the running test.
   *
   * @param name the resource name declared in the test's resource requests
   * @throws IllegalArgumentException if the test did not request the resource
   */
  <T> T getResource(String name, Class<T> type);
}
