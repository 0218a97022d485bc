package trellis.core.internal.invoke;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import trellis.api.CancellationToken;
import trellis.api.InvocationContext;
import trellis.core.internal.resource.SharedResourceHandle;

public final class DefaultInvocationContext implements InvocationContext {
  private final String testId;
  private final String scopeId;
  private final int attempt;
  private final CancellationToken cancellation;
  private final ImmutableMap<String, SharedResourceHandle> resources;

  private DefaultInvocationContext(
      String testId,
      String scopeId,
      int attempt,
      CancellationToken cancellation,
      Map<String, SharedResourceHandle> resources) {
    this.testId = testId;
    this.scopeId = scopeId;
    this.attempt = attempt;
    this.cancellation = cancellation;
    this.resources = ImmutableMap.copyOf(resources);
  }

  public static DefaultInvocationContext forTest(
      String testId,
      int attempt,
      CancellationToken cancellation,
      Map<String, SharedResourceHandle> resources) {
    return new DefaultInvocationContext(testId, testId, attempt, cancellation, resources);
  }

  /** Context of a session, module or class hook: no test, no resources. */
  public static DefaultInvocationContext forScope(String scopeId, CancellationToken cancellation) {
    return new DefaultInvocationContext(null, scopeId, 1, cancellation, ImmutableMap.of());
  }

  /** The same invocation seen under another cancellation token. */
  public DefaultInvocationContext withCancellation(CancellationToken token) {
    return new DefaultInvocationContext(testId, scopeId, attempt, token, resources);
  }

  @Override
  public Optional<String> getTestId() {
    return Optional.ofNullable(testId);
  }

  @Override
  public String getScopeId() {
    return scopeId;
  }

  @Override
  public int getAttempt() {
    return attempt;
  }

  @Override
  public CancellationToken getCancellation() {
    return cancellation;
  }

  @Override
  public <T> T getResource(String name, Class<T> type) {
    SharedResourceHandle handle = resources.get(name);
    if (handle == null) {
      throw new IllegalArgumentException(
          String.format("Resource [%s] was not requested by [%s]", name, scopeId));
    }
    return type.cast(handle.getInstance());
  }
}
