package trellis.core.internal.scope;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import trellis.api.descriptor.ResourceRequest;
import trellis.api.descriptor.SharingScope;
import trellis.api.descriptor.TestDescriptor;

/**
 * Counts the unsettled tests of every module, declaring class and sharing key so that the last
 * test of a scope can close it.
 */
@ThreadSafe
public final class ScopeTracker {

  @GuardedBy("this")
  private final Map<ScopeInstance, Integer> remaining = new HashMap<>();

  @GuardedBy("this")
  private final Set<String> settled = new HashSet<>();

  public ScopeTracker(Iterable<TestDescriptor> tests) {
    for (TestDescriptor test : tests) {
      for (ScopeInstance scope : scopesOf(test)) {
        remaining.merge(scope, 1, Integer::sum);
      }
    }
  }

  /**
   * Records that {@code test} reached its terminal outcome.
   *
   * @return the scopes closed by this test, innermost first (keys, class, module)
   */
  public synchronized ImmutableList<ScopeInstance> settle(TestDescriptor test) {
    if (!settled.add(test.getId())) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<ScopeInstance> closed = ImmutableList.builder();
    for (ScopeInstance scope : scopesOf(test)) {
      Integer left = remaining.computeIfPresent(scope, (s, count) -> count - 1);
      if (left != null && left == 0) {
        remaining.remove(scope);
        closed.add(scope);
      }
    }
    return closed.build();
  }

  public synchronized boolean isOpen(ScopeInstance scope) {
    return remaining.containsKey(scope);
  }

  private static ImmutableSet<ScopeInstance> scopesOf(TestDescriptor test) {
    ImmutableSet.Builder<ScopeInstance> scopes = ImmutableSet.builder();
    for (ResourceRequest request : test.getResources()) {
      if (request.scope() == SharingScope.PER_KEY) {
        scopes.add(ScopeInstance.key(request.key()));
      }
    }
    scopes.add(ScopeInstance.unit(test.getUnit()));
    scopes.add(ScopeInstance.module(test.getUnit()));
    return scopes.build();
  }
}
