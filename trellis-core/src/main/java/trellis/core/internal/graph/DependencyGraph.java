package trellis.core.internal.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import trellis.api.DiscoveryException;
import trellis.api.descriptor.TestDescriptor;

/**
 * The validated dependency graph of a catalog.
 *
 * <p>Every test id of the catalog has exactly one verdict: included, or excluded with a {@link
 * DiscoveryException}. Edges only connect included tests; the graph restricted to included tests
 * is acyclic.
 */
public final class DependencyGraph {
  private final ImmutableMap<String, TestDescriptor> tests;
  private final ImmutableList<TestDescriptor> included;
  private final ImmutableMap<String, DiscoveryException> exclusions;
  private final ImmutableListMultimap<String, ResolvedDependency> predecessors;
  private final ImmutableListMultimap<String, ResolvedDependency> successors;

  DependencyGraph(
      ImmutableMap<String, TestDescriptor> tests,
      ImmutableMap<String, DiscoveryException> exclusions,
      ImmutableListMultimap<String, ResolvedDependency> predecessors) {
    this.tests = tests;
    this.exclusions = exclusions;
    this.predecessors = predecessors;
    this.included =
        tests.values().stream()
            .filter(test -> !exclusions.containsKey(test.getId()))
            .collect(ImmutableList.toImmutableList());
    ImmutableListMultimap.Builder<String, ResolvedDependency> reverse =
        ImmutableListMultimap.builder();
    for (TestDescriptor test : included) {
      for (ResolvedDependency edge : predecessors.get(test.getId())) {
        reverse.put(edge.testId(), new ResolvedDependency(test.getId(), edge.ref()));
      }
    }
    this.successors = reverse.build();
  }

  /**
   * @return every distinct test id of the catalog with its first descriptor, in catalog order
   */
  public ImmutableMap<String, TestDescriptor> tests() {
    return tests;
  }

  /**
   * @return the schedulable tests, in catalog order
   */
  public ImmutableList<TestDescriptor> included() {
    return included;
  }

  public ImmutableMap<String, DiscoveryException> exclusions() {
    return exclusions;
  }

  public Optional<DiscoveryException> exclusion(String testId) {
    return Optional.ofNullable(exclusions.get(testId));
  }

  public boolean isExcluded(String testId) {
    return exclusions.containsKey(testId);
  }

  /**
   * @return the tests {@code testId} waits for
   */
  public ImmutableList<ResolvedDependency> predecessors(String testId) {
    return predecessors.get(testId);
  }

  /**
   * @return the tests waiting for {@code testId}; each edge carries the dependent's id and the
   *     declaration it made
   */
  public ImmutableList<ResolvedDependency> successors(String testId) {
    return successors.get(testId);
  }
}
