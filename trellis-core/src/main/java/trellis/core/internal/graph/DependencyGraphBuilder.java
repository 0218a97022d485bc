package trellis.core.internal.graph;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.MultimapBuilder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trellis.api.DiscoveryException;
import trellis.api.descriptor.ConcurrencyConstraint;
import trellis.api.descriptor.DependencyRef;
import trellis.api.descriptor.TestCatalog;
import trellis.api.descriptor.TestDescriptor;
import trellis.api.result.ExclusionReason;

/**
 * Resolves the declared dependencies of a catalog into a {@link DependencyGraph}.
 *
 * <ol>
 *   <li>Index tests by id and by declaring class. A repeated id excludes the id.
 *   <li>Expand class dependencies to every other test of the class.
 *   <li>Exclude tests with an unresolved non-optional dependency; drop unresolved optional ones.
 *   <li>Exclude every test on a dependency cycle, optional edges included.
 *   <li>Exclude tests depending on a later order of their own parallel group.
 *   <li>Propagate exclusions to everything transitively depending on an excluded test.
 * </ol>
 */
public final class DependencyGraphBuilder {
  private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

  public DependencyGraph build(TestCatalog catalog) {
    Map<String, TestDescriptor> byId = new LinkedHashMap<>();
    ListMultimap<String, String> byUnit = MultimapBuilder.hashKeys().arrayListValues().build();
    Map<String, DiscoveryException> exclusions = new LinkedHashMap<>();

    for (TestDescriptor test : catalog.descriptors()) {
      if (byId.putIfAbsent(test.getId(), test) != null) {
        exclusions.putIfAbsent(
            test.getId(),
            new DiscoveryException(
                ExclusionReason.DUPLICATE_ID,
                String.format("Test id [%s] is declared more than once", test.getId())));
      } else {
        byUnit.put(test.getUnit().className(), test.getId());
      }
    }

    Map<String, Map<String, DependencyRef>> edges = new LinkedHashMap<>();
    for (TestDescriptor test : byId.values()) {
      Map<String, DependencyRef> targets = new LinkedHashMap<>();
      for (DependencyRef ref : test.getDependencies()) {
        List<String> resolved = resolve(ref, test, byId, byUnit);
        if (resolved == null) {
          if (ref.optional()) {
            log.debug("Dropping optional dependency {} of [{}]", ref, test.getId());
          } else {
            exclusions.putIfAbsent(
                test.getId(),
                new DiscoveryException(
                    ExclusionReason.UNRESOLVED_DEPENDENCY,
                    String.format("Test [%s] depends on unknown %s", test.getId(), describe(ref))));
          }
          continue;
        }
        for (String target : resolved) {
          targets.merge(target, ref, (first, next) -> first.gatesExecution() ? first : next);
        }
      }
      edges.put(test.getId(), targets);
    }

    markCycles(edges, exclusions);
    markOrderConflicts(byId, edges, exclusions);
    propagate(edges, exclusions);

    ImmutableListMultimap.Builder<String, ResolvedDependency> predecessors =
        ImmutableListMultimap.builder();
    for (Map.Entry<String, Map<String, DependencyRef>> entry : edges.entrySet()) {
      if (exclusions.containsKey(entry.getKey())) {
        continue;
      }
      for (Map.Entry<String, DependencyRef> edge : entry.getValue().entrySet()) {
        if (!exclusions.containsKey(edge.getKey())) {
          predecessors.put(entry.getKey(), new ResolvedDependency(edge.getKey(), edge.getValue()));
        }
      }
    }

    exclusions.forEach((id, e) -> log.info("Excluded test [{}]: {}", id, e.getMessage()));
    return new DependencyGraph(
        ImmutableMap.copyOf(byId), ImmutableMap.copyOf(exclusions), predecessors.build());
  }

  /**
   * @return the ids {@code ref} resolves to, or null if its target is not in the catalog
   */
  private static List<String> resolve(
      DependencyRef ref,
      TestDescriptor dependent,
      Map<String, TestDescriptor> byId,
      ListMultimap<String, String> byUnit) {
    if (ref instanceof DependencyRef.OnTest onTest) {
      return byId.containsKey(onTest.testId()) ? ImmutableList.of(onTest.testId()) : null;
    }
    DependencyRef.OnUnit onUnit = (DependencyRef.OnUnit) ref;
    if (!byUnit.containsKey(onUnit.className())) {
      return null;
    }
    List<String> members = new ArrayList<>(byUnit.get(onUnit.className()));
    members.remove(dependent.getId());
    return members;
  }

  /**
   * Tarjan's strongly connected components with an explicit stack, over every edge including
   * optional ones. Members of a component with more than one test, or of a self loop, are cyclic.
   */
  private static void markCycles(
      Map<String, Map<String, DependencyRef>> edges, Map<String, DiscoveryException> exclusions) {
    Map<String, Integer> index = new HashMap<>();
    Map<String, Integer> lowLink = new HashMap<>();
    Deque<String> component = new ArrayDeque<>();
    Set<String> onComponent = new HashSet<>();

    for (String start : edges.keySet()) {
      if (index.containsKey(start)) {
        continue;
      }
      Deque<String> path = new ArrayDeque<>();
      Deque<Iterator<String>> stack = new ArrayDeque<>();
      visit(start, index, lowLink, component, onComponent);
      path.push(start);
      stack.push(edges.get(start).keySet().iterator());

      while (!stack.isEmpty()) {
        String node = path.peek();
        Iterator<String> targets = stack.peek();
        if (targets.hasNext()) {
          String next = targets.next();
          if (!index.containsKey(next)) {
            visit(next, index, lowLink, component, onComponent);
            path.push(next);
            stack.push(edges.get(next).keySet().iterator());
          } else if (onComponent.contains(next)) {
            lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
          }
          continue;
        }
        stack.pop();
        path.pop();
        if (!path.isEmpty()) {
          String parent = path.peek();
          lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(node)));
        }
        if (lowLink.get(node).equals(index.get(node))) {
          List<String> members = new ArrayList<>();
          String member;
          do {
            member = component.pop();
            onComponent.remove(member);
            members.add(member);
          } while (!member.equals(node));
          if (members.size() > 1 || edges.get(node).containsKey(node)) {
            excludeCycle(members, exclusions);
          }
        }
      }
    }
  }

  private static void visit(
      String node,
      Map<String, Integer> index,
      Map<String, Integer> lowLink,
      Deque<String> component,
      Set<String> onComponent) {
    int next = index.size();
    index.put(node, next);
    lowLink.put(node, next);
    component.push(node);
    onComponent.add(node);
  }

  private static void excludeCycle(
      List<String> members, Map<String, DiscoveryException> exclusions) {
    List<String> ordered = Lists.reverse(members);
    String description = Joiner.on(", ").join(ordered);
    for (String member : ordered) {
      String message =
          String.format("Test [%s] is part of a dependency cycle among [%s]", member, description);
      exclusions.putIfAbsent(
          member, new DiscoveryException(ExclusionReason.CYCLIC_DEPENDENCY, message));
    }
  }

  private static void markOrderConflicts(
      Map<String, TestDescriptor> byId,
      Map<String, Map<String, DependencyRef>> edges,
      Map<String, DiscoveryException> exclusions) {
    for (Map.Entry<String, Map<String, DependencyRef>> entry : edges.entrySet()) {
      if (!(byId.get(entry.getKey()).getConstraint()
          instanceof ConcurrencyConstraint.ParallelGroup group)) {
        continue;
      }
      for (String target : entry.getValue().keySet()) {
        if (byId.get(target).getConstraint() instanceof ConcurrencyConstraint.ParallelGroup other
            && other.name().equals(group.name())
            && other.order() > group.order()) {
          exclusions.putIfAbsent(
              entry.getKey(),
              new DiscoveryException(
                  ExclusionReason.ORDER_CONFLICT,
                  String.format(
                      "Test [%s] (order %d) depends on [%s] (order %d) of parallel group [%s]",
                      entry.getKey(), group.order(), target, other.order(), group.name())));
        }
      }
    }
  }

  /** Optional edges do not propagate: an excluded optional target is simply dropped. */
  private static void propagate(
      Map<String, Map<String, DependencyRef>> edges, Map<String, DiscoveryException> exclusions) {
    ListMultimap<String, String> dependents = MultimapBuilder.hashKeys().arrayListValues().build();
    edges.forEach(
        (dependent, targets) ->
            targets.forEach(
                (target, ref) -> {
                  if (!ref.optional()) {
                    dependents.put(target, dependent);
                  }
                }));

    Deque<String> queue = new ArrayDeque<>(exclusions.keySet());
    Set<String> visited = new LinkedHashSet<>(exclusions.keySet());
    while (!queue.isEmpty()) {
      String excluded = queue.poll();
      DiscoveryException cause = exclusions.get(excluded);
      for (String dependent : dependents.get(excluded)) {
        if (visited.add(dependent)) {
          exclusions.putIfAbsent(
              dependent,
              new DiscoveryException(
                  cause.getReason(),
                  String.format(
                      "Test [%s] depends on excluded test [%s]: %s",
                      dependent, excluded, cause.getMessage())));
          queue.add(dependent);
        }
      }
    }
  }

  private static String describe(DependencyRef ref) {
    if (ref instanceof DependencyRef.OnTest onTest) {
      return "test [" + onTest.testId() + "]";
    }
    return "class [" + ((DependencyRef.OnUnit) ref).className() + "]";
  }
}
