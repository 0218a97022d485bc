package trellis.core.internal.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import trellis.api.descriptor.DependencyRef;
import trellis.api.descriptor.TestCatalog;
import trellis.api.descriptor.TestDescriptor;

/** Narrows a catalog to a selection of tests without breaking their dependencies. */
public final class CatalogFilter {

  private CatalogFilter() {}

  /**
   * Keeps the tests matching {@code selector} plus everything they transitively depend on, in
   * catalog order. Hooks are kept as they are.
   */
  public static TestCatalog select(TestCatalog catalog, Predicate<TestDescriptor> selector) {
    Map<String, TestDescriptor> byId = new HashMap<>();
    ListMultimap<String, TestDescriptor> byUnit =
        MultimapBuilder.hashKeys().arrayListValues().build();
    for (TestDescriptor test : catalog.descriptors()) {
      byId.putIfAbsent(test.getId(), test);
      byUnit.put(test.getUnit().className(), test);
    }

    Set<TestDescriptor> selected = new HashSet<>();
    Deque<TestDescriptor> queue = new ArrayDeque<>();
    for (TestDescriptor test : catalog.descriptors()) {
      if (selector.test(test) && selected.add(test)) {
        queue.add(test);
      }
    }
    while (!queue.isEmpty()) {
      TestDescriptor test = queue.poll();
      for (DependencyRef ref : test.getDependencies()) {
        if (ref instanceof DependencyRef.OnTest onTest) {
          TestDescriptor target = byId.get(onTest.testId());
          if (target != null && selected.add(target)) {
            queue.add(target);
          }
        } else if (ref instanceof DependencyRef.OnUnit onUnit) {
          for (TestDescriptor target : byUnit.get(onUnit.className())) {
            if (selected.add(target)) {
              queue.add(target);
            }
          }
        }
      }
    }

    ImmutableList<TestDescriptor> kept =
        catalog.descriptors().stream()
            .filter(selected::contains)
            .collect(ImmutableList.toImmutableList());
    return new TestCatalog(kept, catalog.hooks());
  }
}
