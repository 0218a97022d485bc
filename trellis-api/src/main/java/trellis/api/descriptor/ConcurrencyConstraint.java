package trellis.api.descriptor;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;

/** How a test may overlap with others. */
public sealed interface ConcurrencyConstraint
    permits ConcurrencyConstraint.Unconstrained,
        ConcurrencyConstraint.ExclusiveKey,
        ConcurrencyConstraint.ParallelGroup {

  Unconstrained UNCONSTRAINED = new Unconstrained();

  static ExclusiveKey exclusive(String... keys) {
    return new ExclusiveKey(ImmutableSet.copyOf(Arrays.asList(keys)));
  }

  static ParallelGroup group(String name, int order) {
    return new ParallelGroup(name, order);
  }

  /** Runs in the shared parallel pool. */
  record Unconstrained() implements ConcurrencyConstraint {}

  /**
   * Mutually exclusive with every other test sharing any of the keys. An empty key set puts the
   * test on the implicit {@link #SERIAL_KEY}, which serializes all key-less exclusive tests.
   */
  record ExclusiveKey(ImmutableSet<String> keys) implements ConcurrencyConstraint {
    public static final String SERIAL_KEY = "__serial__";

    public ExclusiveKey {
      keys = keys.isEmpty() ? ImmutableSet.of(SERIAL_KEY) : ImmutableSet.copyOf(keys);
    }
  }

  /**
   * Member of a named group. Tests of one group run in ascending {@code order}: every member of
   * an order finishes before the next order starts, members sharing an order run in parallel.
   * Distinct groups are independent.
   */
  record ParallelGroup(String name, int order) implements ConcurrencyConstraint {
    public ParallelGroup {
      checkArgument(name != null && !name.isEmpty(), "group name must not be empty");
    }
  }
}
