package trellis.api.descriptor;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A declared "depends on" relationship.
 *
 * <ul>
 *   <li>{@code optional}: run after the target if it is present in the catalog, but do not fail
 *       discovery when it is absent.
 *   <li>{@code proceedOnFailure}: the target only orders execution; the dependent runs even if
 *       the target did not pass.
 * </ul>
 *
 * A dependency that is neither optional nor proceed-on-failure gates execution: the dependent is
 * skipped when the target does not pass.
 */
public sealed interface DependencyRef permits DependencyRef.OnTest, DependencyRef.OnUnit {

  boolean optional();

  boolean proceedOnFailure();

  /**
   * @return true if the target must pass for the dependent to run
   */
  default boolean gatesExecution() {
    return !optional() && !proceedOnFailure();
  }

  static OnTest onTest(String testId) {
    return new OnTest(testId, false, false);
  }

  static OnUnit onUnit(String className) {
    return new OnUnit(className, false, false);
  }

  /** Depends on a single test identified by id. */
  record OnTest(String testId, boolean optional, boolean proceedOnFailure)
      implements DependencyRef {
    public OnTest {
      checkArgument(testId != null && !testId.isEmpty(), "testId must not be empty");
    }

    public OnTest asOptional() {
      return new OnTest(testId, true, proceedOnFailure);
    }

    public OnTest proceedingOnFailure() {
      return new OnTest(testId, optional, true);
    }
  }

  /** Depends on every test declared by a class. */
  record OnUnit(String className, boolean optional, boolean proceedOnFailure)
      implements DependencyRef {
    public OnUnit {
      checkArgument(className != null && !className.isEmpty(), "className must not be empty");
    }

    public OnUnit asOptional() {
      return new OnUnit(className, true, proceedOnFailure);
    }

    public OnUnit proceedingOnFailure() {
      return new OnUnit(className, optional, true);
    }
  }
}
