package trellis.api.descriptor;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import trellis.api.hook.HookBindings;

/**
 * The immutable input of a run: every declared test plus the hooks bound to its scopes.
 *
 * <p>Class level hooks and resources are keyed by class name, so a class name may belong to one
 * module only.
 *
 * @param descriptors tests in registration order
 * @param hooks entry and exit hooks per level and scope
 */
public record TestCatalog(ImmutableList<TestDescriptor> descriptors, HookBindings hooks) {

  public TestCatalog {
    Objects.requireNonNull(descriptors, "descriptors");
    Objects.requireNonNull(hooks, "hooks");
    Map<String, String> modules = new HashMap<>();
    for (TestDescriptor test : descriptors) {
      DeclaringUnit unit = test.getUnit();
      String module = modules.putIfAbsent(unit.className(), unit.module());
      checkArgument(
          module == null || module.equals(unit.module()),
          "Class [%s] is declared in modules [%s] and [%s]",
          unit.className(),
          module,
          unit.module());
    }
  }

  public static TestCatalog of(List<TestDescriptor> descriptors) {
    return new TestCatalog(ImmutableList.copyOf(descriptors), HookBindings.empty());
  }

  public static TestCatalog of(List<TestDescriptor> descriptors, HookBindings hooks) {
    return new TestCatalog(ImmutableList.copyOf(descriptors), hooks);
  }
}
