package trellis.api.descriptor;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The class (and the module containing it) that declares a test. Module and class level hooks
 * and resources are grouped by it.
 *
 * @param module the module (assembly, jar) the class belongs to
 * @param className fully qualified name of the declaring class; a catalog binds it to one module
 */
public record DeclaringUnit(String module, String className) {

  public DeclaringUnit {
    checkArgument(module != null && !module.isEmpty(), "module must not be empty");
    checkArgument(className != null && !className.isEmpty(), "className must not be empty");
  }

  public static DeclaringUnit of(String module, String className) {
    return new DeclaringUnit(module, className);
  }
}
