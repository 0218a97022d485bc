package trellis.core.internal.scope;

import trellis.api.descriptor.DeclaringUnit;
import trellis.api.descriptor.ResourceRequest;
import trellis.api.hook.HookBindings;

/**
 * An instance of a lifetime scope: the session, a module, a declaring class or a sharing key.
 * Shared resources and shared hooks are bound to scope instances.
 */
public record ScopeInstance(Kind kind, String id) {

  public static final ScopeInstance SESSION =
      new ScopeInstance(Kind.SESSION, HookBindings.SESSION_SCOPE);

  public enum Kind {
    SESSION,
    MODULE,
    UNIT,
    KEY,
    /** A single acquisition of an unshared resource. */
    ACQUISITION
  }

  public static ScopeInstance module(DeclaringUnit unit) {
    return new ScopeInstance(Kind.MODULE, unit.module());
  }

  public static ScopeInstance unit(DeclaringUnit unit) {
    return new ScopeInstance(Kind.UNIT, unit.className());
  }

  public static ScopeInstance key(String key) {
    return new ScopeInstance(Kind.KEY, key);
  }

  /** The scope instance owning the resource {@code request} made by a test of {@code unit}. */
  public static ScopeInstance of(ResourceRequest request, DeclaringUnit unit) {
    switch (request.scope()) {
      case GLOBAL:
        return SESSION;
      case PER_MODULE:
        return module(unit);
      case PER_DECLARING_UNIT:
        return unit(unit);
      case PER_KEY:
        return key(request.key());
      case NONE:
      default:
        throw new IllegalArgumentException("Unshared resources have no scope instance");
    }
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase() + ":" + id;
  }
}
