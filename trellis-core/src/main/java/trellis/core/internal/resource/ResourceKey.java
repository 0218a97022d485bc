package trellis.core.internal.resource;

import trellis.core.internal.scope.ScopeInstance;

/** Identity of a shared resource handle. */
public record ResourceKey(ScopeInstance scope, String name, String key) {

  @Override
  public String toString() {
    return key.isEmpty() ? scope + "/" + name : scope + "/" + name + "[" + key + "]";
  }
}
