package trellis.api.descriptor;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/**
 * A test's request for a shared fixture.
 *
 * @param name resource type identity; also the name the test uses to look the instance up
 * @param scope lifetime of the instance
 * @param key sharing key, required for {@link SharingScope#PER_KEY}, empty otherwise
 * @param factory creates and disposes the instance
 */
public record ResourceRequest(
    String name, SharingScope scope, String key, ResourceFactory<?> factory) {

  public ResourceRequest {
    checkArgument(name != null && !name.isEmpty(), "resource name must not be empty");
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(factory, "factory");
    key = key == null ? "" : key;
    checkArgument(
        scope != SharingScope.PER_KEY || !key.isEmpty(),
        "key is required when the sharing scope is PER_KEY");
  }

  public static ResourceRequest of(String name, SharingScope scope, ResourceFactory<?> factory) {
    return new ResourceRequest(name, scope, "", factory);
  }

  public static ResourceRequest keyed(String name, String key, ResourceFactory<?> factory) {
    return new ResourceRequest(name, SharingScope.PER_KEY, key, factory);
  }
}
