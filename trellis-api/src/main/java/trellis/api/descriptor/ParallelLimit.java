package trellis.api.descriptor;

import static com.google.common.base.Preconditions.checkArgument;

/** At most {@code limit} in-flight tests share the limiter {@code name}. */
public record ParallelLimit(String name, int limit) {

  public ParallelLimit {
    checkArgument(name != null && !name.isEmpty(), "limiter name must not be empty");
    checkArgument(limit > 0, "limit must be positive, got %s", limit);
  }
}
