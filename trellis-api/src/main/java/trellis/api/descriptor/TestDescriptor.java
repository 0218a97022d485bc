package trellis.api.descriptor;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import trellis.api.Invocation;

/**
 * A fully resolved test declaration. The engine never inspects how it was declared; everything
 * it needs to order, constrain and run the test is carried here.
 */
public final class TestDescriptor {
  private final String id;
  private final DeclaringUnit unit;
  private final ImmutableList<DependencyRef> dependencies;
  private final ConcurrencyConstraint constraint;
  private final int priority;
  private final ParallelLimit parallelLimit;
  private final Integer retryLimit;
  private final Duration timeout;
  private final ImmutableList<ResourceRequest> resources;
  private final Invocation body;
  private final String skipReason;

  private TestDescriptor(Builder builder) {
    this.id = builder.id;
    this.unit = builder.unit;
    this.dependencies = builder.dependencies.build();
    this.constraint = builder.constraint;
    this.priority = builder.priority;
    this.parallelLimit = builder.parallelLimit;
    this.retryLimit = builder.retryLimit;
    this.timeout = builder.timeout;
    this.resources = builder.resources.build();
    this.body = builder.body;
    this.skipReason = builder.skipReason;
  }

  public static Builder builder(String id, DeclaringUnit unit) {
    return new Builder(id, unit);
  }

  public String getId() {
    return id;
  }

  public DeclaringUnit getUnit() {
    return unit;
  }

  public ImmutableList<DependencyRef> getDependencies() {
    return dependencies;
  }

  public ConcurrencyConstraint getConstraint() {
    return constraint;
  }

  /** Higher values are admitted first when several tests compete for a slot. */
  public int getPriority() {
    return priority;
  }

  public Optional<ParallelLimit> getParallelLimit() {
    return Optional.ofNullable(parallelLimit);
  }

  /**
   * @return the number of retries after the first attempt; empty to use the engine default
   */
  public OptionalInt getRetryLimit() {
    return retryLimit == null ? OptionalInt.empty() : OptionalInt.of(retryLimit);
  }

  /**
   * @return the body timeout; empty to use the engine default
   */
  public Optional<Duration> getTimeout() {
    return Optional.ofNullable(timeout);
  }

  public ImmutableList<ResourceRequest> getResources() {
    return resources;
  }

  public Invocation getBody() {
    return body;
  }

  /**
   * @return a reason when the test is statically skipped and must never run
   */
  public Optional<String> getSkipReason() {
    return Optional.ofNullable(skipReason);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TestDescriptor that = (TestDescriptor) o;
    return id.equals(that.id) && unit.equals(that.unit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, unit);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("unit", unit.className())
        .add("constraint", constraint)
        .add("priority", priority)
        .toString();
  }

  public static final class Builder {
    private final String id;
    private final DeclaringUnit unit;
    private final ImmutableList.Builder<DependencyRef> dependencies = ImmutableList.builder();
    private final ImmutableList.Builder<ResourceRequest> resources = ImmutableList.builder();
    private ConcurrencyConstraint constraint = ConcurrencyConstraint.UNCONSTRAINED;
    private int priority;
    private ParallelLimit parallelLimit;
    private Integer retryLimit;
    private Duration timeout;
    private Invocation body;
    private String skipReason;

    private Builder(String id, DeclaringUnit unit) {
      checkArgument(id != null && !id.isEmpty(), "test id must not be empty");
      this.id = id;
      this.unit = Objects.requireNonNull(unit, "unit");
    }

    @CanIgnoreReturnValue
    public Builder dependsOn(DependencyRef dependency) {
      dependencies.add(dependency);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder dependsOn(List<? extends DependencyRef> dependencies) {
      this.dependencies.addAll(dependencies);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder constraint(ConcurrencyConstraint constraint) {
      this.constraint = Objects.requireNonNull(constraint, "constraint");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder parallelLimit(ParallelLimit parallelLimit) {
      this.parallelLimit = parallelLimit;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder retryLimit(int retryLimit) {
      checkArgument(retryLimit >= 0, "retry limit must not be negative, got %s", retryLimit);
      this.retryLimit = retryLimit;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      checkArgument(
          timeout == null || !timeout.isNegative(), "timeout must not be negative: %s", timeout);
      this.timeout = timeout;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder resource(ResourceRequest request) {
      resources.add(request);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder body(Invocation body) {
      this.body = body;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder skip(String reason) {
      this.skipReason = reason;
      return this;
    }

    public TestDescriptor build() {
      checkState(body != null, "test [%s] has no body", id);
      return new TestDescriptor(this);
    }
  }
}
