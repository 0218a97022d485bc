package trellis.api.result;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import trellis.api.DiscoveryException;

/** Terminal outcome of a test. Every test of a catalog reaches exactly one. */
public sealed interface Outcome
    permits Outcome.Passed, Outcome.Failed, Outcome.Skipped, Outcome.Cancelled, Outcome.Excluded {

  Passed PASSED = new Passed();
  Cancelled CANCELLED = new Cancelled();

  static Failed failed(Throwable cause) {
    return new Failed(ImmutableList.of(cause));
  }

  static Skipped skipped(SkipReason reason, String message) {
    return new Skipped(reason, message);
  }

  default boolean isPassed() {
    return this instanceof Passed;
  }

  /**
   * @return true for outcomes that satisfy a gating dependency
   */
  default boolean satisfiesDependents() {
    return isPassed();
  }

  /**
   * Appends errors raised after the outcome was decided, e.g. by class-level exit hooks. Appending
   * to a passed test turns it into a failure; other outcomes are kept and the errors are attached
   * only to failures.
   */
  default Outcome withAdditionalFailures(List<? extends Throwable> errors) {
    if (errors.isEmpty()) {
      return this;
    }
    if (this instanceof Failed failed) {
      return new Failed(
          ImmutableList.<Throwable>builder().addAll(failed.causes()).addAll(errors).build());
    }
    if (this instanceof Passed) {
      return new Failed(ImmutableList.copyOf(errors));
    }
    return this;
  }

  record Passed() implements Outcome {}

  /**
   * @param causes body error first, then hook errors in the order they were raised
   */
  record Failed(ImmutableList<Throwable> causes) implements Outcome {
    public Failed {
      if (causes.isEmpty()) {
        throw new IllegalArgumentException("a failure needs at least one cause");
      }
    }

    public Throwable primaryCause() {
      return causes.get(0);
    }
  }

  record Skipped(SkipReason reason, String message) implements Outcome {
    public Skipped {
      Objects.requireNonNull(reason, "reason");
      message = message == null ? "" : message;
    }
  }

  record Cancelled() implements Outcome {}

  record Excluded(DiscoveryException cause) implements Outcome {
    public Excluded {
      Objects.requireNonNull(cause, "cause");
    }

    public ExclusionReason reason() {
      return cause.getReason();
    }
  }
}
