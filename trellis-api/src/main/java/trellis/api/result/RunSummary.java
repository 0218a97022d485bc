package trellis.api.result;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Aggregated result of one run.
 *
 * @param outcomes terminal outcome per test id, in catalog order
 * @param unattributedFailures hook and disposal failures that could not be attached to a test
 *     outcome (session exit hooks, scope closures after a test that never ran)
 * @param elapsed wall time of the run
 */
public record RunSummary(
    ImmutableMap<String, Outcome> outcomes,
    ImmutableList<Throwable> unattributedFailures,
    Duration elapsed) {

  public Outcome outcome(String testId) {
    Outcome outcome = outcomes.get(testId);
    if (outcome == null) {
      throw new IllegalArgumentException("Unknown test id " + testId);
    }
    return outcome;
  }

  public long count(Class<? extends Outcome> type) {
    return count(type::isInstance);
  }

  public long count(Predicate<Outcome> predicate) {
    return outcomes.values().stream().filter(predicate).count();
  }

  public int total() {
    return outcomes.size();
  }

  /**
   * @return true when every test passed or was skipped and no failure was left unattributed
   */
  public boolean isSuccessful() {
    return unattributedFailures.isEmpty()
        && outcomes.values().stream()
            .allMatch(o -> o instanceof Outcome.Passed || o instanceof Outcome.Skipped);
  }

  public static RunSummary of(
      Map<String, Outcome> outcomes, Iterable<Throwable> failures, Duration elapsed) {
    return new RunSummary(
        ImmutableMap.copyOf(outcomes), ImmutableList.copyOf(failures), elapsed);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("total", total())
        .add("passed", count(Outcome.Passed.class))
        .add("failed", count(Outcome.Failed.class))
        .add("skipped", count(Outcome.Skipped.class))
        .add("cancelled", count(Outcome.Cancelled.class))
        .add("excluded", count(Outcome.Excluded.class))
        .add("unattributedFailures", unattributedFailures.size())
        .add("elapsed", elapsed)
        .toString();
  }
}
