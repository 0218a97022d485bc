package trellis.core.internal.executor;

import com.google.common.collect.ImmutableList;
import trellis.api.result.Outcome;

/**
 * Result of a single attempt.
 *
 * @param retryable whether another attempt may change the outcome
 */
record AttemptResult(Outcome outcome, boolean retryable) {

  static AttemptResult terminal(Outcome outcome) {
    return new AttemptResult(outcome, false);
  }

  static AttemptResult retryable(Outcome outcome) {
    return new AttemptResult(outcome, true);
  }

  ImmutableList<Throwable> causes() {
    return outcome instanceof Outcome.Failed failed ? failed.causes() : ImmutableList.of();
  }
}
