package trellis.api.result;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import trellis.api.descriptor.TestDescriptor;

/**
 * Progress of a single test. For one test the events always arrive in the order {@code
 * Discovered}, ({@code Started}, {@code Retrying}?)*, {@code Terminal}; events of different tests
 * interleave freely.
 */
public sealed interface TestEvent
    permits TestEvent.Discovered, TestEvent.Started, TestEvent.Retrying, TestEvent.Terminal {

  String testId();

  record Discovered(String testId, TestDescriptor descriptor) implements TestEvent {}

  /**
   * @param attempt 1-based attempt number
   */
  record Started(String testId, int attempt) implements TestEvent {}

  /**
   * @param attempt the attempt about to start
   * @param previousCauses why the previous attempt failed
   */
  record Retrying(String testId, int attempt, ImmutableList<Throwable> previousCauses)
      implements TestEvent {}

  /**
   * @param attempts number of attempts made, 0 when the test never ran
   * @param elapsed wall time from the first start to the outcome
   */
  record Terminal(String testId, Outcome outcome, int attempts, Duration elapsed)
      implements TestEvent {}
}
