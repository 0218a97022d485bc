package trellis.engine;

import com.google.auto.service.AutoService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trellis.api.result.Outcome;
import trellis.api.result.ResultSink;
import trellis.api.result.TestEvent;

/** Writes the result stream to SLF4J: terminal outcomes at info, failures at warn. */
@AutoService(ResultSink.class)
public final class LoggingResultSink implements ResultSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingResultSink.class);

  @Override
  public void onEvent(TestEvent event) {
    if (event instanceof TestEvent.Started started) {
      log.debug("[{}] started, attempt {}", started.testId(), started.attempt());
    } else if (event instanceof TestEvent.Retrying retrying) {
      log.info("[{}] retrying, attempt {}", retrying.testId(), retrying.attempt());
    } else if (event instanceof TestEvent.Terminal terminal) {
      logTerminal(terminal);
    }
  }

  private static void logTerminal(TestEvent.Terminal terminal) {
    Outcome outcome = terminal.outcome();
    if (outcome instanceof Outcome.Failed failed) {
      log.warn(
          "[{}] FAILED after {} attempt(s) in {} ms",
          terminal.testId(),
          terminal.attempts(),
          terminal.elapsed().toMillis(),
          failed.primaryCause());
    } else if (outcome instanceof Outcome.Skipped skipped) {
      log.info("[{}] SKIPPED ({}): {}", terminal.testId(), skipped.reason(), skipped.message());
    } else if (outcome instanceof Outcome.Excluded excluded) {
      log.warn(
          "[{}] EXCLUDED ({}): {}",
          terminal.testId(),
          excluded.reason(),
          excluded.cause().getMessage());
    } else if (outcome instanceof Outcome.Cancelled) {
      log.info("[{}] CANCELLED", terminal.testId());
    } else {
      log.info("[{}] PASSED in {} ms", terminal.testId(), terminal.elapsed().toMillis());
    }
  }
}
