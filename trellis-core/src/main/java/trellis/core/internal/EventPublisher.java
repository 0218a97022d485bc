package trellis.core.internal;

import trellis.api.result.TestEvent;

/** Delivers engine events to the result stream of the running session. */
@FunctionalInterface
public interface EventPublisher {

  void publish(TestEvent event);
}
