package trellis.engine;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.common.eventbus.SubscriberExceptionHandler;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trellis.api.result.ResultSink;
import trellis.api.result.TestEvent;
import trellis.core.internal.EventPublisher;

/**
 * Fans engine events out to the registered sinks through a Guava {@link EventBus}.
 *
 * <p>Delivery is synchronous on the publishing thread and serialized per sink, so a sink sees
 * the events of one test in publication order. A failing sink is logged and never affects the
 * run or the other sinks.
 */
final class EventBusPublisher implements EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(EventBusPublisher.class);

  private final EventBus bus;
  private final Map<ResultSink, SinkSubscriber> subscribers = new ConcurrentHashMap<>();

  EventBusPublisher(String identifier) {
    this.bus = new EventBus(new LoggingHandler(identifier));
  }

  void register(ResultSink sink) {
    SinkSubscriber subscriber = new SinkSubscriber(sink);
    if (subscribers.putIfAbsent(sink, subscriber) == null) {
      bus.register(subscriber);
    }
  }

  void unregister(ResultSink sink) {
    SinkSubscriber subscriber = subscribers.remove(sink);
    if (subscriber != null) {
      bus.unregister(subscriber);
    }
  }

  @Override
  public void publish(TestEvent event) {
    bus.post(event);
  }

  static final class SinkSubscriber {
    private final ResultSink sink;

    SinkSubscriber(ResultSink sink) {
      this.sink = sink;
    }

    @Subscribe
    public void onEvent(TestEvent event) {
      sink.onEvent(event);
    }
  }

  private static final class LoggingHandler implements SubscriberExceptionHandler {
    private final String identifier;

    LoggingHandler(String identifier) {
      this.identifier = identifier;
    }

    @Override
    public void handleException(Throwable exception, SubscriberExceptionContext context) {
      Object subscriber = context.getSubscriber();
      Object sink =
          subscriber instanceof SinkSubscriber sinkSubscriber ? sinkSubscriber.sink : subscriber;
      log.warn(
          "[{}] result sink {} failed on {}", identifier, sink, context.getEvent(), exception);
    }
  }
}
