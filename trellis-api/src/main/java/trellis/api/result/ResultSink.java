package trellis.api.result;

/**
 * Receives the result stream of a run. Implementations registered through {@code
 * META-INF/services/trellis.api.result.ResultSink} are picked up when sink discovery is enabled.
 *
 * <p>Events are delivered from engine threads; implementations must be thread-safe.
 */
@FunctionalInterface
public interface ResultSink {

  void onEvent(TestEvent event);
}
