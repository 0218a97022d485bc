package trellis.engine;

import com.google.common.collect.ImmutableList;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trellis.api.result.ResultSink;

/** Discovers {@link ResultSink} implementations registered as services. */
final class ResultSinkRegistry {
  private static final Logger log = LoggerFactory.getLogger(ResultSinkRegistry.class);

  private ResultSinkRegistry() {}

  static ImmutableList<ResultSink> discover(ClassLoader classLoader) {
    ImmutableList.Builder<ResultSink> sinks = ImmutableList.builder();
    ServiceLoader<ResultSink> loader = ServiceLoader.load(ResultSink.class, classLoader);
    for (ServiceLoader.Provider<ResultSink> provider : loader.stream().toList()) {
      try {
        sinks.add(provider.get());
        log.debug("Discovered result sink {}", provider.type().getName());
      } catch (ServiceConfigurationError e) {
        log.warn("Failed to instantiate result sink {}", provider.type().getName(), e);
      }
    }
    return sinks.build();
  }
}
