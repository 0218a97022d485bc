package trellis.engine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trellis.api.descriptor.TestCatalog;
import trellis.api.descriptor.TestDescriptor;
import trellis.api.result.ResultSink;
import trellis.api.result.RunSummary;
import trellis.core.internal.graph.CatalogFilter;

/**
 * Entry point: runs test catalogs with ordering, bounded parallelism, shared fixtures and hook
 * lifecycles.
 *
 * <pre>{@code
 * try (TrellisEngine engine = TrellisEngine.create(EngineConfig.load())) {
 *   engine.register(event -> System.out.println(event));
 *   RunSummary summary = engine.run(catalog);
 * }
 * }</pre>
 *
 * One run at a time per engine. Every run gets fresh resources, hook scopes and cancellation
 * state; only the thread pools and the registered sinks are reused across runs.
 */
public final class TrellisEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TrellisEngine.class);

  private final EngineConfig config;
  private final ExecutorService workers;
  private final ScheduledExecutorService timers;
  private final EventBusPublisher publisher = new EventBusPublisher("trellis");
  private final AtomicReference<EngineSession> current = new AtomicReference<>();

  private volatile boolean closed;

  private TrellisEngine(EngineConfig config) {
    this.config = config;
    this.workers =
        Executors.newFixedThreadPool(
            config.getWorkers(),
            new ThreadFactoryBuilder().setNameFormat("trellis-worker-%d").setDaemon(true).build());
    this.timers =
        Executors.newScheduledThreadPool(
            1,
            new ThreadFactoryBuilder().setNameFormat("trellis-timer-%d").setDaemon(true).build());
    if (config.isDiscoverSinks()) {
      ResultSinkRegistry.discover(Thread.currentThread().getContextClassLoader())
          .forEach(publisher::register);
    }
  }

  public static TrellisEngine create(EngineConfig config) {
    log.debug("Creating engine with {}", config);
    return new TrellisEngine(config);
  }

  /** Creates an engine configured by {@link EngineConfig#load()}. */
  public static TrellisEngine create() {
    return create(EngineConfig.load());
  }

  public EngineConfig getConfig() {
    return config;
  }

  @CanIgnoreReturnValue
  public TrellisEngine register(ResultSink sink) {
    publisher.register(sink);
    return this;
  }

  public void unregister(ResultSink sink) {
    publisher.unregister(sink);
  }

  /**
   * Runs every test of {@code catalog} to a terminal outcome and blocks until the run is over,
   * including its session exit hooks and resource disposal.
   *
   * @throws IllegalStateException if a run is already in progress or the engine is closed
   */
  public RunSummary run(TestCatalog catalog) {
    if (closed) {
      throw new IllegalStateException("The engine is closed");
    }
    EngineSession session = new EngineSession(catalog, config, workers, timers, publisher);
    if (!current.compareAndSet(null, session)) {
      throw new IllegalStateException("A run is already in progress");
    }
    try {
      return session.run();
    } finally {
      current.compareAndSet(session, null);
    }
  }

  /**
   * Runs the tests matching {@code filter} and everything they depend on.
   *
   * @see CatalogFilter#select(TestCatalog, Predicate)
   */
  public RunSummary run(TestCatalog catalog, Predicate<TestDescriptor> filter) {
    return run(CatalogFilter.select(catalog, filter));
  }

  /**
   * Cancels the current run, if any: pending tests are cancelled, running tests are interrupted,
   * exit hooks still run and every resource is disposed. {@link #run} returns once that is done.
   */
  public void cancel() {
    EngineSession session = current.get();
    if (session != null) {
      session.cancel();
    }
  }

  public boolean isRunning() {
    return current.get() != null;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    cancel();
    workers.shutdown();
    timers.shutdownNow();
    try {
      if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Worker threads did not terminate in time");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
