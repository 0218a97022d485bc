package trellis.api.descriptor;

/**
 * Creates and disposes a shared fixture. {@link #create()} runs at most once per handle.
 *
 * @param <T> the fixture type
 */
@FunctionalInterface
public interface ResourceFactory<T> {

  T create() throws Exception;

  /** Closes {@link AutoCloseable} instances by default. */
  default void dispose(T instance) throws Exception {
    if (instance instanceof AutoCloseable closeable) {
      closeable.close();
    }
  }
}
