package trellis.api;

import java.util.Optional;

/**
 * Cooperative cancellation signal handed to every test body and hook.
 *
 * <p>Bodies that loop or wait should poll {@link #isCancelled()} or call {@link
 * #throwIfCancelled()}. The engine additionally interrupts the thread running a synchronous body
 * when its token is cancelled.
 */
public interface CancellationToken {

  boolean isCancelled();

  /**
   * @return the reason of the first cancellation, empty while not cancelled
   */
  Optional<CancellationReason> getReason();

  /**
   * @throws TestTimeoutException if cancelled because of a timeout
   * @throws SessionCancelledException if cancelled because of a session shutdown
   */
  void throwIfCancelled();

  /**
   * Registers a callback run once on cancellation, immediately if the token is already
   * cancelled.
   *
   * @return a registration whose {@code close()} removes the callback
   */
  Registration onCancel(Runnable callback);

  interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
