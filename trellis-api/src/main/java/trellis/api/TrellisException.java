package trellis.api;

/** Base type of every failure raised by the engine itself. */
public class TrellisException extends RuntimeException {

  public TrellisException(Throwable cause) {
    super(cause);
  }

  public TrellisException(String message) {
    super(message);
  }

  public TrellisException(String message, Throwable cause) {
    super(message, cause);
  }
}
