package trellis.api;

/** The session was shut down while the operation was in progress. Never retried. */
public class SessionCancelledException extends TrellisException {

  public SessionCancelledException(String message) {
    super(message);
  }
}
