package trellis.api;

/**
 * The factory of a shared resource failed. The same instance is replayed to every consumer of
 * the resource for the lifetime of its scope; it never consumes a retry attempt.
 */
public class ResourceInitializationException extends TrellisException {
  private final String resource;

  public ResourceInitializationException(String resource, Throwable cause) {
    super(String.format("Shared resource [%s] failed to initialize", resource), cause);
    this.resource = resource;
  }

  public String getResource() {
    return resource;
  }
}
