package trellis.core.internal.resource;

import trellis.api.TrellisException;

/** A resource whose disposal threw. Never blocks the disposal of other resources. */
public record DisposalFailure(ResourceKey key, Throwable cause) {

  public TrellisException asException() {
    return new TrellisException(
        String.format("Shared resource [%s] failed to dispose", key), cause);
  }
}
