package trellis.core.internal.resource;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trellis.api.CancellationToken;
import trellis.api.ResourceInitializationException;
import trellis.api.SessionCancelledException;
import trellis.api.descriptor.ResourceRequest;
import trellis.api.descriptor.SharingScope;
import trellis.api.descriptor.TestDescriptor;
import trellis.core.internal.scope.ScopeInstance;

/**
 * Owns every shared resource handle of a session.
 *
 * <p>The handle map is the only shared structure; it is never locked while a factory or a
 * disposer runs. Initialization is serialized per handle, disposal happens exactly once per
 * handle, when its reference count dropped to zero and its scope was closed.
 */
@ThreadSafe
public final class SharedResourceManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SharedResourceManager.class);

  private final ConcurrentHashMap<ResourceKey, SharedResourceHandle> handles =
      new ConcurrentHashMap<>();
  private final Queue<DisposalFailure> disposalFailures = new ConcurrentLinkedQueue<>();
  private final AtomicLong acquisitions = new AtomicLong();

  /**
   * Returns the handle for {@code request} on behalf of {@code owner}, creating and initializing
   * it if needed. Each successful call must be paired with {@link #release}.
   *
   * @throws ResourceInitializationException if the factory failed, now or for an earlier caller
   * @throws SessionCancelledException if {@code cancellation} fired while waiting for another
   *     caller's initialization
   */
  public SharedResourceHandle acquire(
      ResourceRequest request, TestDescriptor owner, CancellationToken cancellation) {
    cancellation.throwIfCancelled();
    SharedResourceHandle handle = retain(request, owner);
    try {
      awaitInitialization(handle, request, cancellation);
      log.debug("Test [{}] acquired [{}]", owner.getId(), handle.getKey());
      return handle;
    } catch (RuntimeException | Error e) {
      release(handle);
      throw e;
    }
  }

  /** Drops one reference; disposes the handle if it was the last one and its scope is closed. */
  public void release(SharedResourceHandle handle) {
    if (handle.release()) {
      dispose(handle);
    }
  }

  /**
   * Marks every handle of {@code scope} closed and disposes the ones no test holds anymore. Held
   * handles are disposed by their last {@link #release}.
   */
  public void closeScope(ScopeInstance scope) {
    for (SharedResourceHandle handle : handlesOf(scope)) {
      if (handle.closeScope()) {
        dispose(handle);
      }
    }
  }

  public ImmutableList<DisposalFailure> disposalFailures() {
    return ImmutableList.copyOf(disposalFailures);
  }

  public ImmutableList<SharedResourceHandle> liveHandles() {
    return ImmutableList.copyOf(handles.values());
  }

  /** Disposes every remaining handle, whatever its reference count. Ends the session. */
  @Override
  public void close() {
    for (SharedResourceHandle handle : new ArrayList<>(handles.values())) {
      if (handle.getRefCount() > 0) {
        log.warn("Disposing [{}] while still referenced", handle.getKey());
      }
      if (handle.forceClose()) {
        dispose(handle);
      }
    }
  }

  private SharedResourceHandle retain(ResourceRequest request, TestDescriptor owner) {
    if (request.scope() == SharingScope.NONE) {
      ResourceKey key =
          new ResourceKey(
              new ScopeInstance(
                  ScopeInstance.Kind.ACQUISITION,
                  owner.getId() + "#" + acquisitions.incrementAndGet()),
              request.name(),
              request.key());
      SharedResourceHandle handle = new SharedResourceHandle(key, request.factory(), true);
      handle.retain();
      handles.put(key, handle);
      return handle;
    }
    ResourceKey key =
        new ResourceKey(ScopeInstance.of(request, owner.getUnit()), request.name(), request.key());
    return handles.compute(
        key,
        (k, existing) -> {
          if (existing != null && existing.retain()) {
            return existing;
          }
          SharedResourceHandle created = new SharedResourceHandle(k, request.factory(), false);
          created.retain();
          return created;
        });
  }

  private Object awaitInitialization(
      SharedResourceHandle handle, ResourceRequest request, CancellationToken cancellation) {
    if (handle.claimInitialization()) {
      initialize(handle);
    }
    CompletableFuture<Object> waiting = handle.ready().copy();
    try (CancellationToken.Registration registration =
        cancellation.onCancel(() -> waiting.cancel(false))) {
      return waiting.get();
    } catch (ExecutionException e) {
      throw new ResourceInitializationException(request.name(), e.getCause());
    } catch (CancellationException e) {
      throw new SessionCancelledException(
          "Cancelled while waiting for shared resource [" + request.name() + "]");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SessionCancelledException(
          "Interrupted while waiting for shared resource [" + request.name() + "]");
    }
  }

  private void initialize(SharedResourceHandle handle) {
    handle.initializing();
    try {
      Object instance = handle.factory().create();
      handle.initialized(instance);
      log.debug("Initialized shared resource [{}]", handle.getKey());
    } catch (Throwable e) {
      log.warn("Shared resource [{}] failed to initialize", handle.getKey(), e);
      handle.initializationFailed(e);
    }
  }

  private List<SharedResourceHandle> handlesOf(ScopeInstance scope) {
    List<SharedResourceHandle> owned = new ArrayList<>();
    for (SharedResourceHandle handle : handles.values()) {
      if (handle.getKey().scope().equals(scope)) {
        owned.add(handle);
      }
    }
    return owned;
  }

  private void dispose(SharedResourceHandle handle) {
    handles.remove(handle.getKey(), handle);
    CompletableFuture<Object> ready = handle.ready();
    if (!ready.isDone() || ready.isCompletedExceptionally()) {
      return;
    }
    try {
      handle.factory().dispose(ready.join());
      log.debug("Disposed shared resource [{}]", handle.getKey());
    } catch (Throwable e) {
      log.warn("Shared resource [{}] failed to dispose", handle.getKey(), e);
      disposalFailures.add(new DisposalFailure(handle.getKey(), e));
    }
  }
}
