package trellis.core.internal.resource;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import trellis.api.descriptor.ResourceFactory;

/**
 * A lazily initialized, reference counted shared resource instance.
 *
 * <p>Initialization is single-flight: the first acquirer wins {@link #claimInitialization()} and
 * runs the factory, every other acquirer waits on {@link #ready()}. A failure completes the
 * future exceptionally and is replayed to every later acquirer of the same handle.
 */
@ThreadSafe
public final class SharedResourceHandle {
  private final ResourceKey key;
  private final ResourceFactory<Object> factory;

  private final AtomicBoolean initializationClaimed = new AtomicBoolean();
  private final CompletableFuture<Object> ready = new CompletableFuture<>();

  @GuardedBy("this")
  private HandleState state = HandleState.PENDING;

  @GuardedBy("this")
  private int refCount;

  @GuardedBy("this")
  private boolean scopeClosed;

  @SuppressWarnings("unchecked")
  SharedResourceHandle(ResourceKey key, ResourceFactory<?> factory, boolean scopeClosed) {
    this.key = key;
    this.factory = (ResourceFactory<Object>) factory;
    this.scopeClosed = scopeClosed;
  }

  public ResourceKey getKey() {
    return key;
  }

  public synchronized HandleState getState() {
    return state;
  }

  public synchronized int getRefCount() {
    return refCount;
  }

  /**
   * @return the initialized instance
   * @throws IllegalStateException if the handle is not ready
   */
  public Object getInstance() {
    if (!ready.isDone() || ready.isCompletedExceptionally()) {
      throw new IllegalStateException("Resource " + key + " is not ready");
    }
    return ready.join();
  }

  ResourceFactory<Object> factory() {
    return factory;
  }

  CompletableFuture<Object> ready() {
    return ready;
  }

  boolean claimInitialization() {
    return initializationClaimed.compareAndSet(false, true);
  }

  synchronized void initializing() {
    state = HandleState.INITIALIZING;
  }

  void initialized(Object instance) {
    synchronized (this) {
      state = HandleState.READY;
    }
    ready.complete(instance);
  }

  void initializationFailed(Throwable cause) {
    synchronized (this) {
      state = HandleState.FAILED;
    }
    ready.completeExceptionally(cause);
  }

  /**
   * @return false if the handle was already disposed and must be replaced
   */
  synchronized boolean retain() {
    if (state == HandleState.DISPOSED) {
      return false;
    }
    refCount++;
    return true;
  }

  /**
   * @return true if the caller must dispose the handle now
   */
  synchronized boolean release() {
    if (refCount <= 0) {
      throw new IllegalStateException("Resource " + key + " released more often than acquired");
    }
    refCount--;
    return claimDisposal();
  }

  /**
   * @return true if the caller must dispose the handle now
   */
  synchronized boolean closeScope() {
    scopeClosed = true;
    return claimDisposal();
  }

  /** Claims disposal regardless of outstanding references; used when the session ends. */
  synchronized boolean forceClose() {
    scopeClosed = true;
    if (state == HandleState.DISPOSED) {
      return false;
    }
    state = HandleState.DISPOSED;
    return true;
  }

  @GuardedBy("this")
  private boolean claimDisposal() {
    if (refCount == 0 && scopeClosed && state != HandleState.DISPOSED) {
      state = HandleState.DISPOSED;
      return true;
    }
    return false;
  }

  @Override
  public synchronized String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("state", state)
        .add("refCount", refCount)
        .add("scopeClosed", scopeClosed)
        .toString();
  }
}
