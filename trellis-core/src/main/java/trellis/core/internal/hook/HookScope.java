package trellis.core.internal.hook;

import com.google.errorprone.annotations.ThreadSafe;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import trellis.api.hook.HookLevel;

/**
 * One-shot entry and exit state of a shared hook scope instance.
 *
 * <p>Entry: {@code NOT_STARTED -> RUNNING -> SUCCEEDED | FAILED}, observed through {@link
 * #entry()}. Exit: {@code NOT_STARTED -> DONE}, claimed once by {@link #claimExit()}.
 */
@ThreadSafe
final class HookScope {
  private final HookLevel level;
  private final String scopeId;

  private final AtomicBoolean entryClaimed = new AtomicBoolean();
  private final CompletableFuture<Void> entry = new CompletableFuture<>();
  private final AtomicBoolean exitClaimed = new AtomicBoolean();

  HookScope(HookLevel level, String scopeId) {
    this.level = level;
    this.scopeId = scopeId;
  }

  HookLevel level() {
    return level;
  }

  String scopeId() {
    return scopeId;
  }

  /**
   * @return true for the single caller that must run the entry hooks
   */
  boolean claimEntry() {
    return entryClaimed.compareAndSet(false, true);
  }

  boolean isEntryAttempted() {
    return entryClaimed.get();
  }

  CompletableFuture<Void> entry() {
    return entry;
  }

  /**
   * @return true for the single caller that must run the exit hooks, provided entry was attempted
   */
  boolean claimExit() {
    return isEntryAttempted() && exitClaimed.compareAndSet(false, true);
  }

  record Key(HookLevel level, String scopeId) {}
}
