package trellis.api;

import trellis.api.hook.HookLevel;

public class HookException extends TrellisException {
  private final HookLevel level;
  private final String hook;
  private final boolean entry;

  public HookException(HookLevel level, String hook, boolean entry, Throwable cause) {
    super(
        String.format("%s %s hook [%s] failed", level, entry ? "entry" : "exit", hook), cause);
    this.level = level;
    this.hook = hook;
    this.entry = entry;
  }

  public HookLevel getLevel() {
    return level;
  }

  public String getHook() {
    return hook;
  }

  /**
   * @return true for a failure of an entry (before) hook, false for an exit (after) hook
   */
  public boolean isEntry() {
    return entry;
  }
}
