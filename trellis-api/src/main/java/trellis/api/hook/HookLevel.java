package trellis.api.hook;

/** Nesting levels of lifecycle hooks, outermost first. */
public enum HookLevel {
  SESSION,
  MODULE,
  CLASS,
  TEST;

  /**
   * @return true for levels whose entry hooks run once per scope instance and are shared by
   *     every test entering the scope
   */
  public boolean isShared() {
    return this != TEST;
  }
}
