package trellis.api.descriptor;

/** Lifetime of a shared resource instance. */
public enum SharingScope {
  /** A fresh instance per acquisition, disposed on release. */
  NONE,
  /** One instance per session, disposed when the session ends. */
  GLOBAL,
  /** One instance per module, disposed after the last test of the module. */
  PER_MODULE,
  /** One instance per declaring class, disposed after the last test of the class. */
  PER_DECLARING_UNIT,
  /** One instance per custom key, disposed after the last test requesting the key. */
  PER_KEY
}
