package trellis.core.internal.resource;

public enum HandleState {
  PENDING,
  INITIALIZING,
  READY,
  FAILED,
  DISPOSED
}
