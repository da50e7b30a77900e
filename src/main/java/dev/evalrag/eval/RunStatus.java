package dev.evalrag.eval;

/** Lifecycle of an evaluation run. */
public enum RunStatus {
  RUNNING,
  COMPLETED,
  CANCELLED,
  FAILED;

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
