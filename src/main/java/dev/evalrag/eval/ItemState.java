package dev.evalrag.eval;

/** Processing state of one dataset item within a run. */
public enum ItemState {
  PENDING,
  RETRIEVING,
  GENERATING,
  JUDGING,
  SUCCESS,
  PARTIAL,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCESS || this == PARTIAL || this == FAILED;
  }
}
