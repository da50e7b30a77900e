package dev.evalrag.eval;

/** Receives item progress from {@link EvalRunner}. Called from worker threads. */
public interface EvalRunListener {

  EvalRunListener NONE = new EvalRunListener() {};

  default void onItemState(String itemId, ItemState state) {}

  /**
   * Called once per processed item, as soon as its result is final.
   *
   * @param position 0-based dataset position
   * @param result the item result
   */
  default void onItemCompleted(int position, EvalItemResult result) {}
}
