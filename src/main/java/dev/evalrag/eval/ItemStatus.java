package dev.evalrag.eval;

/**
 * Final outcome of one dataset item.
 *
 * <ul>
 *   <li>{@link #SUCCESS} - answered and judged
 *   <li>{@link #PARTIAL} - answered, but the judge gave no usable verdict
 *   <li>{@link #FAILED} - no answer (retrieval or generation failed)
 * </ul>
 */
public enum ItemStatus {
  SUCCESS,
  PARTIAL,
  FAILED;

  public ItemState toState() {
    return switch (this) {
      case SUCCESS -> ItemState.SUCCESS;
      case PARTIAL -> ItemState.PARTIAL;
      case FAILED -> ItemState.FAILED;
    };
  }
}
