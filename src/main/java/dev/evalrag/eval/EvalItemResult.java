package dev.evalrag.eval;

import dev.evalrag.judge.JudgeVerdict;
import dev.evalrag.rag.AnswerResult;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one dataset item.
 *
 * <p>{@link ItemStatus#SUCCESS} carries an answer and a valid verdict. {@link ItemStatus#PARTIAL}
 * carries an answer and the judge error, plus an invalid verdict when the judge answered with
 * output that failed validation. {@link ItemStatus#FAILED} carries only the error.
 *
 * @param item the dataset item
 * @param answer the pipeline answer, absent when the item failed
 * @param verdict the judge verdict, absent when the item failed or the judge call failed
 * @param status final outcome
 * @param error failure description, absent on success
 */
public record EvalItemResult(
    EvalDatasetItem item,
    @Nullable AnswerResult answer,
    @Nullable JudgeVerdict verdict,
    ItemStatus status,
    @Nullable String error) {

  public EvalItemResult {
    Objects.requireNonNull(item, "item");
    Objects.requireNonNull(status, "status");
    switch (status) {
      case SUCCESS -> {
        if (answer == null || verdict == null || !verdict.valid()) {
          throw new IllegalArgumentException("SUCCESS requires an answer and a valid verdict");
        }
      }
      case PARTIAL -> {
        if (answer == null || error == null) {
          throw new IllegalArgumentException("PARTIAL requires an answer and an error");
        }
      }
      case FAILED -> {
        if (error == null) {
          throw new IllegalArgumentException("FAILED requires an error");
        }
      }
    }
  }

  public static EvalItemResult success(
      EvalDatasetItem item, AnswerResult answer, JudgeVerdict verdict) {
    return new EvalItemResult(item, answer, verdict, ItemStatus.SUCCESS, null);
  }

  /** Answered, but the judge call failed before producing any output. */
  public static EvalItemResult partial(EvalDatasetItem item, AnswerResult answer, String error) {
    return new EvalItemResult(item, answer, null, ItemStatus.PARTIAL, error);
  }

  /** Answered, but the judge output was malformed or out of range. */
  public static EvalItemResult rejectedVerdict(
      EvalDatasetItem item, AnswerResult answer, String error) {
    return new EvalItemResult(
        item, answer, JudgeVerdict.unscored(error), ItemStatus.PARTIAL, error);
  }

  /** True if the judge answered with output that failed validation. */
  public boolean verdictRejected() {
    return verdict != null && !verdict.valid();
  }

  public static EvalItemResult failed(EvalDatasetItem item, String error) {
    return new EvalItemResult(item, null, null, ItemStatus.FAILED, error);
  }

  public String itemId() {
    return item.id();
  }

  /** True if the judge produced scores for this item. */
  public boolean scored() {
    return status == ItemStatus.SUCCESS;
  }
}
