package dev.evalrag.eval;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * What {@link EvalRunner#run} produced.
 *
 * @param status COMPLETED, CANCELLED or FAILED
 * @param results item results in dataset order, skipped items excluded
 * @param summary run metrics, absent for a failed run
 * @param error the systemic error of a failed run
 */
public record EvalRunOutcome(
    RunStatus status,
    List<EvalItemResult> results,
    @Nullable EvalRunSummary summary,
    @Nullable String error) {

  public EvalRunOutcome {
    results = List.copyOf(results);
  }
}
