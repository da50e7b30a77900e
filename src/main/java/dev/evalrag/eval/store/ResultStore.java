package dev.evalrag.eval.store;

import dev.evalrag.eval.EvalItemResult;
import dev.evalrag.eval.EvalRunSummary;
import dev.evalrag.eval.RunStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Durable storage of evaluation runs, their item results and summaries.
 *
 * <p>Items are keyed by {@code (runId, itemId)}; saving an item twice overwrites it. Items are
 * returned in dataset order.
 */
public interface ResultStore {

  void createRun(String runId, String datasetId, Instant startedAt);

  void saveItem(String runId, int position, EvalItemResult result);

  /**
   * Records the end of a run.
   *
   * @param runId the run
   * @param status final status
   * @param summary run metrics, absent for a failed run
   * @param error the systemic error of a failed run
   * @param completedAt completion time
   */
  void completeRun(
      String runId,
      RunStatus status,
      @Nullable EvalRunSummary summary,
      @Nullable String error,
      Instant completedAt);

  Optional<RunRecord> findRun(String runId);

  Optional<EvalRunSummary> findSummary(String runId);

  List<EvalItemResult> findItems(String runId);
}
