package dev.evalrag.eval;

import java.time.Instant;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of an evaluation run's progress.
 *
 * <p>Created and updated by {@link RunProgressTracker}. Each mutation produces a new record.
 *
 * @param runId the run
 * @param datasetId the evaluated dataset
 * @param status current run status
 * @param itemsTotal dataset size, 0 until the dataset is loaded
 * @param succeeded items that ended SUCCESS
 * @param partial items that ended PARTIAL
 * @param failed items that ended FAILED
 * @param itemStates latest state per item id
 * @param cancelRequested whether cancellation was requested
 * @param error the systemic error of a failed run
 * @param startedAt when the run was accepted
 */
public record RunProgress(
    String runId,
    String datasetId,
    RunStatus status,
    int itemsTotal,
    int succeeded,
    int partial,
    int failed,
    Map<String, ItemState> itemStates,
    boolean cancelRequested,
    @Nullable String error,
    Instant startedAt) {

  public RunProgress {
    itemStates = itemStates == null ? Map.of() : Map.copyOf(itemStates);
  }

  public int itemsCompleted() {
    return succeeded + partial + failed;
  }
}
