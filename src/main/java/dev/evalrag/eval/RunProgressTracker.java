package dev.evalrag.eval;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker for evaluation run progress.
 *
 * <p>Holds one {@link RunProgress} snapshot per run id. Every update replaces the snapshot
 * atomically through {@code computeIfPresent()}, so worker threads never share mutable state.
 *
 * <p>Progress is transient and lost on restart; finished runs are persisted by the result store.
 */
@Component
public class RunProgressTracker {

  private final ConcurrentHashMap<String, RunProgress> runs = new ConcurrentHashMap<>();
  private final Clock clock;

  public RunProgressTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Start tracking a run.
   *
   * @param runId the new run
   * @param datasetId the dataset it evaluates
   */
  public void startRun(String runId, String datasetId) {
    runs.put(
        runId,
        new RunProgress(
            runId,
            datasetId,
            RunStatus.RUNNING,
            0,
            0,
            0,
            0,
            Map.of(),
            false,
            null,
            clock.instant()));
  }

  /**
   * Record the dataset size once it is loaded; every item starts PENDING.
   *
   * @param runId the run
   * @param itemIds ids of the dataset items
   */
  public void recordDatasetLoaded(String runId, Iterable<String> itemIds) {
    update(
        runId,
        p -> {
          Map<String, ItemState> states = new HashMap<>();
          itemIds.forEach(id -> states.put(id, ItemState.PENDING));
          return copy(p, p.status(), states.size(), p.succeeded(), p.partial(), p.failed(), states,
              p.cancelRequested(), p.error());
        });
  }

  /**
   * Record an item state transition. Terminal states also update the counters.
   *
   * @param runId the run
   * @param itemId the item
   * @param state its new state
   */
  public void recordItemState(String runId, String itemId, ItemState state) {
    update(
        runId,
        p -> {
          Map<String, ItemState> states = new HashMap<>(p.itemStates());
          states.put(itemId, state);
          return copy(
              p,
              p.status(),
              p.itemsTotal(),
              p.succeeded() + (state == ItemState.SUCCESS ? 1 : 0),
              p.partial() + (state == ItemState.PARTIAL ? 1 : 0),
              p.failed() + (state == ItemState.FAILED ? 1 : 0),
              states,
              p.cancelRequested(),
              p.error());
        });
  }

  /**
   * Flag a running run for cancellation.
   *
   * @param runId the run
   * @return false if the run is unknown or already finished
   */
  public boolean requestCancel(String runId) {
    RunProgress progress =
        runs.computeIfPresent(
            runId,
            (id, p) ->
                p.status().isTerminal()
                    ? p
                    : copy(p, p.status(), p.itemsTotal(), p.succeeded(), p.partial(), p.failed(),
                        p.itemStates(), true, p.error()));
    return progress != null && !progress.status().isTerminal();
  }

  public boolean isCancelRequested(String runId) {
    RunProgress progress = runs.get(runId);
    return progress != null && progress.cancelRequested();
  }

  /**
   * Mark a run finished.
   *
   * @param runId the run
   * @param status its final status
   * @param error the systemic error, for a failed run
   */
  public void completeRun(String runId, RunStatus status, @Nullable String error) {
    update(
        runId,
        p -> copy(p, status, p.itemsTotal(), p.succeeded(), p.partial(), p.failed(),
            p.itemStates(), p.cancelRequested(), error));
  }

  /**
   * Get the current snapshot of a run.
   *
   * @param runId the run
   * @return progress snapshot, or empty if the run is not tracked
   */
  public Optional<RunProgress> getProgress(String runId) {
    return Optional.ofNullable(runs.get(runId));
  }

  /** Stop tracking a run. */
  public void removeRun(String runId) {
    runs.remove(runId);
  }

  private void update(String runId, UnaryOperator<RunProgress> change) {
    runs.computeIfPresent(runId, (id, progress) -> change.apply(progress));
  }

  private static RunProgress copy(
      RunProgress p,
      RunStatus status,
      int itemsTotal,
      int succeeded,
      int partial,
      int failed,
      Map<String, ItemState> itemStates,
      boolean cancelRequested,
      @Nullable String error) {
    return new RunProgress(
        p.runId(),
        p.datasetId(),
        status,
        itemsTotal,
        succeeded,
        partial,
        failed,
        itemStates,
        cancelRequested,
        error,
        p.startedAt());
  }
}
