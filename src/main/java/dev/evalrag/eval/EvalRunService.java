package dev.evalrag.eval;

import dev.evalrag.error.DatasetException;
import dev.evalrag.eval.store.ResultStore;
import dev.evalrag.eval.store.RunRecord;
import dev.evalrag.generation.GenerationProperties;
import dev.evalrag.judge.JudgeProperties;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Entry point for evaluation runs.
 *
 * <p>{@link #runEval} returns a run id immediately and evaluates on the {@code evalRunExecutor}.
 * The dataset is loaded inside the run, so a missing or invalid dataset yields a FAILED run with
 * the loader's error rather than an exception to the caller. Item results are stored as soon as
 * each item finishes; the summary is stored when the run completes.
 */
@Service
public class EvalRunService {

  private static final Logger log = LoggerFactory.getLogger(EvalRunService.class);

  private final DatasetLoader datasetLoader;
  private final EvalRunner runner;
  private final RunProgressTracker progressTracker;
  private final ResultStore resultStore;
  private final EvaluationExporter exporter;
  private final EvalConfig defaultConfig;
  private final TaskExecutor executor;
  private final Clock clock;

  public EvalRunService(
      DatasetLoader datasetLoader,
      EvalRunner runner,
      RunProgressTracker progressTracker,
      ResultStore resultStore,
      EvaluationExporter exporter,
      EvalProperties evalProperties,
      GenerationProperties generationProperties,
      JudgeProperties judgeProperties,
      @Qualifier("evalRunExecutor") TaskExecutor executor,
      Clock clock) {
    this.datasetLoader = datasetLoader;
    this.runner = runner;
    this.progressTracker = progressTracker;
    this.resultStore = resultStore;
    this.exporter = exporter;
    this.defaultConfig =
        evalProperties.defaultConfig(judgeProperties.getModel(), generationProperties.getModel());
    this.executor = executor;
    this.clock = clock;
  }

  /** Run options from {@code evalrag.eval.*} with the configured generation and judge models. */
  public EvalConfig defaultConfig() {
    return defaultConfig;
  }

  /**
   * Starts an evaluation run.
   *
   * @param datasetId the dataset to evaluate
   * @param config run options
   * @return the new run id
   * @throws TaskRejectedException if too many runs are already queued
   */
  public String runEval(String datasetId, EvalConfig config) {
    String runId = UUID.randomUUID().toString();
    progressTracker.startRun(runId, datasetId);
    resultStore.createRun(runId, datasetId, clock.instant());
    try {
      executor.execute(() -> execute(runId, datasetId, config));
    } catch (TaskRejectedException e) {
      finish(runId, RunStatus.FAILED, null, "Run rejected: too many runs in progress");
      throw e;
    }
    log.info("Started run {} on dataset {} (k={}, concurrency={}, generation={}, judge={})",
        runId, datasetId, config.k(), config.concurrency(), config.generationModel(),
        config.judgeModel());
    return runId;
  }

  void execute(String runId, String datasetId, EvalConfig config) {
    List<EvalDatasetItem> items;
    try {
      items = datasetLoader.load(datasetId);
    } catch (DatasetException e) {
      log.warn("Run {} failed: {}", runId, e.getMessage());
      finish(runId, RunStatus.FAILED, null, "DatasetError: " + e.getMessage());
      return;
    }
    progressTracker.recordDatasetLoaded(runId, items.stream().map(EvalDatasetItem::id).toList());

    try {
      EvalRunOutcome outcome =
          runner.run(
              runId,
              datasetId,
              items,
              config,
              () -> progressTracker.isCancelRequested(runId),
              new EvalRunListener() {
                @Override
                public void onItemState(String itemId, ItemState state) {
                  progressTracker.recordItemState(runId, itemId, state);
                }

                @Override
                public void onItemCompleted(int position, EvalItemResult result) {
                  resultStore.saveItem(runId, position, result);
                }
              });
      finish(runId, outcome.status(), outcome.summary(), outcome.error());
      EvalRunSummary summary = outcome.summary();
      if (summary != null) {
        log.info("Run {} {}: {} items, {} success, {} partial, {} failed, overall score {}",
            runId, outcome.status(), summary.itemCount(), summary.successCount(),
            summary.partialCount(), summary.failedCount(), summary.overallScore());
      }
    } catch (RuntimeException e) {
      log.error("Run {} failed unexpectedly", runId, e);
      finish(runId, RunStatus.FAILED, null, e.toString());
    }
  }

  /**
   * Summary of a finished run.
   *
   * @param runId the run
   * @return the summary, empty while running, for a failed run or an unknown id
   */
  public Optional<EvalRunSummary> getRunSummary(String runId) {
    return resultStore.findSummary(runId);
  }

  /**
   * Item results stored so far, in dataset order.
   *
   * @param runId the run
   * @return item results, empty for an unknown run
   */
  public List<EvalItemResult> getRunItems(String runId) {
    return resultStore.findItems(runId);
  }

  /** Live progress of a run started by this process. */
  public Optional<RunProgress> getRunProgress(String runId) {
    return progressTracker.getProgress(runId);
  }

  /** Stored status of any run, including runs of earlier processes. */
  public Optional<RunRecord> getRun(String runId) {
    return resultStore.findRun(runId);
  }

  /**
   * Requests cancellation. Items not yet started are skipped; items in flight finish.
   *
   * @param runId the run
   * @return false if the run is unknown or already finished
   */
  public boolean cancelRun(String runId) {
    boolean requested = progressTracker.requestCancel(runId);
    if (requested) {
      log.info("Cancellation requested for run {}", runId);
    }
    return requested;
  }

  /**
   * Writes a finished run to summary and item CSV files.
   *
   * @param runId the run
   * @return the written files, summary first
   * @throws IllegalArgumentException if the run has no summary
   * @throws IOException if writing fails
   */
  public List<Path> exportRun(String runId) throws IOException {
    EvalRunSummary summary =
        getRunSummary(runId)
            .orElseThrow(() -> new IllegalArgumentException("No summary for run " + runId));
    return exporter.export(summary, getRunItems(runId));
  }

  private void finish(
      String runId, RunStatus status, @Nullable EvalRunSummary summary, @Nullable String error) {
    resultStore.completeRun(runId, status, summary, error, clock.instant());
    progressTracker.completeRun(runId, status, error);
  }
}
