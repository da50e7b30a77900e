package dev.evalrag.eval;

import dev.evalrag.error.JudgeException;
import dev.evalrag.error.RetrievalException;
import dev.evalrag.generation.LlmProperties;
import dev.evalrag.judge.Judge;
import dev.evalrag.judge.JudgeVerdict;
import dev.evalrag.rag.AnswerResult;
import dev.evalrag.rag.RagPipeline;
import dev.evalrag.retrieval.RetrievedContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Runs every item of a dataset through the RAG pipeline and the judge.
 *
 * <p>Each item moves {@code PENDING -> RETRIEVING -> GENERATING -> JUDGING} and ends {@code
 * SUCCESS}, {@code PARTIAL} (answered, not judged) or {@code FAILED} (not answered). Item failures
 * become item results and never abort the run. Retrieval errors are retried per item.
 *
 * <p>Items are processed by a fixed pool of {@link EvalConfig#concurrency()} workers owned by the
 * run and joined through an {@link ExecutorCompletionService}. Results are collected by dataset
 * position, so their order does not depend on completion order. An item whose task starts after
 * cancellation was requested is skipped.
 *
 * <p>The run fails as a whole when every processed item failed because the vector index was
 * unreachable, or when the listener cannot record an item. In the latter case no further item is
 * started.
 */
@Component
public class EvalRunner {

  private static final Logger log = LoggerFactory.getLogger(EvalRunner.class);

  private final RagPipeline pipeline;
  private final Judge judge;
  private final MetricsAggregator aggregator;
  private final Duration retryBaseDelay;
  private final Duration retryMaxDelay;

  public EvalRunner(
      RagPipeline pipeline,
      Judge judge,
      MetricsAggregator aggregator,
      LlmProperties llmProperties) {
    this(pipeline, judge, aggregator, llmProperties.baseDelay(), llmProperties.maxDelay());
  }

  EvalRunner(
      RagPipeline pipeline,
      Judge judge,
      MetricsAggregator aggregator,
      Duration retryBaseDelay,
      Duration retryMaxDelay) {
    this.pipeline = pipeline;
    this.judge = judge;
    this.aggregator = aggregator;
    this.retryBaseDelay = retryBaseDelay;
    this.retryMaxDelay = retryMaxDelay;
  }

  /**
   * Evaluates a dataset.
   *
   * @param runId the run
   * @param datasetId the dataset, for the summary
   * @param items dataset items in file order
   * @param config run options
   * @param cancelled polled before each item starts
   * @param listener receives item transitions and results
   * @return item results in dataset order with the summary, or the systemic error
   */
  public EvalRunOutcome run(
      String runId,
      String datasetId,
      List<EvalDatasetItem> items,
      EvalConfig config,
      BooleanSupplier cancelled,
      EvalRunListener listener) {
    ExecutorService workers =
        Executors.newFixedThreadPool(
            config.concurrency(), new CustomizableThreadFactory("eval-" + shortId(runId) + "-"));
    CompletionService<ItemOutcome> completion = new ExecutorCompletionService<>(workers);
    ItemOutcome[] outcomes = new ItemOutcome[items.size()];
    AtomicReference<String> aborted = new AtomicReference<>();
    try {
      for (int i = 0; i < items.size(); i++) {
        int position = i;
        EvalDatasetItem item = items.get(i);
        completion.submit(() -> process(position, item, config, cancelled, aborted, listener));
      }
      for (int i = 0; i < items.size(); i++) {
        ItemOutcome outcome = completion.take().get();
        outcomes[outcome.position()] = outcome;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
      return new EvalRunOutcome(RunStatus.FAILED, List.of(), null, "Run interrupted");
    } catch (ExecutionException e) {
      // process() converts every item error into a result
      workers.shutdownNow();
      throw new IllegalStateException("Item task failed unexpectedly", e.getCause());
    } finally {
      workers.shutdown();
    }

    List<EvalItemResult> results = new ArrayList<>(items.size());
    int processed = 0;
    int unreachable = 0;
    @Nullable String lastUnreachable = null;
    for (ItemOutcome outcome : outcomes) {
      if (outcome.result() == null) {
        continue;
      }
      processed++;
      results.add(outcome.result());
      if (outcome.indexUnreachable()) {
        unreachable++;
        lastUnreachable = outcome.result().error();
      }
    }

    String abortError = aborted.get();
    if (abortError != null) {
      log.warn("Run {} aborted: {}", runId, abortError);
      return new EvalRunOutcome(RunStatus.FAILED, results, null, abortError);
    }

    if (processed > 0 && unreachable == processed) {
      String error =
          "Vector index unreachable for all %d processed item(s): %s"
              .formatted(processed, lastUnreachable);
      log.warn("Run {} failed: {}", runId, error);
      return new EvalRunOutcome(RunStatus.FAILED, results, null, error);
    }

    boolean wasCancelled = processed < items.size();
    EvalRunSummary summary =
        aggregator.aggregate(runId, datasetId, results, config.passThreshold(), wasCancelled);
    return new EvalRunOutcome(
        wasCancelled ? RunStatus.CANCELLED : RunStatus.COMPLETED, results, summary, null);
  }

  private ItemOutcome process(
      int position,
      EvalDatasetItem item,
      EvalConfig config,
      BooleanSupplier cancelled,
      AtomicReference<String> aborted,
      EvalRunListener listener) {
    if (aborted.get() != null) {
      log.debug("Skipping {}: run aborted", item.id());
      return new ItemOutcome(position, null, false);
    }
    if (cancelled.getAsBoolean()) {
      log.debug("Skipping {}: run cancelled", item.id());
      return new ItemOutcome(position, null, false);
    }
    try {
      ItemOutcome outcome = evaluate(position, item, config, listener);
      EvalItemResult result = outcome.result();
      if (result != null) {
        if (result.status() != ItemStatus.SUCCESS) {
          log.warn("Item {} ended {}: {}", item.id(), result.status(), result.error());
        }
        listener.onItemState(item.id(), result.status().toState());
        listener.onItemCompleted(position, result);
      }
      return outcome;
    } catch (RuntimeException e) {
      // only listener calls reach here; evaluate() turns item errors into results
      log.error("Could not record item {}", item.id(), e);
      aborted.compareAndSet(null, "Could not record item %s: %s".formatted(item.id(), e));
      return new ItemOutcome(position, null, false);
    }
  }

  private ItemOutcome evaluate(
      int position, EvalDatasetItem item, EvalConfig config, EvalRunListener listener) {
    transition(listener, item, ItemState.RETRIEVING);
    List<RetrievedContext> contexts;
    try {
      contexts = retrieveWithRetry(item, config);
    } catch (RetrievalException e) {
      boolean unreachable = e.getReason() == RetrievalException.Reason.INDEX_UNREACHABLE;
      return new ItemOutcome(
          position,
          EvalItemResult.failed(
              item, "RetrievalError[%s]: %s".formatted(e.getReason(), e.getMessage())),
          unreachable);
    } catch (RuntimeException e) {
      return failed(position, item, "RetrievalError: " + e.getMessage());
    }

    transition(listener, item, ItemState.GENERATING);
    AnswerResult answer;
    try {
      answer = pipeline.answer(item.question(), contexts, config.generationSettings());
    } catch (RuntimeException e) {
      return failed(position, item, "GenerationError: " + e.getMessage());
    }

    transition(listener, item, ItemState.JUDGING);
    try {
      JudgeVerdict verdict =
          judge.judge(
              item.question(),
              answer.answerText(),
              answer.contexts(),
              item.expectedAnswer(),
              config.judgeSettings());
      return new ItemOutcome(position, EvalItemResult.success(item, answer, verdict), false);
    } catch (JudgeException e) {
      String error = "JudgeError: " + e.getMessage();
      EvalItemResult result =
          e.getRawResponse() != null
              ? EvalItemResult.rejectedVerdict(item, answer, error)
              : EvalItemResult.partial(item, answer, error);
      return new ItemOutcome(position, result, false);
    } catch (RuntimeException e) {
      return new ItemOutcome(
          position, EvalItemResult.partial(item, answer, "JudgeError: " + e), false);
    }
  }

  private List<RetrievedContext> retrieveWithRetry(EvalDatasetItem item, EvalConfig config) {
    RetryTemplate retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(config.maxRetries() + 1)
            .exponentialBackoff(retryBaseDelay.toMillis(), 2.0, retryMaxDelay.toMillis())
            .retryOn(RetrievalException.class)
            .build();
    return retryTemplate.execute(
        context -> {
          if (context.getRetryCount() > 0) {
            log.debug(
                "Retrying retrieval for {} (attempt {} of {})",
                item.id(),
                context.getRetryCount() + 1,
                config.maxRetries() + 1);
          }
          return pipeline.retrieve(item.question(), config.k(), null);
        });
  }

  private static void transition(EvalRunListener listener, EvalDatasetItem item, ItemState state) {
    log.debug("Item {} -> {}", item.id(), state);
    listener.onItemState(item.id(), state);
  }

  private static ItemOutcome failed(int position, EvalDatasetItem item, String error) {
    return new ItemOutcome(position, EvalItemResult.failed(item, error), false);
  }

  private static String shortId(String runId) {
    return runId.length() > 8 ? runId.substring(0, 8) : runId;
  }

  /** Result of one item task; {@code result} is null for an item skipped after cancellation. */
  private record ItemOutcome(
      int position, @Nullable EvalItemResult result, boolean indexUnreachable) {}
}
