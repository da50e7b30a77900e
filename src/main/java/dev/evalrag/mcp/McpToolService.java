package dev.evalrag.mcp;

import dev.evalrag.config.EmbeddingProperties;
import dev.evalrag.document.DocumentRecordRepository;
import dev.evalrag.eval.AxisStatistics;
import dev.evalrag.eval.EvalConfig;
import dev.evalrag.eval.EvalItemResult;
import dev.evalrag.eval.EvalRunService;
import dev.evalrag.eval.EvalRunSummary;
import dev.evalrag.eval.QaPairGenerator;
import dev.evalrag.eval.RunProgress;
import dev.evalrag.eval.store.RunRecord;
import dev.evalrag.index.VectorIndex;
import dev.evalrag.ingestion.IngestionService;
import dev.evalrag.judge.JudgeVerdict;
import dev.evalrag.rag.AnswerResult;
import dev.evalrag.rag.RagPipeline;
import dev.evalrag.retrieval.RetrievalProperties;
import dev.evalrag.retrieval.RetrievedContext;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing question answering, ingestion and evaluation as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Functional tools: {@code ask}, {@code ingest_directory}, {@code run_eval}, {@code
 * get_run_summary}, {@code get_run_items}, {@code cancel_run}, {@code export_run}, {@code
 * generate_dataset}, {@code index_statistics}.
 */
@Service
public class McpToolService {

  private static final int MAX_PREVIEW_CHARS = 200;
  private static final int DEFAULT_GENERATED_ITEMS = 10;

  private final RagPipeline ragPipeline;
  private final IngestionService ingestionService;
  private final EvalRunService evalRunService;
  private final QaPairGenerator qaPairGenerator;
  private final VectorIndex vectorIndex;
  private final DocumentRecordRepository documentRecordRepository;
  private final int defaultK;
  private final EmbeddingProperties embeddingProperties;

  public McpToolService(
      RagPipeline ragPipeline,
      IngestionService ingestionService,
      EvalRunService evalRunService,
      QaPairGenerator qaPairGenerator,
      VectorIndex vectorIndex,
      DocumentRecordRepository documentRecordRepository,
      RetrievalProperties retrievalProperties,
      EmbeddingProperties embeddingProperties) {
    this.ragPipeline = ragPipeline;
    this.ingestionService = ingestionService;
    this.evalRunService = evalRunService;
    this.qaPairGenerator = qaPairGenerator;
    this.vectorIndex = vectorIndex;
    this.documentRecordRepository = documentRecordRepository;
    this.defaultK = retrievalProperties.getDefaultK();
    this.embeddingProperties = embeddingProperties;
  }

  /** Answers a question from the indexed documents and lists the contexts used. */
  @Tool(
      name = "ask",
      description =
          "Answer a question with retrieval-augmented generation over the indexed documents. "
              + "Returns the answer followed by the retrieved contexts and their similarity scores.")
  public String ask(
      @ToolParam(description = "The question to answer") @Nullable String question,
      @ToolParam(description = "Number of contexts to retrieve (default 5)", required = false)
          @Nullable Integer k,
      @ToolParam(description = "Restrict retrieval to one document id", required = false)
          @Nullable String documentId) {
    try {
      if (question == null || question.isBlank()) {
        return "Error: Question must not be empty.";
      }
      int depth = k != null ? k : defaultK;
      AnswerResult result =
          ragPipeline.ask(
              question, depth, documentId == null || documentId.isBlank() ? null : documentId);

      StringBuilder sb = new StringBuilder();
      sb.append(result.answerText().strip()).append("\n\n");
      if (result.contexts().isEmpty()) {
        sb.append("No contexts retrieved.\n");
      } else {
        sb.append("Contexts:\n");
        for (RetrievedContext context : result.contexts()) {
          sb.append(
              String.format(
                  Locale.US,
                  "- %s (%.4f): %s%n",
                  context.chunkId(),
                  context.similarityScore(),
                  preview(context.text())));
        }
      }
      sb.append(
          "Model: %s | latency: %d ms | tokens: %d prompt, %d completion"
              .formatted(
                  result.model(),
                  result.generationLatencyMs(),
                  result.tokenUsage().promptTokens(),
                  result.tokenUsage().completionTokens()));
      return sb.toString();
    } catch (Exception e) {
      return "Error answering question: " + e.getMessage();
    }
  }

  /** Ingests every {@code .txt} and {@code .md} file of a directory. */
  @Tool(
      name = "ingest_directory",
      description =
          "Ingest all .txt and .md files of a directory into the vector index. "
              + "Unchanged documents are skipped; changed documents are re-chunked.")
  public String ingestDirectory(
      @ToolParam(description = "Absolute path of the corpus directory") @Nullable String path) {
    try {
      if (path == null || path.isBlank()) {
        return "Error: Path must not be empty.";
      }
      IngestionService.DirectoryIngestResult result =
          ingestionService.ingestDirectory(Path.of(path));
      String summary =
          "Ingested %d document(s), %d unchanged, %d chunk(s) stored."
              .formatted(
                  result.documentsIngested(), result.documentsSkipped(), result.chunksStored());
      if (!result.failedDocuments().isEmpty()) {
        summary += " Failed: " + String.join(", ", result.failedDocuments());
      }
      return summary;
    } catch (Exception e) {
      return "Error ingesting directory: " + e.getMessage();
    }
  }

  /** Starts an asynchronous evaluation run. Unset options fall back to configured defaults. */
  @Tool(
      name = "run_eval",
      description =
          "Start an evaluation run over a dataset (<dataset-dir>/<datasetId>.jsonl). "
              + "Each item is answered by the RAG pipeline and scored by an LLM judge. "
              + "Returns the run ID; check progress with get_run_summary.")
  public String runEval(
      @ToolParam(description = "Dataset id (file name without .jsonl)") @Nullable String datasetId,
      @ToolParam(description = "Retrieval depth", required = false) @Nullable Integer k,
      @ToolParam(description = "Items processed in parallel", required = false)
          @Nullable Integer concurrency,
      @ToolParam(description = "Pass threshold in [0, 1] (default 0.7)", required = false)
          @Nullable Double passThreshold,
      @ToolParam(description = "Judge model", required = false) @Nullable String judgeModel,
      @ToolParam(description = "Generation model", required = false)
          @Nullable String generationModel,
      @ToolParam(description = "Retries per model call", required = false)
          @Nullable Integer maxRetries,
      @ToolParam(description = "Timeout per model call attempt in ms", required = false)
          @Nullable Long timeoutMs) {
    try {
      if (datasetId == null || datasetId.isBlank()) {
        return "Error: Dataset id must not be empty.";
      }
      EvalConfig defaults = evalRunService.defaultConfig();
      EvalConfig config =
          new EvalConfig(
              Objects.requireNonNullElse(k, defaults.k()),
              Objects.requireNonNullElse(concurrency, defaults.concurrency()),
              Objects.requireNonNullElse(passThreshold, defaults.passThreshold()),
              orDefault(judgeModel, defaults.judgeModel()),
              orDefault(generationModel, defaults.generationModel()),
              Objects.requireNonNullElse(maxRetries, defaults.maxRetries()),
              Objects.requireNonNullElse(timeoutMs, defaults.timeoutMs()));
      String runId = evalRunService.runEval(datasetId, config);
      return "Run %s started on dataset '%s'. Check progress with get_run_summary."
          .formatted(runId, datasetId);
    } catch (Exception e) {
      return "Error starting evaluation: " + e.getMessage();
    }
  }

  /** Returns the summary of a finished run, or its progress while it is running. */
  @Tool(
      name = "get_run_summary",
      description =
          "Get the metrics of an evaluation run: per-axis mean, median and pass rate, overall score, "
              + "failure rates, latency percentiles, token usage and cost. "
              + "Reports progress while the run is still in progress.")
  public String getRunSummary(@ToolParam(description = "Run ID") @Nullable String runId) {
    try {
      if (runId == null || runId.isBlank()) {
        return "Error: Run ID must not be empty.";
      }
      Optional<EvalRunSummary> summary = evalRunService.getRunSummary(runId);
      if (summary.isPresent()) {
        return formatSummary(summary.get());
      }
      Optional<RunProgress> progress = evalRunService.getRunProgress(runId);
      if (progress.isPresent()) {
        return formatProgress(progress.get());
      }
      Optional<RunRecord> run = evalRunService.getRun(runId);
      if (run.isPresent()) {
        RunRecord record = run.get();
        return "Run %s on '%s': %s%s"
            .formatted(
                record.runId(),
                record.datasetId(),
                record.status(),
                record.error() != null ? " (" + record.error() + ")" : "");
      }
      return "Error: Run %s not found.".formatted(runId);
    } catch (Exception e) {
      return "Error reading run summary: " + e.getMessage();
    }
  }

  /** Lists the item results of a run in dataset order. */
  @Tool(
      name = "get_run_items",
      description =
          "List the per-item results of an evaluation run in dataset order: status, judge scores, "
              + "answer preview and error.")
  public String getRunItems(@ToolParam(description = "Run ID") @Nullable String runId) {
    try {
      if (runId == null || runId.isBlank()) {
        return "Error: Run ID must not be empty.";
      }
      List<EvalItemResult> items = evalRunService.getRunItems(runId);
      if (items.isEmpty()) {
        return "No item results for run %s.".formatted(runId);
      }
      StringBuilder sb = new StringBuilder();
      for (EvalItemResult item : items) {
        sb.append("- ").append(item.itemId()).append(" [").append(item.status()).append("]");
        JudgeVerdict verdict = item.verdict();
        if (item.scored() && verdict != null) {
          sb.append(
              String.format(
                  Locale.US,
                  " correctness %.2f, faithfulness %.2f, context relevance %.2f",
                  verdict.correctnessScore(),
                  verdict.faithfulnessScore(),
                  verdict.contextRelevanceScore()));
        }
        AnswerResult answer = item.answer();
        if (answer != null) {
          sb.append(" | answer: ").append(preview(answer.answerText()));
        }
        if (item.error() != null) {
          sb.append(" | error: ").append(item.error());
        }
        sb.append('\n');
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error reading run items: " + e.getMessage();
    }
  }

  /** Requests cancellation of a running evaluation. */
  @Tool(
      name = "cancel_run",
      description =
          "Cancel an evaluation run. Items not yet started are skipped, items in progress finish, "
              + "and a summary flagged as cancelled is produced.")
  public String cancelRun(@ToolParam(description = "Run ID") @Nullable String runId) {
    try {
      if (runId == null || runId.isBlank()) {
        return "Error: Run ID must not be empty.";
      }
      if (evalRunService.cancelRun(runId)) {
        return "Cancellation requested for run %s.".formatted(runId);
      }
      return "Error: Run %s is not running.".formatted(runId);
    } catch (Exception e) {
      return "Error cancelling run: " + e.getMessage();
    }
  }

  /** Writes a finished run to CSV files. */
  @Tool(
      name = "export_run",
      description = "Export a finished evaluation run to summary and per-item CSV files.")
  public String exportRun(@ToolParam(description = "Run ID") @Nullable String runId) {
    try {
      if (runId == null || runId.isBlank()) {
        return "Error: Run ID must not be empty.";
      }
      List<Path> paths = evalRunService.exportRun(runId);
      return "Exported run %s to %s and %s".formatted(runId, paths.get(0), paths.get(1));
    } catch (Exception e) {
      return "Error exporting run: " + e.getMessage();
    }
  }

  /** Generates a synthetic question/answer dataset from indexed chunks. */
  @Tool(
      name = "generate_dataset",
      description =
          "Generate a synthetic evaluation dataset: samples indexed chunks and asks the generation "
              + "model for one factoid question and answer per chunk.")
  public String generateDataset(
      @ToolParam(description = "Dataset id to write") @Nullable String datasetId,
      @ToolParam(description = "Number of chunks to sample (default 10)", required = false)
          @Nullable Integer count,
      @ToolParam(description = "Sampling seed (default 0)", required = false) @Nullable Long seed) {
    try {
      if (datasetId == null || datasetId.isBlank()) {
        return "Error: Dataset id must not be empty.";
      }
      QaPairGenerator.GeneratedDataset dataset =
          qaPairGenerator.generate(
              datasetId,
              Objects.requireNonNullElse(count, DEFAULT_GENERATED_ITEMS),
              Objects.requireNonNullElse(seed, 0L));
      return "Dataset '%s' written to %s: %d item(s) from %d sampled chunk(s)."
          .formatted(
              dataset.datasetId(), dataset.path(), dataset.itemsWritten(), dataset.chunksSampled());
    } catch (Exception e) {
      return "Error generating dataset: " + e.getMessage();
    }
  }

  /** Returns index statistics: documents, chunks and embedding configuration. */
  @Tool(
      name = "index_statistics",
      description = "Get index statistics: document count, chunk count and embedding model.")
  public String indexStatistics() {
    try {
      return "Documents: %d | chunks: %d | embeddings: %s, %d dimensions"
          .formatted(
              documentRecordRepository.count(),
              vectorIndex.size(),
              embeddingProperties.getProvider(),
              embeddingProperties.getDimension());
    } catch (Exception e) {
      return "Error retrieving index statistics: " + e.getMessage();
    }
  }

  private static String formatSummary(EvalRunSummary s) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        "Run %s on '%s'%s%n"
            .formatted(s.runId(), s.datasetId(), s.cancelled() ? " (cancelled)" : ""));
    sb.append(
        "Items: %d | success: %d | partial: %d | failed: %d | invalid verdicts: %d%n"
            .formatted(
                s.itemCount(),
                s.successCount(),
                s.partialCount(),
                s.failedCount(),
                s.invalidVerdictCount()));
    appendAxis(sb, "Correctness", s.correctness(), s.passThreshold());
    appendAxis(sb, "Faithfulness", s.faithfulness(), s.passThreshold());
    appendAxis(sb, "Context relevance", s.contextRelevance(), s.passThreshold());
    sb.append(
        String.format(
            Locale.US,
            "Overall score: %s | partial failure rate: %.1f%% | failure rate: %.1f%%%n",
            score(s.overallScore()),
            s.partialFailureRate() * 100,
            s.failureRate() * 100));
    sb.append(
        String.format(
            Locale.US,
            "Latency p50: %s ms | p95: %s ms | tokens: %d prompt, %d completion | cost: %.4f",
            millis(s.latencyP50Ms()),
            millis(s.latencyP95Ms()),
            s.promptTokens(),
            s.completionTokens(),
            s.estimatedCost()));
    return sb.toString();
  }

  private static void appendAxis(
      StringBuilder sb, String name, AxisStatistics axis, double threshold) {
    sb.append(
        String.format(
            Locale.US,
            "%s: mean %s, median %s, pass rate %.1f%% (>= %.2f, %d scored)%n",
            name,
            score(axis.mean()),
            score(axis.median()),
            axis.passRate() * 100,
            threshold,
            axis.scoredCount()));
  }

  private static String formatProgress(RunProgress p) {
    String text =
        "Run %s on '%s': %s | %d/%d items done (%d success, %d partial, %d failed)"
            .formatted(
                p.runId(),
                p.datasetId(),
                p.cancelRequested() && !p.status().isTerminal() ? "CANCELLING" : p.status(),
                p.itemsCompleted(),
                p.itemsTotal(),
                p.succeeded(),
                p.partial(),
                p.failed());
    return p.error() != null ? text + " | error: " + p.error() : text;
  }

  private static String score(double value) {
    return Double.isNaN(value) ? "n/a" : String.format(Locale.US, "%.3f", value);
  }

  private static String millis(double value) {
    return Double.isNaN(value) ? "n/a" : String.format(Locale.US, "%.0f", value);
  }

  private static String preview(String text) {
    String flat = text.strip().replaceAll("\\s+", " ");
    return flat.length() <= MAX_PREVIEW_CHARS ? flat : flat.substring(0, MAX_PREVIEW_CHARS) + "...";
  }

  private static String orDefault(@Nullable String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
