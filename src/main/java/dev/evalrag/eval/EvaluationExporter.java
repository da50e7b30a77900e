package dev.evalrag.eval;

import dev.evalrag.judge.JudgeVerdict;
import dev.evalrag.rag.AnswerResult;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;

/**
 * Exports run results to CSV files for comparing pipeline configurations over time.
 *
 * <p>Produces two CSV files per export under {@code evalrag.eval.output-dir}: a one-row summary CSV
 * with the run metrics, and a detailed CSV with one row per item.
 */
@Service
public class EvaluationExporter {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss");

  private static final String SUMMARY_HEADER =
      "run_id,dataset_id,item_count,success,partial,failed,invalid_verdicts,"
          + "correctness_mean,correctness_median,correctness_pass_rate,"
          + "faithfulness_mean,faithfulness_median,faithfulness_pass_rate,"
          + "context_relevance_mean,context_relevance_median,context_relevance_pass_rate,"
          + "overall_score,partial_failure_rate,failure_rate,latency_p50_ms,latency_p95_ms,"
          + "prompt_tokens,completion_tokens,estimated_cost,cancelled";

  private static final String ITEMS_HEADER =
      "item_id,status,question,answer,correctness,faithfulness,context_relevance,"
          + "latency_ms,prompt_tokens,completion_tokens,error";

  private final Path outputDir;
  private final Clock clock;

  public EvaluationExporter(EvalProperties properties, Clock clock) {
    this.outputDir = Path.of(properties.getOutputDir());
    this.clock = clock;
  }

  /**
   * Exports a run to summary and detailed CSV files.
   *
   * @param summary the run summary
   * @param results the item results in dataset order
   * @return the paths to the two generated CSV files (summary first, detailed second)
   * @throws IOException if file writing fails
   */
  public List<Path> export(EvalRunSummary summary, List<EvalItemResult> results)
      throws IOException {
    Files.createDirectories(outputDir);

    String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    String label = summary.datasetId() + "-" + summary.runId();
    Path summaryPath = outputDir.resolve("eval-summary-%s-%s.csv".formatted(timestamp, label));
    Path itemsPath = outputDir.resolve("eval-items-%s-%s.csv".formatted(timestamp, label));

    writeSummaryCsv(summary, summaryPath);
    writeItemsCsv(results, itemsPath);

    return List.of(summaryPath, itemsPath);
  }

  private void writeSummaryCsv(EvalRunSummary s, Path path) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path)) {
      writer.write(SUMMARY_HEADER);
      writer.newLine();
      writer.write(
          String.join(
              ",",
              escapeCsv(s.runId()),
              escapeCsv(s.datasetId()),
              Integer.toString(s.itemCount()),
              Integer.toString(s.successCount()),
              Integer.toString(s.partialCount()),
              Integer.toString(s.failedCount()),
              Integer.toString(s.invalidVerdictCount()),
              number(s.correctness().mean()),
              number(s.correctness().median()),
              number(s.correctness().passRate()),
              number(s.faithfulness().mean()),
              number(s.faithfulness().median()),
              number(s.faithfulness().passRate()),
              number(s.contextRelevance().mean()),
              number(s.contextRelevance().median()),
              number(s.contextRelevance().passRate()),
              number(s.overallScore()),
              number(s.partialFailureRate()),
              number(s.failureRate()),
              number(s.latencyP50Ms()),
              number(s.latencyP95Ms()),
              Long.toString(s.promptTokens()),
              Long.toString(s.completionTokens()),
              String.format(Locale.US, "%.6f", s.estimatedCost()),
              Boolean.toString(s.cancelled())));
      writer.newLine();
    }
  }

  private void writeItemsCsv(List<EvalItemResult> results, Path path) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path)) {
      writer.write(ITEMS_HEADER);
      writer.newLine();

      for (EvalItemResult result : results) {
        AnswerResult answer = result.answer();
        JudgeVerdict verdict = result.scored() ? result.verdict() : null;
        writer.write(
            String.join(
                ",",
                escapeCsv(result.itemId()),
                result.status().name(),
                escapeCsv(result.item().question()),
                answer != null ? escapeCsv(answer.answerText()) : "",
                verdict != null ? number(verdict.correctnessScore()) : "",
                verdict != null ? number(verdict.faithfulnessScore()) : "",
                verdict != null ? number(verdict.contextRelevanceScore()) : "",
                answer != null ? Long.toString(answer.generationLatencyMs()) : "",
                answer != null ? Long.toString(answer.tokenUsage().promptTokens()) : "",
                answer != null ? Long.toString(answer.tokenUsage().completionTokens()) : "",
                escapeCsv(result.error())));
        writer.newLine();
      }
    }
  }

  /** Four decimals; empty for {@code NaN}. */
  private static String number(double value) {
    return Double.isNaN(value) ? "" : String.format(Locale.US, "%.4f", value);
  }

  private static String escapeCsv(@Nullable String value) {
    if (value == null) {
      return "";
    }
    if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
