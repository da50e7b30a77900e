package dev.evalrag.eval;

import static org.assertj.core.api.Assertions.assertThat;

import dev.evalrag.fixture.EvalItemResultBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EvaluationExporterTest {

  @TempDir Path tempDir;

  private EvaluationExporter exporter;
  private MetricsAggregator aggregator;

  @BeforeEach
  void setUp() {
    EvalProperties properties = new EvalProperties();
    properties.setOutputDir(tempDir.toString());
    exporter =
        new EvaluationExporter(
            properties, Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    aggregator = new MetricsAggregator(properties);
  }

  @Test
  void writesSummaryAndItemFilesNamedByTimestampDatasetAndRun() throws IOException {
    List<EvalItemResult> results = List.of(new EvalItemResultBuilder().id("q1").build());
    EvalRunSummary summary = aggregator.aggregate("run-1", "capitals", results, 0.7, false);

    List<Path> paths = exporter.export(summary, results);

    assertThat(paths)
        .containsExactly(
            tempDir.resolve("eval-summary-2026-03-01T12-00-00-capitals-run-1.csv"),
            tempDir.resolve("eval-items-2026-03-01T12-00-00-capitals-run-1.csv"));
    List<String> summaryLines = Files.readAllLines(paths.get(0));
    assertThat(summaryLines).hasSize(2);
    assertThat(summaryLines.get(0)).startsWith("run_id,dataset_id,item_count");
    assertThat(summaryLines.get(1)).startsWith("run-1,capitals,1,1,0,0,0,1.0000,1.0000,1.0000");
    assertThat(summaryLines.get(1)).endsWith(",false");
  }

  @Test
  void itemRowsEscapeTextAndLeaveMissingScoresEmpty() throws IOException {
    List<EvalItemResult> results =
        List.of(
            new EvalItemResultBuilder()
                .id("q1")
                .answerText("Paris, \"the\" capital")
                .scores(0.5, 1.0, 0.25)
                .latencyMs(120)
                .tokens(30, 4)
                .build(),
            new EvalItemResultBuilder().id("q2").rejected("JudgeError: not JSON"),
            new EvalItemResultBuilder().id("q3").failed("GenerationError: 503"));
    EvalRunSummary summary = aggregator.aggregate("run-1", "capitals", results, 0.7, false);

    List<String> lines = Files.readAllLines(exporter.export(summary, results).get(1));

    assertThat(lines).hasSize(4);
    assertThat(lines.get(0))
        .isEqualTo(
            "item_id,status,question,answer,correctness,faithfulness,context_relevance,"
                + "latency_ms,prompt_tokens,completion_tokens,error");
    assertThat(lines.get(1))
        .isEqualTo(
            "q1,SUCCESS,What is the capital of France?,\"Paris, \"\"the\"\" capital\","
                + "0.5000,1.0000,0.2500,120,30,4,");
    assertThat(lines.get(2))
        .isEqualTo("q2,PARTIAL,What is the capital of France?,Paris.,,,,100,10,5,JudgeError: not JSON");
    assertThat(lines.get(3))
        .isEqualTo("q3,FAILED,What is the capital of France?,,,,,,,,GenerationError: 503");
  }

  @Test
  void undefinedAxesAreWrittenAsEmptyCells() throws IOException {
    List<EvalItemResult> results =
        List.of(new EvalItemResultBuilder().id("q1").failed("RetrievalError: down"));
    EvalRunSummary summary = aggregator.aggregate("run-2", "capitals", results, 0.7, false);

    String row = Files.readAllLines(exporter.export(summary, results).get(0)).get(1);

    assertThat(row).startsWith("run-2,capitals,1,0,0,1,0,,,0.0000,");
  }
}
