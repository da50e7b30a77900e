package dev.evalrag.mcp;

import dev.evalrag.config.EmbeddingProperties;
import dev.evalrag.document.DocumentRecordRepository;
import dev.evalrag.eval.EvalConfig;
import dev.evalrag.eval.EvalItemResult;
import dev.evalrag.eval.EvalProperties;
import dev.evalrag.eval.EvalRunService;
import dev.evalrag.eval.EvalRunSummary;
import dev.evalrag.eval.MetricsAggregator;
import dev.evalrag.eval.QaPairGenerator;
import dev.evalrag.eval.RunProgress;
import dev.evalrag.eval.RunStatus;
import dev.evalrag.eval.store.RunRecord;
import dev.evalrag.fixture.EvalItemResultBuilder;
import dev.evalrag.generation.TokenUsage;
import dev.evalrag.index.VectorIndex;
import dev.evalrag.ingestion.IngestionService;
import dev.evalrag.rag.AnswerResult;
import dev.evalrag.rag.RagPipeline;
import dev.evalrag.retrieval.RetrievalProperties;
import dev.evalrag.retrieval.RetrievedContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

    private static final EvalConfig DEFAULTS = new EvalConfig(5, 2, 0.7, "gpt-judge", "gpt-gen", 3, 30_000);

    @Mock
    RagPipeline ragPipeline;

    @Mock
    IngestionService ingestionService;

    @Mock
    EvalRunService evalRunService;

    @Mock
    QaPairGenerator qaPairGenerator;

    @Mock
    VectorIndex vectorIndex;

    @Mock
    DocumentRecordRepository documentRecordRepository;

    @Captor
    ArgumentCaptor<EvalConfig> configCaptor;

    McpToolService mcpToolService;

    @BeforeEach
    void setUp() {
        mcpToolService = new McpToolService(
                ragPipeline, ingestionService, evalRunService, qaPairGenerator,
                vectorIndex, documentRecordRepository, new RetrievalProperties(), new EmbeddingProperties());
    }

    private static EvalRunSummary summary(List<EvalItemResult> results) {
        return new MetricsAggregator(new EvalProperties()).aggregate("run-1", "capitals", results, 0.7, false);
    }

    // --- ask ---

    @Test
    void askFormatsAnswerAndContexts() {
        AnswerResult answer = new AnswerResult(
                "Capital of France?",
                "Paris.",
                List.of(new RetrievedContext("france.txt#0", "Paris is the capital of France.", 0.9123)),
                42,
                new TokenUsage(120, 3),
                "gpt-gen");
        given(ragPipeline.ask("Capital of France?", 5, null)).willReturn(answer);

        String output = mcpToolService.ask("Capital of France?", null, null);

        assertThat(output).startsWith("Paris.");
        assertThat(output).contains("- france.txt#0 (0.9123): Paris is the capital of France.");
        assertThat(output).contains("Model: gpt-gen | latency: 42 ms | tokens: 120 prompt, 3 completion");
    }

    @Test
    void askPassesDepthAndDocumentFilter() {
        given(ragPipeline.ask("q", 2, "guide.md"))
                .willReturn(new AnswerResult("q", "a", List.of(), 1, TokenUsage.ZERO, "gpt-gen"));

        String output = mcpToolService.ask("q", 2, "guide.md");

        assertThat(output).contains("No contexts retrieved.");
    }

    @Test
    void askWithBlankQuestionReturnsError() {
        assertThat(mcpToolService.ask("  ", null, null)).startsWith("Error:");
        verifyNoInteractions(ragPipeline);
    }

    @Test
    void askHandlesExceptionGracefully() {
        given(ragPipeline.ask(anyString(), anyInt(), any())).willThrow(new IllegalStateException("index down"));

        String output = mcpToolService.ask("q", null, null);

        assertThat(output).startsWith("Error");
        assertThat(output).contains("index down");
    }

    // --- ingest_directory ---

    @Test
    void ingestDirectoryReportsCountsAndFailures() {
        given(ingestionService.ingestDirectory(Path.of("/corpus")))
                .willReturn(new IngestionService.DirectoryIngestResult(2, 1, 17, List.of("broken.txt")));

        String output = mcpToolService.ingestDirectory("/corpus");

        assertThat(output).isEqualTo(
                "Ingested 2 document(s), 1 unchanged, 17 chunk(s) stored. Failed: broken.txt");
    }

    // --- run_eval ---

    @Test
    void runEvalFillsUnsetOptionsFromDefaults() {
        given(evalRunService.defaultConfig()).willReturn(DEFAULTS);
        given(evalRunService.runEval(eq("capitals"), configCaptor.capture())).willReturn("run-1");

        String output = mcpToolService.runEval("capitals", 3, null, 0.5, null, "gpt-other", null, null);

        assertThat(output).contains("Run run-1 started");
        assertThat(configCaptor.getValue())
                .isEqualTo(new EvalConfig(3, 2, 0.5, "gpt-judge", "gpt-other", 3, 30_000));
    }

    @Test
    void runEvalReportsInvalidOptions() {
        given(evalRunService.defaultConfig()).willReturn(DEFAULTS);

        String output = mcpToolService.runEval("capitals", 0, null, null, null, null, null, null);

        assertThat(output).startsWith("Error");
        assertThat(output).contains("k must be at least 1");
        verify(evalRunService, never()).runEval(anyString(), any());
    }

    @Test
    void runEvalWithoutDatasetReturnsError() {
        assertThat(mcpToolService.runEval(null, null, null, null, null, null, null, null)).startsWith("Error:");
    }

    // --- get_run_summary ---

    @Test
    void runSummaryShowsMetricsOfFinishedRun() {
        EvalRunSummary summary = summary(List.of(
                new EvalItemResultBuilder().id("q1").scores(1.0, 1.0, 1.0).build(),
                new EvalItemResultBuilder().id("q2").rejected("JudgeError: not JSON")));
        given(evalRunService.getRunSummary("run-1")).willReturn(Optional.of(summary));

        String output = mcpToolService.getRunSummary("run-1");

        assertThat(output).contains("Run run-1 on 'capitals'");
        assertThat(output).contains("Items: 2 | success: 1 | partial: 1 | failed: 0 | invalid verdicts: 1");
        assertThat(output).contains("Correctness: mean 1.000, median 1.000, pass rate 100.0%");
        assertThat(output).contains("partial failure rate: 50.0%");
    }

    @Test
    void runSummaryShowsUndefinedAxesAsNotAvailable() {
        EvalRunSummary summary = summary(List.of(new EvalItemResultBuilder().failed("RetrievalError: down")));
        given(evalRunService.getRunSummary("run-1")).willReturn(Optional.of(summary));

        String output = mcpToolService.getRunSummary("run-1");

        assertThat(output).contains("Correctness: mean n/a, median n/a, pass rate 0.0%");
        assertThat(output).contains("Overall score: n/a");
    }

    @Test
    void runSummaryShowsProgressWhileRunning() {
        given(evalRunService.getRunSummary("run-1")).willReturn(Optional.empty());
        given(evalRunService.getRunProgress("run-1")).willReturn(Optional.of(new RunProgress(
                "run-1", "capitals", RunStatus.RUNNING, 4, 1, 0, 1, Map.of(), true, null,
                Instant.parse("2026-03-01T12:00:00Z"))));

        String output = mcpToolService.getRunSummary("run-1");

        assertThat(output).isEqualTo(
                "Run run-1 on 'capitals': CANCELLING | 2/4 items done (1 success, 0 partial, 1 failed)");
    }

    @Test
    void runSummaryFallsBackToStoredRun() {
        given(evalRunService.getRunSummary("run-0")).willReturn(Optional.empty());
        given(evalRunService.getRunProgress("run-0")).willReturn(Optional.empty());
        given(evalRunService.getRun("run-0")).willReturn(Optional.of(new RunRecord(
                "run-0", "capitals", RunStatus.FAILED, "DatasetError: Dataset not found",
                Instant.parse("2026-03-01T12:00:00Z"), Instant.parse("2026-03-01T12:00:01Z"))));

        String output = mcpToolService.getRunSummary("run-0");

        assertThat(output).isEqualTo("Run run-0 on 'capitals': FAILED (DatasetError: Dataset not found)");
    }

    @Test
    void runSummaryOfUnknownRunReturnsError() {
        given(evalRunService.getRunSummary("nope")).willReturn(Optional.empty());
        given(evalRunService.getRunProgress("nope")).willReturn(Optional.empty());
        given(evalRunService.getRun("nope")).willReturn(Optional.empty());

        assertThat(mcpToolService.getRunSummary("nope")).isEqualTo("Error: Run nope not found.");
    }

    // --- get_run_items ---

    @Test
    void runItemsListsStatusScoresAndErrors() {
        given(evalRunService.getRunItems("run-1")).willReturn(List.of(
                new EvalItemResultBuilder().id("q1").scores(0.5, 1.0, 0.25).build(),
                new EvalItemResultBuilder().id("q2").failed("GenerationError: 503")));

        String output = mcpToolService.getRunItems("run-1");

        assertThat(output).contains(
                "- q1 [SUCCESS] correctness 0.50, faithfulness 1.00, context relevance 0.25 | answer: Paris.");
        assertThat(output).contains("- q2 [FAILED] | error: GenerationError: 503");
    }

    @Test
    void runItemsOfEmptyRun() {
        given(evalRunService.getRunItems("run-1")).willReturn(List.of());

        assertThat(mcpToolService.getRunItems("run-1")).isEqualTo("No item results for run run-1.");
    }

    // --- cancel_run ---

    @Test
    void cancelRunConfirmsRequest() {
        given(evalRunService.cancelRun("run-1")).willReturn(true);

        assertThat(mcpToolService.cancelRun("run-1")).isEqualTo("Cancellation requested for run run-1.");
    }

    @Test
    void cancelRunOfFinishedRunReturnsError() {
        given(evalRunService.cancelRun("run-1")).willReturn(false);

        assertThat(mcpToolService.cancelRun("run-1")).isEqualTo("Error: Run run-1 is not running.");
    }

    // --- export_run ---

    @Test
    void exportRunListsWrittenFiles() throws IOException {
        given(evalRunService.exportRun("run-1")).willReturn(List.of(Path.of("s.csv"), Path.of("i.csv")));

        assertThat(mcpToolService.exportRun("run-1")).isEqualTo("Exported run run-1 to s.csv and i.csv");
    }

    @Test
    void exportRunWithoutSummaryReturnsError() throws IOException {
        given(evalRunService.exportRun("run-1")).willThrow(new IllegalArgumentException("No summary for run run-1"));

        assertThat(mcpToolService.exportRun("run-1")).isEqualTo("Error exporting run: No summary for run run-1");
    }

    // --- generate_dataset ---

    @Test
    void generateDatasetUsesDefaults() {
        given(qaPairGenerator.generate("synthetic", 10, 0L)).willReturn(
                new QaPairGenerator.GeneratedDataset("synthetic", Path.of("datasets/synthetic.jsonl"), 10, 8));

        String output = mcpToolService.generateDataset("synthetic", null, null);

        assertThat(output).isEqualTo(
                "Dataset 'synthetic' written to datasets/synthetic.jsonl: 8 item(s) from 10 sampled chunk(s).");
    }

    // --- index_statistics ---

    @Test
    void indexStatisticsReportsCountsAndEmbeddingSettings() {
        given(documentRecordRepository.count()).willReturn(3L);
        given(vectorIndex.size()).willReturn(42L);

        assertThat(mcpToolService.indexStatistics())
                .isEqualTo("Documents: 3 | chunks: 42 | embeddings: LOCAL, 384 dimensions");
    }
}
