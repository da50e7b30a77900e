package dev.evalrag.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.evalrag.error.DatasetException;
import dev.evalrag.eval.store.ResultStore;
import dev.evalrag.fixture.EvalItemResultBuilder;
import dev.evalrag.generation.GenerationProperties;
import dev.evalrag.judge.JudgeProperties;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
class EvalRunServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final EvalConfig CONFIG = new EvalConfig(3, 2, 0.7, "judge", "gen", 1, 1000);

  @Mock DatasetLoader datasetLoader;
  @Mock EvalRunner runner;
  @Mock ResultStore resultStore;
  @Mock EvaluationExporter exporter;

  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
  private RunProgressTracker tracker;
  private EvalProperties evalProperties;

  @BeforeEach
  void setUp() {
    tracker = new RunProgressTracker(clock);
    evalProperties = new EvalProperties();
  }

  private EvalRunService service(TaskExecutor executor) {
    GenerationProperties generationProperties = new GenerationProperties();
    generationProperties.setModel("gpt-gen");
    JudgeProperties judgeProperties = new JudgeProperties();
    judgeProperties.setModel("gpt-judge");
    return new EvalRunService(
        datasetLoader,
        runner,
        tracker,
        resultStore,
        exporter,
        evalProperties,
        generationProperties,
        judgeProperties,
        executor,
        clock);
  }

  @Test
  void defaultConfigCombinesEvalDefaultsWithConfiguredModels() {
    EvalConfig config = service(new SyncTaskExecutor()).defaultConfig();

    assertThat(config.generationModel()).isEqualTo("gpt-gen");
    assertThat(config.judgeModel()).isEqualTo("gpt-judge");
    assertThat(config.k()).isEqualTo(evalProperties.getK());
  }

  @Test
  void completedRunStoresItemsAndSummary() {
    EvalItemResult result = new EvalItemResultBuilder().id("q1").build();
    List<EvalDatasetItem> items = List.of(new EvalItemResultBuilder().id("q1").item());
    EvalRunSummary summary =
        new MetricsAggregator(evalProperties)
            .aggregate("run", "capitals", List.of(result), 0.7, false);
    when(datasetLoader.load("capitals")).thenReturn(items);
    when(runner.run(anyString(), eq("capitals"), eq(items), eq(CONFIG), any(), any()))
        .thenAnswer(
            invocation -> {
              EvalRunListener listener = invocation.getArgument(5);
              listener.onItemState("q1", ItemState.RETRIEVING);
              listener.onItemState("q1", ItemState.SUCCESS);
              listener.onItemCompleted(0, result);
              return new EvalRunOutcome(RunStatus.COMPLETED, List.of(result), summary, null);
            });

    String runId = service(new SyncTaskExecutor()).runEval("capitals", CONFIG);

    assertThat(UUID.fromString(runId)).isNotNull();
    verify(resultStore).createRun(runId, "capitals", NOW);
    verify(resultStore).saveItem(runId, 0, result);
    verify(resultStore).completeRun(runId, RunStatus.COMPLETED, summary, null, NOW);
    RunProgress progress = tracker.getProgress(runId).orElseThrow();
    assertThat(progress.status()).isEqualTo(RunStatus.COMPLETED);
    assertThat(progress.itemsTotal()).isEqualTo(1);
    assertThat(progress.succeeded()).isEqualTo(1);
  }

  @Test
  void missingDatasetFailsTheRunButStillReturnsItsId() {
    when(datasetLoader.load("absent"))
        .thenThrow(new DatasetException("Dataset not found: datasets/absent.jsonl"));

    String runId = service(new SyncTaskExecutor()).runEval("absent", CONFIG);

    verify(resultStore)
        .completeRun(
            runId,
            RunStatus.FAILED,
            null,
            "DatasetError: Dataset not found: datasets/absent.jsonl",
            NOW);
    verifyNoInteractions(runner);
    assertThat(tracker.getProgress(runId).orElseThrow().status()).isEqualTo(RunStatus.FAILED);
  }

  @Test
  void unexpectedRunnerErrorFailsTheRun() {
    when(datasetLoader.load("capitals")).thenReturn(List.of());
    when(runner.run(anyString(), anyString(), any(), any(), any(), any()))
        .thenThrow(new IllegalStateException("pool exploded"));

    String runId = service(new SyncTaskExecutor()).runEval("capitals", CONFIG);

    verify(resultStore)
        .completeRun(
            runId, RunStatus.FAILED, null, "java.lang.IllegalStateException: pool exploded", NOW);
  }

  @Test
  void rejectedRunIsMarkedFailedAndRethrown() {
    EvalRunService service =
        service(
            task -> {
              throw new TaskRejectedException("queue full");
            });

    assertThatThrownBy(() -> service.runEval("capitals", CONFIG))
        .isInstanceOf(TaskRejectedException.class);
    verify(resultStore)
        .completeRun(
            anyString(),
            eq(RunStatus.FAILED),
            isNull(),
            eq("Run rejected: too many runs in progress"),
            eq(NOW));
    verifyNoInteractions(datasetLoader);
  }

  @Test
  void cancellationIsVisibleToTheRunner() {
    List<Runnable> queued = new ArrayList<>();
    EvalRunService service = service(queued::add);
    when(datasetLoader.load("capitals")).thenReturn(List.of());
    when(runner.run(anyString(), anyString(), any(), any(), any(), any()))
        .thenAnswer(
            invocation -> {
              BooleanSupplier cancelled = invocation.getArgument(4);
              assertThat(cancelled.getAsBoolean()).isTrue();
              return new EvalRunOutcome(RunStatus.CANCELLED, List.of(), null, null);
            });

    String runId = service.runEval("capitals", CONFIG);
    assertThat(service.cancelRun(runId)).isTrue();
    queued.forEach(Runnable::run);

    verify(resultStore).completeRun(runId, RunStatus.CANCELLED, null, null, NOW);
    assertThat(service.cancelRun(runId)).isFalse();
  }

  @Test
  void cancellingUnknownRunIsRefused() {
    assertThat(service(new SyncTaskExecutor()).cancelRun("nope")).isFalse();
  }

  @Test
  void exportRequiresASummary() {
    when(resultStore.findSummary("run-1")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service(new SyncTaskExecutor()).exportRun("run-1"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("No summary for run run-1");
    verifyNoInteractions(exporter);
  }

  @Test
  void exportWritesStoredSummaryAndItems() throws IOException {
    EvalItemResult result = new EvalItemResultBuilder().build();
    EvalRunSummary summary =
        new MetricsAggregator(evalProperties)
            .aggregate("run-1", "capitals", List.of(result), 0.7, false);
    when(resultStore.findSummary("run-1")).thenReturn(Optional.of(summary));
    when(resultStore.findItems("run-1")).thenReturn(List.of(result));
    when(exporter.export(summary, List.of(result)))
        .thenReturn(List.of(Path.of("summary.csv"), Path.of("items.csv")));

    assertThat(service(new SyncTaskExecutor()).exportRun("run-1"))
        .containsExactly(Path.of("summary.csv"), Path.of("items.csv"));
    verify(resultStore, never()).completeRun(any(), any(), any(), any(), any());
  }
}
