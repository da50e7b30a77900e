package dev.evalrag.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.evalrag.fixture.EvalItemResultBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetricsAggregatorTest {

  private EvalProperties properties;
  private MetricsAggregator aggregator;

  @BeforeEach
  void setUp() {
    properties = new EvalProperties();
    aggregator = new MetricsAggregator(properties);
  }

  private EvalRunSummary aggregate(List<EvalItemResult> results) {
    return aggregator.aggregate("run-1", "capitals", results, 0.7, false);
  }

  @Test
  void singleCorrectItemScoresPerfectly() {
    EvalRunSummary summary = aggregate(List.of(new EvalItemResultBuilder().build()));

    assertThat(summary.itemCount()).isEqualTo(1);
    assertThat(summary.successCount()).isEqualTo(1);
    assertThat(summary.correctness().mean()).isEqualTo(1.0);
    assertThat(summary.correctness().passRate()).isEqualTo(1.0);
    assertThat(summary.overallScore()).isEqualTo(1.0, within(1e-9));
    assertThat(summary.failureRate()).isZero();
  }

  @Test
  void wrongAnswerIsSuccessfulButFailsCorrectnessThreshold() {
    EvalRunSummary summary =
        aggregate(List.of(new EvalItemResultBuilder().answerText("Lyon.").scores(0.0, 1.0, 1.0).build()));

    assertThat(summary.successCount()).isEqualTo(1);
    assertThat(summary.correctness().mean()).isZero();
    assertThat(summary.correctness().passRate()).isZero();
    assertThat(summary.faithfulness().passRate()).isEqualTo(1.0);
  }

  @Test
  void partialItemsAreExcludedFromAxesAndCountedInPartialRate() {
    EvalRunSummary summary =
        aggregate(
            List.of(
                new EvalItemResultBuilder().id("q1").scores(0.5, 0.5, 0.5).build(),
                new EvalItemResultBuilder().id("q2").rejected("JudgeError: not JSON")));

    assertThat(summary.partialCount()).isEqualTo(1);
    assertThat(summary.invalidVerdictCount()).isEqualTo(1);
    assertThat(summary.partialFailureRate()).isEqualTo(0.5);
    assertThat(summary.correctness().scoredCount()).isEqualTo(1);
    assertThat(summary.correctness().mean()).isEqualTo(0.5);
  }

  @Test
  void failedJudgeCallsAreNotCountedAsInvalidVerdicts() {
    EvalRunSummary summary =
        aggregate(
            List.of(
                new EvalItemResultBuilder().id("q1").partial("JudgeError: timed out"),
                new EvalItemResultBuilder().id("q2").rejected("JudgeError: not JSON"),
                new EvalItemResultBuilder().id("q3").build()));

    assertThat(summary.partialCount()).isEqualTo(2);
    assertThat(summary.invalidVerdictCount()).isEqualTo(1);
  }

  @Test
  void axesAreUndefinedWhenNothingWasScored() {
    EvalRunSummary summary =
        aggregate(
            List.of(
                new EvalItemResultBuilder().id("q1").partial("JudgeError: timeout"),
                new EvalItemResultBuilder().id("q2").failed("GenerationError: 503")));

    assertThat(summary.correctness().mean()).isNaN();
    assertThat(summary.correctness().median()).isNaN();
    assertThat(summary.correctness().passRate()).isZero();
    assertThat(summary.correctness().scoredCount()).isZero();
    assertThat(summary.overallScore()).isNaN();
    assertThat(summary.failureRate()).isEqualTo(0.5);
  }

  @Test
  void medianAveragesMiddlePairForEvenCounts() {
    EvalRunSummary summary =
        aggregate(
            List.of(
                new EvalItemResultBuilder().id("a").scores(0.2, 1, 1).build(),
                new EvalItemResultBuilder().id("b").scores(0.4, 1, 1).build(),
                new EvalItemResultBuilder().id("c").scores(0.8, 1, 1).build(),
                new EvalItemResultBuilder().id("d").scores(1.0, 1, 1).build()));

    assertThat(summary.correctness().median()).isEqualTo(0.6, within(1e-9));
    assertThat(summary.correctness().mean()).isEqualTo(0.6, within(1e-9));
    assertThat(summary.correctness().passRate()).isEqualTo(0.5);
  }

  @Test
  void passThresholdIsInclusive() {
    EvalRunSummary summary =
        aggregate(List.of(new EvalItemResultBuilder().scores(0.7, 0.69, 1.0).build()));

    assertThat(summary.correctness().passRate()).isEqualTo(1.0);
    assertThat(summary.faithfulness().passRate()).isZero();
  }

  @Test
  void overallScoreUsesConfiguredWeights() {
    EvalRunSummary summary =
        aggregate(List.of(new EvalItemResultBuilder().scores(1.0, 0.0, 0.5).build()));

    // 0.5 * 1.0 + 0.3 * 0.0 + 0.2 * 0.5
    assertThat(summary.overallScore()).isEqualTo(0.6, within(1e-9));
  }

  @Test
  void latencyPercentilesUseNearestRankOverAnsweredItems() {
    List<EvalItemResult> results = new ArrayList<>();
    for (int i = 1; i <= 20; i++) {
      results.add(new EvalItemResultBuilder().id("q" + i).latencyMs(i * 10L).build());
    }
    results.add(new EvalItemResultBuilder().id("failed").failed("GenerationError: 503"));

    EvalRunSummary summary = aggregate(results);

    assertThat(summary.latencyP50Ms()).isEqualTo(100.0);
    assertThat(summary.latencyP95Ms()).isEqualTo(190.0);
  }

  @Test
  void percentileOfEmptyInputIsUndefined() {
    assertThat(MetricsAggregator.percentile(new long[0], 50)).isNaN();
    assertThat(MetricsAggregator.percentile(new long[] {42}, 95)).isEqualTo(42.0);
  }

  @Test
  void tokensIncludePartialItemsAndCostUsesPricing() {
    properties.getPricing().setPromptPer1k(0.01);
    properties.getPricing().setCompletionPer1k(0.03);
    aggregator = new MetricsAggregator(properties);

    EvalRunSummary summary =
        aggregate(
            List.of(
                new EvalItemResultBuilder().id("q1").tokens(1500, 500).build(),
                new EvalItemResultBuilder().id("q2").tokens(500, 500).partial("JudgeError: x"),
                new EvalItemResultBuilder().id("q3").failed("RetrievalError: down")));

    assertThat(summary.promptTokens()).isEqualTo(2000);
    assertThat(summary.completionTokens()).isEqualTo(1000);
    assertThat(summary.totalTokens()).isEqualTo(3000);
    assertThat(summary.estimatedCost()).isEqualTo(0.05, within(1e-9));
  }

  @Test
  void emptyRunHasZeroRates() {
    EvalRunSummary summary = aggregator.aggregate("run-1", "empty", List.of(), 0.7, true);

    assertThat(summary.itemCount()).isZero();
    assertThat(summary.failureRate()).isZero();
    assertThat(summary.partialFailureRate()).isZero();
    assertThat(summary.latencyP50Ms()).isNaN();
    assertThat(summary.cancelled()).isTrue();
  }

  @Test
  void summaryDoesNotDependOnResultOrder() {
    List<EvalItemResult> results = new ArrayList<>();
    for (int i = 0; i < 15; i++) {
      results.add(
          new EvalItemResultBuilder()
              .id("q" + i)
              .scores((i % 5) / 4.0, (i % 3) / 2.0, 1.0)
              .latencyMs(50L + i * 7)
              .build());
    }
    results.add(new EvalItemResultBuilder().id("p").partial("JudgeError: x"));
    EvalRunSummary expected = aggregate(results);

    List<EvalItemResult> shuffled = new ArrayList<>(results);
    Collections.shuffle(shuffled, new Random(7));

    assertThat(aggregate(shuffled)).isEqualTo(expected);
  }
}
