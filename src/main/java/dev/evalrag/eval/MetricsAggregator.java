package dev.evalrag.eval;

import dev.evalrag.judge.JudgeVerdict;
import dev.evalrag.rag.AnswerResult;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import org.springframework.stereotype.Component;

/**
 * Reduces item results to an {@link EvalRunSummary}.
 *
 * <p>Pure: the summary depends only on the results, the threshold and the configured weights and
 * prices, never on the order results arrive in. Percentiles use the nearest-rank method.
 */
@Component
public class MetricsAggregator {

  private final double correctnessWeight;
  private final double faithfulnessWeight;
  private final double contextRelevanceWeight;
  private final double promptPricePer1k;
  private final double completionPricePer1k;

  public MetricsAggregator(EvalProperties properties) {
    this.correctnessWeight = properties.getWeights().getCorrectness();
    this.faithfulnessWeight = properties.getWeights().getFaithfulness();
    this.contextRelevanceWeight = properties.getWeights().getContextRelevance();
    this.promptPricePer1k = properties.getPricing().getPromptPer1k();
    this.completionPricePer1k = properties.getPricing().getCompletionPer1k();
  }

  /**
   * Aggregates the results of a run.
   *
   * @param runId the run
   * @param datasetId the evaluated dataset
   * @param results final item results
   * @param passThreshold scores at or above this value pass
   * @param cancelled whether the run stopped before processing every item
   * @return the run summary
   */
  public EvalRunSummary aggregate(
      String runId,
      String datasetId,
      List<EvalItemResult> results,
      double passThreshold,
      boolean cancelled) {
    int itemCount = results.size();
    int successCount = count(results, ItemStatus.SUCCESS);
    int partialCount = count(results, ItemStatus.PARTIAL);
    int failedCount = count(results, ItemStatus.FAILED);
    int invalidVerdictCount =
        (int) results.stream().filter(EvalItemResult::verdictRejected).count();

    List<JudgeVerdict> verdicts =
        results.stream()
            .filter(EvalItemResult::scored)
            .map(EvalItemResult::verdict)
            .filter(Objects::nonNull)
            .toList();
    AxisStatistics correctness =
        axis(verdicts, JudgeVerdict::correctnessScore, passThreshold);
    AxisStatistics faithfulness =
        axis(verdicts, JudgeVerdict::faithfulnessScore, passThreshold);
    AxisStatistics contextRelevance =
        axis(verdicts, JudgeVerdict::contextRelevanceScore, passThreshold);

    List<AnswerResult> answers =
        results.stream()
            .filter(r -> r.status() != ItemStatus.FAILED)
            .map(EvalItemResult::answer)
            .filter(Objects::nonNull)
            .toList();
    long[] latencies =
        answers.stream().mapToLong(AnswerResult::generationLatencyMs).sorted().toArray();
    long promptTokens = answers.stream().mapToLong(a -> a.tokenUsage().promptTokens()).sum();
    long completionTokens =
        answers.stream().mapToLong(a -> a.tokenUsage().completionTokens()).sum();

    return new EvalRunSummary(
        runId,
        datasetId,
        itemCount,
        successCount,
        partialCount,
        failedCount,
        invalidVerdictCount,
        passThreshold,
        correctness,
        faithfulness,
        contextRelevance,
        overallScore(correctness, faithfulness, contextRelevance),
        rate(partialCount, itemCount),
        rate(failedCount, itemCount),
        percentile(latencies, 50),
        percentile(latencies, 95),
        promptTokens,
        completionTokens,
        promptTokens / 1000.0 * promptPricePer1k
            + completionTokens / 1000.0 * completionPricePer1k,
        cancelled);
  }

  private double overallScore(
      AxisStatistics correctness, AxisStatistics faithfulness, AxisStatistics contextRelevance) {
    if (correctness.scoredCount() == 0) {
      return Double.NaN;
    }
    double weightSum = correctnessWeight + faithfulnessWeight + contextRelevanceWeight;
    return (correctnessWeight * correctness.mean()
            + faithfulnessWeight * faithfulness.mean()
            + contextRelevanceWeight * contextRelevance.mean())
        / weightSum;
  }

  static AxisStatistics axis(
      List<JudgeVerdict> verdicts, ToDoubleFunction<JudgeVerdict> score, double passThreshold) {
    if (verdicts.isEmpty()) {
      return AxisStatistics.EMPTY;
    }
    double[] values = verdicts.stream().mapToDouble(score).sorted().toArray();
    double mean = Arrays.stream(values).average().orElse(Double.NaN);
    int n = values.length;
    double median = n % 2 == 1 ? values[n / 2] : (values[n / 2 - 1] + values[n / 2]) / 2.0;
    long passed = Arrays.stream(values).filter(v -> v >= passThreshold).count();
    return new AxisStatistics(mean, median, (double) passed / n, n);
  }

  /** Nearest-rank percentile of sorted values, {@code NaN} when empty. */
  static double percentile(long[] sorted, int percentile) {
    if (sorted.length == 0) {
      return Double.NaN;
    }
    int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
    return sorted[Math.max(rank, 1) - 1];
  }

  private static int count(List<EvalItemResult> results, ItemStatus status) {
    return (int) results.stream().filter(r -> r.status() == status).count();
  }

  private static double rate(int count, int total) {
    return total == 0 ? 0.0 : (double) count / total;
  }
}
