package dev.evalrag.eval;

/**
 * Aggregate metrics of a finished run.
 *
 * <p>Judge axes are computed over {@link ItemStatus#SUCCESS} items only. Latency and token totals
 * cover every item that produced an answer ({@code SUCCESS} and {@code PARTIAL}). Rates are shares
 * of {@link #itemCount()}.
 *
 * @param runId the run
 * @param datasetId the evaluated dataset
 * @param itemCount items that reached a final status
 * @param successCount items answered and judged
 * @param partialCount items answered without a usable verdict
 * @param failedCount items without an answer
 * @param invalidVerdictCount judge outputs rejected as malformed or out of range
 * @param passThreshold threshold used for pass rates
 * @param correctness correctness axis
 * @param faithfulness faithfulness axis
 * @param contextRelevance context relevance axis
 * @param overallScore weighted mean of the axis means, {@code NaN} if nothing was scored
 * @param partialFailureRate {@code partialCount / itemCount}
 * @param failureRate {@code failedCount / itemCount}
 * @param latencyP50Ms median generation latency, {@code NaN} if nothing was answered
 * @param latencyP95Ms 95th percentile generation latency, {@code NaN} if nothing was answered
 * @param promptTokens generation prompt tokens
 * @param completionTokens generation completion tokens
 * @param estimatedCost cost of the generation tokens at the configured prices
 * @param cancelled true if the run was cancelled before every item was processed
 */
public record EvalRunSummary(
    String runId,
    String datasetId,
    int itemCount,
    int successCount,
    int partialCount,
    int failedCount,
    int invalidVerdictCount,
    double passThreshold,
    AxisStatistics correctness,
    AxisStatistics faithfulness,
    AxisStatistics contextRelevance,
    double overallScore,
    double partialFailureRate,
    double failureRate,
    double latencyP50Ms,
    double latencyP95Ms,
    long promptTokens,
    long completionTokens,
    double estimatedCost,
    boolean cancelled) {

  public long totalTokens() {
    return promptTokens + completionTokens;
  }
}
