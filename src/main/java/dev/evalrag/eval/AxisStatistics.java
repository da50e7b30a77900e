package dev.evalrag.eval;

/**
 * Statistics of one judge axis over the scored items of a run.
 *
 * @param mean arithmetic mean, {@code NaN} if nothing was scored
 * @param median median, {@code NaN} if nothing was scored
 * @param passRate share of scored items at or above the pass threshold, 0 if nothing was
 *     scored
 * @param scoredCount number of items the statistics are computed over
 */
public record AxisStatistics(double mean, double median, double passRate, int scoredCount) {

  public static final AxisStatistics EMPTY =
      new AxisStatistics(Double.NaN, Double.NaN, 0.0, 0);
}
