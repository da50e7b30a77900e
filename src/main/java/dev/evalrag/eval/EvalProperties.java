package dev.evalrag.eval;

import dev.evalrag.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Evaluation defaults bound from {@code evalrag.eval.*}.
 *
 * <ul>
 *   <li>{@code dataset-dir} - directory holding {@code <dataset-id>.jsonl} files
 *   <li>{@code output-dir} - directory for CSV exports
 *   <li>{@code k}, {@code concurrency}, {@code pass-threshold}, {@code max-retries}, {@code
 *       timeout-ms} - defaults for {@link EvalConfig} fields a caller leaves out
 *   <li>{@code weights.*} - weights of the overall score (0.5 / 0.3 / 0.2)
 *   <li>{@code pricing.*} - price per 1000 prompt and completion tokens for the cost estimate
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "evalrag.eval")
public class EvalProperties {

  private String datasetDir = "datasets";
  private String outputDir = System.getProperty("user.home") + "/.evalrag/eval";
  private int k = 5;
  private int concurrency = 2;
  private double passThreshold = 0.7;
  private int maxRetries = 3;
  private long timeoutMs = 30_000;
  private final Weights weights = new Weights();
  private final Pricing pricing = new Pricing();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    // Reuses the run option checks for the defaults
    defaultConfig("judge", "generation");
    if (weights.correctness < 0 || weights.faithfulness < 0 || weights.contextRelevance < 0) {
      throw new ConfigurationException("evalrag.eval.weights must not be negative");
    }
    if (weights.correctness + weights.faithfulness + weights.contextRelevance <= 0) {
      throw new ConfigurationException("evalrag.eval.weights must not all be zero");
    }
    if (pricing.promptPer1k < 0 || pricing.completionPer1k < 0) {
      throw new ConfigurationException("evalrag.eval.pricing must not be negative");
    }
  }

  /** Builds a run configuration from these defaults and the given models. */
  public EvalConfig defaultConfig(String judgeModel, String generationModel) {
    return new EvalConfig(
        k, concurrency, passThreshold, judgeModel, generationModel, maxRetries, timeoutMs);
  }

  public String getDatasetDir() {
    return datasetDir;
  }

  public void setDatasetDir(String datasetDir) {
    this.datasetDir = datasetDir;
  }

  public String getOutputDir() {
    return outputDir;
  }

  public void setOutputDir(String outputDir) {
    this.outputDir = outputDir;
  }

  public int getK() {
    return k;
  }

  public void setK(int k) {
    this.k = k;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public double getPassThreshold() {
    return passThreshold;
  }

  public void setPassThreshold(double passThreshold) {
    this.passThreshold = passThreshold;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  public Weights getWeights() {
    return weights;
  }

  public Pricing getPricing() {
    return pricing;
  }

  /** Weights of each axis mean in the overall score. */
  public static class Weights {

    private double correctness = 0.5;
    private double faithfulness = 0.3;
    private double contextRelevance = 0.2;

    public double getCorrectness() {
      return correctness;
    }

    public void setCorrectness(double correctness) {
      this.correctness = correctness;
    }

    public double getFaithfulness() {
      return faithfulness;
    }

    public void setFaithfulness(double faithfulness) {
      this.faithfulness = faithfulness;
    }

    public double getContextRelevance() {
      return contextRelevance;
    }

    public void setContextRelevance(double contextRelevance) {
      this.contextRelevance = contextRelevance;
    }
  }

  /** Generation token prices, per 1000 tokens. */
  public static class Pricing {

    private double promptPer1k = 0.0;
    private double completionPer1k = 0.0;

    public double getPromptPer1k() {
      return promptPer1k;
    }

    public void setPromptPer1k(double promptPer1k) {
      this.promptPer1k = promptPer1k;
    }

    public double getCompletionPer1k() {
      return completionPer1k;
    }

    public void setCompletionPer1k(double completionPer1k) {
      this.completionPer1k = completionPer1k;
    }
  }
}
