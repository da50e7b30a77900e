package dev.evalrag.eval;

import dev.evalrag.error.ConfigurationException;
import dev.evalrag.generation.ModelSettings;
import java.time.Duration;

/**
 * Immutable options of one evaluation run.
 *
 * @param k retrieval depth per item
 * @param concurrency number of items processed in parallel
 * @param passThreshold a score at or above this value passes
 * @param judgeModel judge model identifier
 * @param generationModel generation model identifier
 * @param maxRetries retries per model call and per item retrieval
 * @param timeoutMs timeout of a single model call attempt
 */
public record EvalConfig(
    int k,
    int concurrency,
    double passThreshold,
    String judgeModel,
    String generationModel,
    int maxRetries,
    long timeoutMs) {

  public EvalConfig {
    if (k < 1) {
      throw new ConfigurationException("k must be at least 1, got: " + k);
    }
    if (concurrency < 1 || concurrency > 64) {
      throw new ConfigurationException("concurrency must be in [1, 64], got: " + concurrency);
    }
    if (!(passThreshold >= 0.0 && passThreshold <= 1.0)) {
      throw new ConfigurationException("pass_threshold must be in [0, 1], got: " + passThreshold);
    }
    if (judgeModel == null || judgeModel.isBlank()) {
      throw new ConfigurationException("judge_model must not be blank");
    }
    if (generationModel == null || generationModel.isBlank()) {
      throw new ConfigurationException("generation_model must not be blank");
    }
    if (maxRetries < 0) {
      throw new ConfigurationException("max_retries must not be negative, got: " + maxRetries);
    }
    if (timeoutMs < 1) {
      throw new ConfigurationException("timeout_ms must be positive, got: " + timeoutMs);
    }
  }

  public ModelSettings generationSettings() {
    return new ModelSettings(generationModel, maxRetries, Duration.ofMillis(timeoutMs));
  }

  public ModelSettings judgeSettings() {
    return new ModelSettings(judgeModel, maxRetries, Duration.ofMillis(timeoutMs));
  }
}
