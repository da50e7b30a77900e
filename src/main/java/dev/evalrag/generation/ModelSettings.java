package dev.evalrag.generation;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call model selection and failure policy.
 *
 * @param model provider model identifier
 * @param maxRetries retries after the first attempt
 * @param timeout limit for a single attempt
 */
public record ModelSettings(String model, int maxRetries, Duration timeout) {

  public ModelSettings {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(timeout, "timeout");
    if (model.isBlank()) {
      throw new IllegalArgumentException("model must not be blank");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative, got: " + maxRetries);
    }
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
    }
  }

  public ModelSettings withModel(String otherModel) {
    return new ModelSettings(otherModel, maxRetries, timeout);
  }
}
