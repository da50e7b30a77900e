package dev.evalrag.generation;

import dev.evalrag.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Answer generation settings bound from {@code evalrag.generation.*}.
 *
 * <p>{@code max-retries} and {@code timeout-ms} are also the default failure policy of the judge.
 */
@Configuration
@ConfigurationProperties(prefix = "evalrag.generation")
public class GenerationProperties {

  private String model = "gpt-4o-mini";
  private int maxRetries = 3;
  private long timeoutMs = 30_000;
  private final RateLimitProperties rateLimit = new RateLimitProperties();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (model == null || model.isBlank()) {
      throw new ConfigurationException("evalrag.generation.model must not be blank");
    }
    if (maxRetries < 0) {
      throw new ConfigurationException(
          "evalrag.generation.max-retries must not be negative, got: " + maxRetries);
    }
    if (timeoutMs < 1) {
      throw new ConfigurationException(
          "evalrag.generation.timeout-ms must be positive, got: " + timeoutMs);
    }
    rateLimit.validate("evalrag.generation.rate-limit");
  }

  public ModelSettings toModelSettings() {
    return new ModelSettings(model, maxRetries, Duration.ofMillis(timeoutMs));
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
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

  public RateLimitProperties getRateLimit() {
    return rateLimit;
  }
}
