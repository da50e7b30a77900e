package dev.evalrag.generation;

import dev.evalrag.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Provider connection and retry backoff settings shared by generation and judging, bound from
 * {@code evalrag.llm.*}.
 *
 * <ul>
 *   <li>{@code api-key} - OpenAI API key, normally {@code ${OPENAI_API_KEY}}
 *   <li>{@code base-url} - alternative OpenAI-compatible endpoint, unset for the public API
 *   <li>{@code temperature} - sampling temperature (default 0.0 for reproducible runs)
 *   <li>{@code retry.base-delay-ms} / {@code retry.max-delay-ms} - exponential backoff between
 *       attempts, doubling from the base up to the cap (defaults 500 / 8000)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "evalrag.llm")
public class LlmProperties {

  private String apiKey = "";
  private @Nullable String baseUrl;
  private double temperature = 0.0;
  private final Retry retry = new Retry();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (temperature < 0.0 || temperature > 2.0) {
      throw new ConfigurationException(
          "evalrag.llm.temperature must be in [0.0, 2.0], got: " + temperature);
    }
    if (retry.baseDelayMs < 1) {
      throw new ConfigurationException(
          "evalrag.llm.retry.base-delay-ms must be at least 1, got: " + retry.baseDelayMs);
    }
    if (retry.maxDelayMs <= retry.baseDelayMs) {
      throw new ConfigurationException(
          "evalrag.llm.retry.max-delay-ms must exceed base-delay-ms, got: " + retry.maxDelayMs);
    }
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public @Nullable String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(@Nullable String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public Retry getRetry() {
    return retry;
  }

  public Duration baseDelay() {
    return Duration.ofMillis(retry.baseDelayMs);
  }

  public Duration maxDelay() {
    return Duration.ofMillis(retry.maxDelayMs);
  }

  /** Backoff between attempts. */
  public static class Retry {

    private long baseDelayMs = 500;
    private long maxDelayMs = 8_000;

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }
  }
}
