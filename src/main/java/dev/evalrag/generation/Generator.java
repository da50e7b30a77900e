package dev.evalrag.generation;

import dev.evalrag.error.ConfigurationException;
import dev.evalrag.error.GenerationException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces answers from rendered prompts through the {@link CompletionBackend}.
 *
 * <p>Calls go through {@link ResilientCaller} with this component's own rate limiter ({@code
 * evalrag.generation.rate-limit.*}). Once retries are exhausted the last underlying error is
 * wrapped in a {@link GenerationException}.
 */
@Service
public class Generator {

  private static final Logger log = LoggerFactory.getLogger(Generator.class);

  private final CompletionBackend backend;
  private final ResilientCaller caller;
  private final RateLimiter rateLimiter;
  private final ModelSettings defaultSettings;

  public Generator(
      CompletionBackend backend, ResilientCaller caller, GenerationProperties properties) {
    this.backend = backend;
    this.caller = caller;
    this.rateLimiter = properties.getRateLimit().toRateLimiter("generation");
    this.defaultSettings = properties.toModelSettings();
  }

  /** Model, retries and timeout from {@code evalrag.generation.*}. */
  public ModelSettings defaultSettings() {
    return defaultSettings;
  }

  /**
   * Generates a completion for the prompt.
   *
   * @param prompt the rendered prompt
   * @param settings model and failure policy
   * @return answer text, token usage and wall time including retries
   * @throws GenerationException if every attempt failed or timed out
   */
  public GenerationResult generate(String prompt, ModelSettings settings) {
    long start = System.nanoTime();
    Completion completion;
    try {
      completion =
          caller.call(
              "generation",
              rateLimiter,
              settings,
              () -> backend.complete(new CompletionRequest(settings.model(), prompt, false)));
    } catch (ConfigurationException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationException("Generation interrupted", e);
    } catch (Exception e) {
      log.warn(
          "Generation with {} failed after {} attempt(s): {}",
          settings.model(),
          settings.maxRetries() + 1,
          e.toString());
      throw new GenerationException(
          "Generation with %s failed after %d attempt(s): %s"
              .formatted(settings.model(), settings.maxRetries() + 1, e),
          e);
    }
    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    return new GenerationResult(
        completion.text(), completion.tokenUsage(), latencyMs, settings.model());
  }
}
