package dev.evalrag.generation;

import dev.evalrag.error.ConfigurationException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Applies the model call failure policy: rate limit, per-attempt timeout, and retries with
 * exponential backoff.
 *
 * <p>Each attempt first waits for a permit from the caller's {@link RateLimiter}, then runs on the
 * {@code llmCallExecutor} under a Resilience4j {@link TimeLimiter}; a timed-out attempt is
 * cancelled. Attempts are retried by a Spring Retry {@link RetryTemplate} up to {@link
 * ModelSettings#maxRetries()} times, waiting {@code baseDelay * 2^attempt} capped at {@code
 * maxDelay} between them. A {@link ConfigurationException} is never retried.
 */
@Component
public class ResilientCaller {

  private static final Logger log = LoggerFactory.getLogger(ResilientCaller.class);

  private final ExecutorService executor;
  private final Duration baseDelay;
  private final Duration maxDelay;

  public ResilientCaller(
      @Qualifier("llmCallExecutor") ExecutorService executor, LlmProperties llmProperties) {
    this(executor, llmProperties.baseDelay(), llmProperties.maxDelay());
  }

  ResilientCaller(ExecutorService executor, Duration baseDelay, Duration maxDelay) {
    this.executor = executor;
    this.baseDelay = baseDelay;
    this.maxDelay = maxDelay;
  }

  /**
   * Runs the call under the failure policy.
   *
   * @param operation name used in log messages
   * @param rateLimiter limiter of the calling role
   * @param settings retry count and per-attempt timeout
   * @param call the blocking provider call
   * @return the result of the first successful attempt
   * @throws Exception the error of the last attempt once retries are exhausted; a timeout surfaces
   *     as {@link java.util.concurrent.TimeoutException}
   */
  public <T> T call(
      String operation, RateLimiter rateLimiter, ModelSettings settings, Callable<T> call)
      throws Exception {
    TimeLimiter timeLimiter =
        TimeLimiter.of(
            TimeLimiterConfig.custom()
                .timeoutDuration(settings.timeout())
                .cancelRunningFuture(true)
                .build());
    RetryTemplate retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(settings.maxRetries() + 1)
            .exponentialBackoff(baseDelay.toMillis(), 2.0, maxDelay.toMillis())
            .notRetryOn(ConfigurationException.class)
            .build();

    return retryTemplate.execute(
        context -> {
          if (context.getRetryCount() > 0) {
            Throwable last = context.getLastThrowable();
            log.debug(
                "Retrying {} with {} (attempt {} of {}): {}",
                operation,
                settings.model(),
                context.getRetryCount() + 1,
                settings.maxRetries() + 1,
                last != null ? last.toString() : "unknown error");
          }
          RateLimiter.waitForPermission(rateLimiter);
          return timeLimiter.executeFutureSupplier(() -> executor.submit(call));
        });
  }
}
