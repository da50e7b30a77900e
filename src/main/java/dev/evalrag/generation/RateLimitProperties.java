package dev.evalrag.generation;

import dev.evalrag.error.ConfigurationException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;

/**
 * Rate limit settings for one model role, nested under that role's properties.
 *
 * <ul>
 *   <li>{@code permits-per-second} - calls allowed per second (default 5)
 *   <li>{@code max-wait-ms} - how long a caller may wait for a permit before the attempt fails
 *       (default 30000)
 * </ul>
 */
public class RateLimitProperties {

  private int permitsPerSecond = 5;
  private long maxWaitMs = 30_000;

  public void validate(String prefix) {
    if (permitsPerSecond < 1) {
      throw new ConfigurationException(
          prefix + ".permits-per-second must be at least 1, got: " + permitsPerSecond);
    }
    if (maxWaitMs < 0) {
      throw new ConfigurationException(
          prefix + ".max-wait-ms must not be negative, got: " + maxWaitMs);
    }
  }

  /** Builds an independent Resilience4j limiter with these settings. */
  public RateLimiter toRateLimiter(String name) {
    return RateLimiter.of(
        name,
        RateLimiterConfig.custom()
            .limitForPeriod(permitsPerSecond)
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .timeoutDuration(Duration.ofMillis(maxWaitMs))
            .build());
  }

  public int getPermitsPerSecond() {
    return permitsPerSecond;
  }

  public void setPermitsPerSecond(int permitsPerSecond) {
    this.permitsPerSecond = permitsPerSecond;
  }

  public long getMaxWaitMs() {
    return maxWaitMs;
  }

  public void setMaxWaitMs(long maxWaitMs) {
    this.maxWaitMs = maxWaitMs;
  }
}
