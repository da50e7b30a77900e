package dev.evalrag.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for evaluation runs and model calls.
 *
 * <p>{@code evalRunExecutor} hosts the coordinator of each run; item workers are owned by the run
 * itself. {@code llmCallExecutor} executes individual model calls so that a per-attempt timeout can
 * abandon a hung call.
 */
@Configuration
public class ExecutorConfig {

  @Bean("evalRunExecutor")
  public AsyncTaskExecutor evalRunExecutor(
      @Value("${evalrag.eval.max-concurrent-runs:2}") int maxConcurrentRuns) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(maxConcurrentRuns);
    executor.setMaxPoolSize(maxConcurrentRuns);
    executor.setQueueCapacity(16);
    executor.setThreadNamePrefix("eval-run-");
    // Reject rather than run a whole evaluation on the caller's thread
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.initialize();
    return executor;
  }

  @Bean(name = "llmCallExecutor", destroyMethod = "shutdownNow")
  public ExecutorService llmCallExecutor() {
    return Executors.newCachedThreadPool(new CustomizableThreadFactory("llm-call-"));
  }
}
