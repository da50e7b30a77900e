package dev.evalrag.generation;

/**
 * Language model capability used for both answer generation and judging.
 *
 * <p>Implementations make one blocking provider call per invocation and do not retry; timeouts,
 * retries and rate limits are applied by {@link ResilientCaller}.
 */
public interface CompletionBackend {

  Completion complete(CompletionRequest request);
}
