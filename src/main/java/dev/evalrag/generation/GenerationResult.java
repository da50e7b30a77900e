package dev.evalrag.generation;

/**
 * Output of {@link Generator#generate}.
 *
 * @param text the answer text
 * @param tokenUsage token counts of the successful attempt
 * @param latencyMs wall time of the call including retries
 * @param model the model that produced the answer
 */
public record GenerationResult(String text, TokenUsage tokenUsage, long latencyMs, String model) {}
