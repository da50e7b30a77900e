package dev.evalrag.generation;

/**
 * Raw provider output.
 *
 * @param text the completion text
 * @param tokenUsage provider-reported token counts, {@link TokenUsage#ZERO} if unreported
 */
public record Completion(String text, TokenUsage tokenUsage) {}
