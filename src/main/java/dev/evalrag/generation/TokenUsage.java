package dev.evalrag.generation;

/**
 * Token counts reported by the model provider for one call.
 *
 * @param promptTokens tokens in the prompt
 * @param completionTokens tokens in the completion
 */
public record TokenUsage(long promptTokens, long completionTokens) {

  public static final TokenUsage ZERO = new TokenUsage(0, 0);

  public TokenUsage {
    if (promptTokens < 0 || completionTokens < 0) {
      throw new IllegalArgumentException("Token counts must not be negative");
    }
  }

  public long totalTokens() {
    return promptTokens + completionTokens;
  }

  public TokenUsage plus(TokenUsage other) {
    return new TokenUsage(
        promptTokens + other.promptTokens, completionTokens + other.completionTokens);
  }
}
