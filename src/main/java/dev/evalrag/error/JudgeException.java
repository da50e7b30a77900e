package dev.evalrag.error;

import org.jspecify.annotations.Nullable;

/**
 * The judge model produced no usable verdict: its output was malformed or out of range, or the
 * call failed after all retries.
 */
public class JudgeException extends EvalRagException {

  private final @Nullable String rawResponse;

  public JudgeException(String message, @Nullable String rawResponse) {
    super(message);
    this.rawResponse = rawResponse;
  }

  public JudgeException(String message, Throwable cause) {
    super(message, cause);
    this.rawResponse = null;
  }

  /** The judge output that failed validation, or {@code null} if the call itself failed. */
  public @Nullable String getRawResponse() {
    return rawResponse;
  }
}
