package dev.evalrag.error;

/** The generation model failed after all retries. The cause is the last underlying error. */
public class GenerationException extends EvalRagException {

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
