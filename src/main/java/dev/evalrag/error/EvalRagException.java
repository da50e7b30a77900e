package dev.evalrag.error;

/**
 * Root of the EvalRAG failure taxonomy.
 *
 * <p>All subclasses are unchecked. Which ones abort a run and which ones are recorded per item is
 * decided by the evaluation runner, not by the exception itself.
 */
public abstract class EvalRagException extends RuntimeException {

  protected EvalRagException(String message) {
    super(message);
  }

  protected EvalRagException(String message, Throwable cause) {
    super(message, cause);
  }
}
