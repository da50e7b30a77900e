package dev.evalrag.error;

/** The vector index could not serve a query. */
public class RetrievalException extends EvalRagException {

  /** Why retrieval failed. */
  public enum Reason {
    /** The index threw while being queried. */
    INDEX_UNREACHABLE,
    /** The index reports chunks but returned none for a query. */
    INDEX_CORRUPT
  }

  private final Reason reason;

  public RetrievalException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public RetrievalException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
