package dev.evalrag.error;

/**
 * An evaluation dataset could not be loaded.
 *
 * <p>{@link #getLineNumber()} is the 1-based line of the offending record, or {@code 0} when the
 * failure is not tied to a line (missing file, I/O error).
 */
public class DatasetException extends EvalRagException {

  private final int lineNumber;

  public DatasetException(String message) {
    super(message);
    this.lineNumber = 0;
  }

  public DatasetException(String message, Throwable cause) {
    super(message, cause);
    this.lineNumber = 0;
  }

  public DatasetException(int lineNumber, String message) {
    super("Line " + lineNumber + ": " + message);
    this.lineNumber = lineNumber;
  }

  public DatasetException(int lineNumber, String message, Throwable cause) {
    super("Line " + lineNumber + ": " + message, cause);
    this.lineNumber = lineNumber;
  }

  public int getLineNumber() {
    return lineNumber;
  }
}
