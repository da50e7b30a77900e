package dev.evalrag.ingestion.chunking;

/**
 * Half-open character range {@code [start, end)} of a chunk within its source text.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 */
public record TextSpan(int start, int end) {

  public TextSpan {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
    }
  }

  public int length() {
    return end - start;
  }
}
