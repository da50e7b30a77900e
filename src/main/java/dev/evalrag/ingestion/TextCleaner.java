package dev.evalrag.ingestion;

/**
 * Normalises extracted text before chunking.
 *
 * <p>Converts CRLF and CR line endings to LF, drops control characters other than tab and newline,
 * drops unpaired surrogates and the U+FFFD replacement character left behind by undecodable bytes.
 */
public final class TextCleaner {

  private TextCleaner() {
    // utility class
  }

  public static String clean(String text) {
    String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
    StringBuilder sb = new StringBuilder(normalized.length());
    for (int i = 0; i < normalized.length(); i++) {
      char c = normalized.charAt(i);
      if (Character.isHighSurrogate(c)) {
        if (i + 1 < normalized.length() && Character.isLowSurrogate(normalized.charAt(i + 1))) {
          sb.append(c).append(normalized.charAt(i + 1));
          i++;
        }
        continue;
      }
      if (Character.isLowSurrogate(c) || c == '\uFFFD') {
        continue;
      }
      if (Character.isISOControl(c) && c != '\n' && c != '\t') {
        continue;
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
