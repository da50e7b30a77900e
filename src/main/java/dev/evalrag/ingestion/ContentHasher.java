package dev.evalrag.ingestion;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 hashing of document text for change detection on re-ingestion. */
public final class ContentHasher {

  private ContentHasher() {
    // utility class
  }

  /**
   * Hashes the UTF-8 bytes of the text.
   *
   * @param content the cleaned document text
   * @return lowercase hex SHA-256 digest
   */
  public static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
