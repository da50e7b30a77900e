package dev.evalrag.document;

import java.util.Map;
import java.util.Objects;

/**
 * A source document as handed to ingestion: plain text with optional scalar metadata.
 *
 * @param id stable document identifier, used as the prefix of every chunk id
 * @param sourceUri where the text came from (file path, URL)
 * @param rawText the extracted plain text
 * @param metadata string to scalar metadata copied onto every chunk
 */
public record Document(String id, String sourceUri, String rawText, Map<String, Object> metadata) {

  public Document {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceUri, "sourceUri");
    Objects.requireNonNull(rawText, "rawText");
    if (id.isBlank()) {
      throw new IllegalArgumentException("Document id must not be blank");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public Document(String id, String sourceUri, String rawText) {
    this(id, sourceUri, rawText, Map.of());
  }
}
