package dev.evalrag.ingestion.chunking;

import dev.evalrag.error.ConfigurationException;
import java.util.Objects;

/**
 * Immutable chunking configuration.
 *
 * @param chunkSize maximum chunk length in characters
 * @param chunkOverlap maximum characters shared by consecutive chunks, in {@code [0, chunkSize)}
 * @param strategy boundary selection strategy
 */
public record ChunkingOptions(int chunkSize, int chunkOverlap, SplittingStrategy strategy) {

  public static final int DEFAULT_CHUNK_SIZE = 800;
  public static final int DEFAULT_CHUNK_OVERLAP = 100;

  public ChunkingOptions {
    Objects.requireNonNull(strategy, "strategy");
    if (chunkSize < 1) {
      throw new ConfigurationException("chunk_size must be at least 1, got: " + chunkSize);
    }
    if (chunkOverlap < 0) {
      throw new ConfigurationException("chunk_overlap must not be negative, got: " + chunkOverlap);
    }
    if (chunkOverlap >= chunkSize) {
      throw new ConfigurationException(
          "chunk_overlap (%d) must be smaller than chunk_size (%d)"
              .formatted(chunkOverlap, chunkSize));
    }
  }

  public static ChunkingOptions defaults() {
    return new ChunkingOptions(
        DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP, SplittingStrategy.SENTENCE_AWARE);
  }
}
