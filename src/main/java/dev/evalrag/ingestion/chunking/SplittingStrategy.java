package dev.evalrag.ingestion.chunking;

/** How {@link TextChunker} chooses chunk boundaries. */
public enum SplittingStrategy {
  /** Cut every {@code chunkSize} characters, stepping back {@code chunkOverlap} each time. */
  FIXED_LENGTH,
  /** Pack whole sentences up to {@code chunkSize}, overlapping by whole trailing sentences. */
  SENTENCE_AWARE
}
