package dev.evalrag.ingestion.chunking;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised chunking configuration bound from {@code evalrag.chunking.*}.
 *
 * <ul>
 *   <li>{@code size} - maximum chunk length in characters (default 800)
 *   <li>{@code overlap} - characters shared by consecutive chunks (default 100)
 *   <li>{@code strategy} - {@code FIXED_LENGTH} or {@code SENTENCE_AWARE} (default)
 * </ul>
 *
 * <p>Validated at startup: an overlap not smaller than the size fails the context with a {@link
 * dev.evalrag.error.ConfigurationException}.
 */
@Configuration
@ConfigurationProperties(prefix = "evalrag.chunking")
public class ChunkingProperties {

  private int size = ChunkingOptions.DEFAULT_CHUNK_SIZE;
  private int overlap = ChunkingOptions.DEFAULT_CHUNK_OVERLAP;
  private SplittingStrategy strategy = SplittingStrategy.SENTENCE_AWARE;

  @PostConstruct
  void validate() {
    toOptions();
  }

  public ChunkingOptions toOptions() {
    return new ChunkingOptions(size, overlap, strategy);
  }

  public int getSize() {
    return size;
  }

  public void setSize(int size) {
    this.size = size;
  }

  public int getOverlap() {
    return overlap;
  }

  public void setOverlap(int overlap) {
    this.overlap = overlap;
  }

  public SplittingStrategy getStrategy() {
    return strategy;
  }

  public void setStrategy(SplittingStrategy strategy) {
    this.strategy = strategy;
  }
}
