package dev.evalrag.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.evalrag.error.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

  private final TextChunker chunker = new TextChunker();

  @Test
  void nullAndBlankTextProduceNoChunks() {
    ChunkingOptions options = ChunkingOptions.defaults();

    assertThat(chunker.chunk(null, options)).isEmpty();
    assertThat(chunker.chunk("", options)).isEmpty();
    assertThat(chunker.chunk("   \n\t ", options)).isEmpty();
  }

  @Test
  void textShorterThanChunkSizeIsASingleChunk() {
    List<String> chunks = chunker.chunk("Short text.", ChunkingOptions.defaults());

    assertThat(chunks).containsExactly("Short text.");
  }

  // --- Fixed length ---

  @Test
  void fixedLengthStepsBySizeMinusOverlap() {
    ChunkingOptions options = new ChunkingOptions(4, 1, SplittingStrategy.FIXED_LENGTH);

    assertThat(chunker.chunk("abcdefghij", options)).containsExactly("abcd", "defg", "ghij");
  }

  @Test
  void fixedLengthWithoutOverlapPartitionsTheText() {
    ChunkingOptions options = new ChunkingOptions(3, 0, SplittingStrategy.FIXED_LENGTH);

    List<String> chunks = chunker.chunk("abcdefgh", options);

    assertThat(chunks).containsExactly("abc", "def", "gh");
    assertThat(String.join("", chunks)).isEqualTo("abcdefgh");
  }

  // --- Sentence aware ---

  @Test
  void sentenceAwarePacksWholeSentences() {
    ChunkingOptions options = new ChunkingOptions(10, 0, SplittingStrategy.SENTENCE_AWARE);

    assertThat(chunker.chunk("One. Two. Three.", options)).containsExactly("One. Two. ", "Three.");
  }

  @Test
  void sentenceAwareCarriesTrailingSentencesAsOverlap() {
    ChunkingOptions options = new ChunkingOptions(11, 5, SplittingStrategy.SENTENCE_AWARE);

    assertThat(chunker.chunk("One. Two. Three.", options))
        .containsExactly("One. Two. ", "Two. Three.");
  }

  @Test
  void sentenceAwareSplitsOnParagraphBreaks() {
    ChunkingOptions options = new ChunkingOptions(14, 0, SplittingStrategy.SENTENCE_AWARE);

    assertThat(chunker.chunk("first block\n\nsecond block", options))
        .containsExactly("first block\n\n", "second block");
  }

  @Test
  void sentenceLongerThanChunkSizeIsCutIntoPieces() {
    ChunkingOptions options = new ChunkingOptions(5, 0, SplittingStrategy.SENTENCE_AWARE);

    assertThat(chunker.chunk("abcdefghijklmnop", options))
        .containsExactly("abcde", "fghij", "klmno", "p");
  }

  @Test
  void spansMatchChunkTexts() {
    String text = "Alpha beta. Gamma delta! Epsilon?";
    ChunkingOptions options = new ChunkingOptions(15, 4, SplittingStrategy.SENTENCE_AWARE);

    List<TextSpan> spans = chunker.spans(text, options);
    List<String> chunks = chunker.chunk(text, options);

    assertThat(spans).hasSameSizeAs(chunks);
    for (int i = 0; i < spans.size(); i++) {
      assertThat(text.substring(spans.get(i).start(), spans.get(i).end()))
          .isEqualTo(chunks.get(i));
    }
  }

  @Test
  void chunkingIsDeterministic() {
    String text = "The quick brown fox. Jumps over the lazy dog! Again? And again.\n\nNew paragraph.";
    ChunkingOptions options = new ChunkingOptions(20, 6, SplittingStrategy.SENTENCE_AWARE);

    assertThat(chunker.chunk(text, options)).isEqualTo(chunker.chunk(text, options));
  }

  // --- Options ---

  @Test
  void overlapNotSmallerThanSizeIsRejected() {
    assertThatThrownBy(() -> new ChunkingOptions(10, 10, SplittingStrategy.FIXED_LENGTH))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("chunk_overlap");
  }

  @Test
  void nonPositiveSizeIsRejected() {
    assertThatThrownBy(() -> new ChunkingOptions(0, 0, SplittingStrategy.FIXED_LENGTH))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void negativeOverlapIsRejected() {
    assertThatThrownBy(() -> new ChunkingOptions(10, -1, SplittingStrategy.SENTENCE_AWARE))
        .isInstanceOf(ConfigurationException.class);
  }
}
