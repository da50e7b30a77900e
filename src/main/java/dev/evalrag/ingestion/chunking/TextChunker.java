package dev.evalrag.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Splits plain text into overlapping chunks for embedding and retrieval.
 *
 * <p>Chunks are exact substrings of the input and together cover it from the first to the last
 * character. Consecutive chunks share at most {@link ChunkingOptions#chunkOverlap()} characters and
 * no chunk is longer than {@link ChunkingOptions#chunkSize()}. The output depends only on the text
 * and the options, so re-chunking a document reproduces the same boundaries.
 */
@Component
public class TextChunker {

  // Sentence end followed by whitespace, or a paragraph break
  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\n\\s*\\n");

  /**
   * Chunks the text according to the options.
   *
   * @param text the document text
   * @param options chunk size, overlap and strategy
   * @return ordered chunk texts, empty for null or blank input
   */
  public List<String> chunk(@Nullable String text, ChunkingOptions options) {
    if (text == null) {
      return List.of();
    }
    return spans(text, options).stream().map(s -> text.substring(s.start(), s.end())).toList();
  }

  /**
   * Computes the chunk boundaries without materialising the chunk texts.
   *
   * @param text the document text
   * @param options chunk size, overlap and strategy
   * @return ordered, non-empty spans, empty for null or blank input
   */
  public List<TextSpan> spans(@Nullable String text, ChunkingOptions options) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return switch (options.strategy()) {
      case FIXED_LENGTH -> fixedLengthSpans(text.length(), options);
      case SENTENCE_AWARE -> sentenceAwareSpans(text, options);
    };
  }

  private static List<TextSpan> fixedLengthSpans(int length, ChunkingOptions options) {
    int step = options.chunkSize() - options.chunkOverlap();
    List<TextSpan> spans = new ArrayList<>();
    int start = 0;
    while (true) {
      int end = Math.min(start + options.chunkSize(), length);
      spans.add(new TextSpan(start, end));
      if (end == length) {
        return spans;
      }
      start += step;
    }
  }

  private static List<TextSpan> sentenceAwareSpans(String text, ChunkingOptions options) {
    List<TextSpan> units = sentenceUnits(text, options.chunkSize());
    List<TextSpan> spans = new ArrayList<>();
    int first = 0;
    while (first < units.size()) {
      int last = first;
      int length = units.get(first).length();
      while (last + 1 < units.size()
          && length + units.get(last + 1).length() <= options.chunkSize()) {
        last++;
        length += units.get(last).length();
      }
      spans.add(new TextSpan(units.get(first).start(), units.get(last).end()));
      if (last == units.size() - 1) {
        break;
      }
      first = nextFirstUnit(units, first, last, options);
    }
    return spans;
  }

  /**
   * Walks back from {@code last} to find the earliest unit whose tail fits the overlap budget and
   * still leaves room for the unit after {@code last}. The result is always in {@code (first,
   * last + 1]}, so every chunk ends beyond the previous one.
   */
  private static int nextFirstUnit(
      List<TextSpan> units, int first, int last, ChunkingOptions options) {
    int next = last + 1;
    int carried = 0;
    int following = units.get(last + 1).length();
    for (int candidate = last; candidate > first; candidate--) {
      int withCandidate = carried + units.get(candidate).length();
      if (withCandidate > options.chunkOverlap()
          || withCandidate + following > options.chunkSize()) {
        break;
      }
      carried = withCandidate;
      next = candidate;
    }
    return next;
  }

  /**
   * Partitions the text into contiguous sentence units, each including its trailing whitespace.
   * Units longer than {@code maxLength} are cut into consecutive pieces.
   */
  private static List<TextSpan> sentenceUnits(String text, int maxLength) {
    List<TextSpan> units = new ArrayList<>();
    Matcher matcher = SENTENCE_BOUNDARY.matcher(text);
    int start = 0;
    while (matcher.find()) {
      if (matcher.end() > start) {
        addUnit(units, start, matcher.end(), maxLength);
        start = matcher.end();
      }
    }
    if (start < text.length()) {
      addUnit(units, start, text.length(), maxLength);
    }
    return units;
  }

  private static void addUnit(List<TextSpan> units, int start, int end, int maxLength) {
    for (int pieceStart = start; pieceStart < end; pieceStart += maxLength) {
      units.add(new TextSpan(pieceStart, Math.min(pieceStart + maxLength, end)));
    }
  }
}
