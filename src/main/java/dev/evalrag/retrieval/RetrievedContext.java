package dev.evalrag.retrieval;

import java.util.Comparator;
import java.util.Objects;

/**
 * A chunk retrieved for a query.
 *
 * @param chunkId the chunk identifier
 * @param text the chunk text
 * @param similarityScore similarity to the query, higher is more relevant
 */
public record RetrievedContext(String chunkId, String text, double similarityScore) {

  /** Similarity descending, ties broken by chunk id ascending. */
  public static final Comparator<RetrievedContext> RANKING =
      Comparator.comparingDouble(RetrievedContext::similarityScore)
          .reversed()
          .thenComparing(RetrievedContext::chunkId);

  public RetrievedContext {
    Objects.requireNonNull(chunkId, "chunkId");
    Objects.requireNonNull(text, "text");
  }
}
