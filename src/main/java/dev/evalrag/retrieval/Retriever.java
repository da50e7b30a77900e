package dev.evalrag.retrieval;

import dev.evalrag.config.EmbeddingProperties;
import dev.evalrag.error.ConfigurationException;
import dev.evalrag.error.RetrievalException;
import dev.evalrag.index.IndexMatch;
import dev.evalrag.index.VectorIndex;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fetches the chunks most relevant to a query from the {@link VectorIndex}.
 *
 * <p>The query is embedded with the active {@link EmbeddingModel}; the index is over-fetched by
 * {@code candidate-multiplier} and every candidate is rescored with the configured {@link
 * SimilarityMetric}, so the ranking does not depend on the index's native distance. Results are
 * ordered by {@link RetrievedContext#RANKING}. Read-only.
 *
 * <p>With the LOCAL bge-small-en-v1.5 model the query, and only the query, is prefixed with
 * {@link #BGE_QUERY_PREFIX}; ingested chunks are embedded as-is.
 */
@Service
public class Retriever {

  private static final Logger log = LoggerFactory.getLogger(Retriever.class);

  /** Instruction prefix bge-small-en-v1.5 expects on retrieval queries. */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingModel embeddingModel;
  private final VectorIndex vectorIndex;
  private final SimilarityMetric metric;
  private final int candidateMultiplier;
  private final String queryPrefix;

  public Retriever(
      EmbeddingModel embeddingModel,
      VectorIndex vectorIndex,
      RetrievalProperties properties,
      EmbeddingProperties embeddingProperties) {
    this.embeddingModel = embeddingModel;
    this.vectorIndex = vectorIndex;
    this.metric = properties.getMetric();
    this.candidateMultiplier = properties.getCandidateMultiplier();
    this.queryPrefix =
        embeddingProperties.getProvider() == EmbeddingProperties.Provider.LOCAL
            ? BGE_QUERY_PREFIX
            : "";
  }

  /**
   * Retrieves the top-k chunks across the whole index.
   *
   * @see #retrieve(String, int, String)
   */
  public List<RetrievedContext> retrieve(String query, int k) {
    return retrieve(query, k, null);
  }

  /**
   * Retrieves the top-k chunks for a query.
   *
   * @param query the question text
   * @param k requested depth, clamped to {@code [1, index size]}
   * @param documentId restrict retrieval to one document, or {@code null}
   * @return contexts sorted by similarity descending, empty if the index is empty
   * @throws ConfigurationException if {@code k < 1}
   * @throws RetrievalException if the index is unreachable or returns nothing while non-empty
   */
  public List<RetrievedContext> retrieve(String query, int k, @Nullable String documentId) {
    if (k < 1) {
      throw new ConfigurationException("Retrieval depth k must be at least 1, got: " + k);
    }
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }

    long indexSize = indexSize();
    if (indexSize == 0) {
      log.debug("Index is empty, nothing to retrieve for '{}'", query);
      return List.of();
    }
    int depth = (int) Math.min(k, indexSize);
    int candidates = (int) Math.min((long) depth * candidateMultiplier, indexSize);

    float[] queryVector = embeddingModel.embed(queryPrefix + query).content().vector();
    List<IndexMatch> matches = nearest(queryVector, candidates, documentId);

    if (matches.isEmpty()) {
      if (documentId != null) {
        return List.of();
      }
      throw new RetrievalException(
          RetrievalException.Reason.INDEX_CORRUPT,
          "Index reports " + indexSize + " chunks but returned no match");
    }

    return matches.stream()
        .map(
            match ->
                new RetrievedContext(match.chunkId(), match.text(), rescore(queryVector, match)))
        .sorted(RetrievedContext.RANKING)
        .limit(depth)
        .toList();
  }

  private long indexSize() {
    try {
      return vectorIndex.size();
    } catch (RuntimeException e) {
      throw new RetrievalException(
          RetrievalException.Reason.INDEX_UNREACHABLE,
          "Vector index unreachable: " + e.getMessage(),
          e);
    }
  }

  private List<IndexMatch> nearest(
      float[] queryVector, int candidates, @Nullable String documentId) {
    try {
      return vectorIndex.nearest(queryVector, candidates, documentId);
    } catch (RuntimeException e) {
      throw new RetrievalException(
          RetrievalException.Reason.INDEX_UNREACHABLE,
          "Vector index unreachable: " + e.getMessage(),
          e);
    }
  }

  private double rescore(float[] queryVector, IndexMatch match) {
    if (match.embedding().length != queryVector.length) {
      return match.indexScore();
    }
    return metric.score(queryVector, match.embedding());
  }
}
