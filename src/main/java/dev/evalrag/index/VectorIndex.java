package dev.evalrag.index;

import dev.evalrag.document.Chunk;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Storage and nearest-neighbour search for chunk embeddings.
 *
 * <p>Implementations are external shared services reached through stateless calls. Any failure to
 * reach the backing store surfaces as a runtime exception from the called method.
 */
public interface VectorIndex {

  /**
   * Replaces every chunk of a document with the given chunks.
   *
   * @param documentId the parent document
   * @param chunks the new chunks, all belonging to {@code documentId}
   */
  void replaceDocument(String documentId, List<Chunk> chunks);

  /** Removes every chunk of a document. */
  void removeDocument(String documentId);

  /**
   * Returns up to {@code maxResults} chunks nearest to the query embedding, best first according
   * to the index's native metric.
   *
   * @param queryEmbedding the embedded query
   * @param maxResults maximum number of matches
   * @param documentId restrict the search to one document, or {@code null} for the whole index
   * @return matches with their stored embeddings
   */
  List<IndexMatch> nearest(float[] queryEmbedding, int maxResults, @Nullable String documentId);

  /** Number of chunks currently stored. */
  long size();
}
