package dev.evalrag.document;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link DocumentChunk} rows. */
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID> {

  /**
   * Counts total chunks in the index.
   *
   * @return total chunk count
   */
  @Query(value = "SELECT COUNT(*) FROM document_chunks", nativeQuery = true)
  long countAllChunks();

  /**
   * Counts the chunks belonging to one document.
   *
   * @param documentId the parent document id stored in chunk metadata
   * @return chunk count for the document
   */
  @Query(
      value =
          """
            SELECT COUNT(*) FROM document_chunks WHERE metadata->>'document_id' = :documentId
            """,
      nativeQuery = true)
  long countByDocumentId(@Param("documentId") String documentId);

  /**
   * Returns the text of up to {@code limit} chunks in a stable order.
   *
   * @param limit maximum number of chunk texts
   * @return chunk texts ordered by chunk id
   */
  @Query(
      value =
          """
            SELECT text FROM document_chunks
            ORDER BY metadata->>'chunk_id'
            LIMIT :limit
            """,
      nativeQuery = true)
  List<String> findChunkTexts(@Param("limit") int limit);
}
