package dev.evalrag.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Read-only JPA view of a row in the pgvector chunk table.
 *
 * <p>Rows are written by LangChain4j's {@code PgVectorEmbeddingStore}; the embedding column is
 * not mapped. Used for counting and for sampling chunk text when generating synthetic datasets.
 *
 * @see DocumentChunkRepository
 */
@Entity
@Table(name = "document_chunks")
public class DocumentChunk {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  protected DocumentChunk() {
    // JPA requires no-arg constructor
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }
}
