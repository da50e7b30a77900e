package dev.evalrag.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Ingestion bookkeeping for one {@link Document}.
 *
 * <p>Stores the content hash of the last ingested version so unchanged documents are skipped and
 * changed ones have their chunks replaced. Maps to the {@code documents} table managed by Flyway.
 */
@Entity
@Table(name = "documents")
public class DocumentRecord {

  @Id
  @Column(name = "document_id")
  private String documentId;

  @Column(name = "source_uri", nullable = false)
  private String sourceUri;

  @Column(name = "content_hash", nullable = false)
  private String contentHash;

  @Column(name = "chunk_count", nullable = false)
  private int chunkCount;

  @Column(name = "ingested_at", nullable = false)
  private Instant ingestedAt;

  protected DocumentRecord() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates the record for a newly ingested document.
   *
   * @param documentId the document id
   * @param sourceUri where the document came from
   * @param contentHash SHA-256 of the cleaned text
   * @param chunkCount number of chunks written to the index
   * @param ingestedAt ingestion time
   */
  public DocumentRecord(
      String documentId, String sourceUri, String contentHash, int chunkCount, Instant ingestedAt) {
    this.documentId = documentId;
    this.sourceUri = sourceUri;
    this.contentHash = contentHash;
    this.chunkCount = chunkCount;
    this.ingestedAt = ingestedAt;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getSourceUri() {
    return sourceUri;
  }

  public String getContentHash() {
    return contentHash;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  public Instant getIngestedAt() {
    return ingestedAt;
  }

  /** Records a new ingested version of the document. */
  public void update(String sourceUri, String contentHash, int chunkCount, Instant ingestedAt) {
    this.sourceUri = sourceUri;
    this.contentHash = contentHash;
    this.chunkCount = chunkCount;
    this.ingestedAt = ingestedAt;
  }
}
