package dev.evalrag.index;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.evalrag.document.Chunk;
import dev.evalrag.document.DocumentChunkRepository;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * {@link VectorIndex} backed by LangChain4j's pgvector {@link EmbeddingStore}.
 *
 * <p>Each chunk is stored under a name-based UUID derived from its chunk id, with {@code chunk_id},
 * {@code document_id} and {@code position_index} in the JSONB metadata. Size queries go through
 * {@link DocumentChunkRepository} because the store API has no count operation.
 */
@Component
public class PgVectorIndex implements VectorIndex {

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final DocumentChunkRepository documentChunkRepository;

  public PgVectorIndex(
      EmbeddingStore<TextSegment> embeddingStore,
      DocumentChunkRepository documentChunkRepository) {
    this.embeddingStore = embeddingStore;
    this.documentChunkRepository = documentChunkRepository;
  }

  @Override
  public void replaceDocument(String documentId, List<Chunk> chunks) {
    removeDocument(documentId);
    if (chunks.isEmpty()) {
      return;
    }
    List<String> ids = chunks.stream().map(c -> embeddingIdFor(c.id())).toList();
    List<Embedding> embeddings = chunks.stream().map(c -> Embedding.from(c.embedding())).toList();
    List<TextSegment> segments = chunks.stream().map(Chunk::toTextSegment).toList();
    embeddingStore.addAll(ids, embeddings, segments);
  }

  @Override
  public void removeDocument(String documentId) {
    embeddingStore.removeAll(metadataKey(Chunk.DOCUMENT_ID_KEY).isEqualTo(documentId));
  }

  @Override
  public List<IndexMatch> nearest(
      float[] queryEmbedding, int maxResults, @Nullable String documentId) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(queryEmbedding))
            .maxResults(maxResults)
            .minScore(0.0)
            .filter(buildFilter(documentId))
            .build();
    return embeddingStore.search(request).matches().stream().map(PgVectorIndex::toMatch).toList();
  }

  @Override
  public long size() {
    return documentChunkRepository.countAllChunks();
  }

  static String embeddingIdFor(String chunkId) {
    return UUID.nameUUIDFromBytes(chunkId.getBytes(StandardCharsets.UTF_8)).toString();
  }

  private static @Nullable Filter buildFilter(@Nullable String documentId) {
    if (documentId == null || documentId.isBlank()) {
      return null;
    }
    return metadataKey(Chunk.DOCUMENT_ID_KEY).isEqualTo(documentId);
  }

  private static IndexMatch toMatch(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = Objects.requireNonNull(match.embedded(), "stored chunk without text");
    String chunkId = segment.metadata().getString(Chunk.CHUNK_ID_KEY);
    String documentId = segment.metadata().getString(Chunk.DOCUMENT_ID_KEY);
    return new IndexMatch(
        chunkId != null ? chunkId : match.embeddingId(),
        documentId != null ? documentId : "",
        segment.text(),
        match.embedding() != null ? match.embedding().vector() : new float[0],
        match.score());
  }
}
