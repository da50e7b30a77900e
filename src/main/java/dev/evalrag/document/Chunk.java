package dev.evalrag.document;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import java.util.Map;

/**
 * One bounded span of a document, embedded and ready for the vector index.
 *
 * <p>The chunk id is derived from the document id and the position, so re-chunking the same text
 * with the same options reproduces the same ids.
 *
 * @param id {@code <documentId>#<positionIndex>}
 * @param documentId the parent document
 * @param text the chunk text
 * @param positionIndex zero-based order within the document
 * @param embedding the chunk embedding
 * @param metadata document metadata propagated to the chunk
 */
public record Chunk(
    String id,
    String documentId,
    String text,
    int positionIndex,
    float[] embedding,
    Map<String, Object> metadata) {

  public static final String CHUNK_ID_KEY = "chunk_id";
  public static final String DOCUMENT_ID_KEY = "document_id";
  public static final String POSITION_KEY = "position_index";

  public Chunk {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static String idFor(String documentId, int positionIndex) {
    return documentId + "#" + positionIndex;
  }

  /** Converts to a LangChain4j segment carrying the chunk identity in snake_case metadata keys. */
  public TextSegment toTextSegment() {
    Metadata segmentMetadata = Metadata.from(metadata);
    segmentMetadata.put(CHUNK_ID_KEY, id);
    segmentMetadata.put(DOCUMENT_ID_KEY, documentId);
    segmentMetadata.put(POSITION_KEY, positionIndex);
    return TextSegment.from(text, segmentMetadata);
  }
}
