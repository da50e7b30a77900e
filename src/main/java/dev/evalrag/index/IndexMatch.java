package dev.evalrag.index;

/**
 * A chunk returned by a {@link VectorIndex} search.
 *
 * @param chunkId the chunk identifier
 * @param documentId the parent document
 * @param text the chunk text
 * @param embedding the stored chunk embedding used for rescoring, empty if the index omits it
 * @param indexScore the similarity reported by the index itself
 */
public record IndexMatch(
    String chunkId, String documentId, String text, float[] embedding, double indexScore) {}
