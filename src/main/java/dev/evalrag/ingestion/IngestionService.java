package dev.evalrag.ingestion;

import dev.evalrag.config.EmbeddingProperties;
import dev.evalrag.document.Chunk;
import dev.evalrag.document.Document;
import dev.evalrag.document.DocumentRecord;
import dev.evalrag.document.DocumentRecordRepository;
import dev.evalrag.error.ConfigurationException;
import dev.evalrag.index.VectorIndex;
import dev.evalrag.ingestion.chunking.ChunkingOptions;
import dev.evalrag.ingestion.chunking.ChunkingProperties;
import dev.evalrag.ingestion.chunking.TextChunker;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates ingestion: document -> clean -> chunk -> embed -> vector index.
 *
 * <p>A document whose cleaned text hashes to the stored content hash is skipped. Otherwise all of
 * its chunks are embedded first and only then swapped into the index, so a failed embedding call
 * leaves the previous version of the document searchable.
 *
 * <p>Directory ingestion is best-effort: a document that fails is logged and counted, and the
 * remaining documents are still ingested. An embedding dimension mismatch is a configuration error
 * and aborts immediately.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private static final int EMBED_BATCH_SIZE = 256;

    private final TextChunker chunker;
    private final ChunkingOptions chunkingOptions;
    private final EmbeddingModel embeddingModel;
    private final int embeddingDimension;
    private final VectorIndex vectorIndex;
    private final DocumentRecordRepository documentRecordRepository;
    private final DocumentLoader documentLoader;
    private final Clock clock;

    public IngestionService(TextChunker chunker,
                            ChunkingProperties chunkingProperties,
                            EmbeddingModel embeddingModel,
                            EmbeddingProperties embeddingProperties,
                            VectorIndex vectorIndex,
                            DocumentRecordRepository documentRecordRepository,
                            DocumentLoader documentLoader,
                            Clock clock) {
        this.chunker = chunker;
        this.chunkingOptions = chunkingProperties.toOptions();
        this.embeddingModel = embeddingModel;
        this.embeddingDimension = embeddingProperties.getDimension();
        this.vectorIndex = vectorIndex;
        this.documentRecordRepository = documentRecordRepository;
        this.documentLoader = documentLoader;
        this.clock = clock;
    }

    /**
     * Ingests a single document, replacing its previous chunks when the content changed.
     *
     * @param document the document to ingest
     * @return chunks stored and whether the document was skipped as unchanged
     * @throws ConfigurationException if the embedding model returns vectors of the wrong dimension
     */
    public IngestResult ingest(Document document) {
        String text = TextCleaner.clean(document.rawText());
        String hash = ContentHasher.sha256(text);

        Optional<DocumentRecord> existing = documentRecordRepository.findById(document.id());
        if (existing.isPresent() && existing.get().getContentHash().equals(hash)) {
            log.debug("Content unchanged for {}, skipping ingestion", document.id());
            return new IngestResult(document.id(), 0, true);
        }

        // Whitespace-only spans carry nothing to embed
        List<String> texts = chunker.chunk(text, chunkingOptions).stream()
                .filter(chunk -> !chunk.isBlank())
                .toList();
        List<Chunk> chunks = embed(document, texts);
        vectorIndex.replaceDocument(document.id(), chunks);

        Instant now = clock.instant();
        if (existing.isPresent()) {
            DocumentRecord record = existing.get();
            record.update(document.sourceUri(), hash, chunks.size(), now);
            documentRecordRepository.save(record);
        } else {
            documentRecordRepository.save(new DocumentRecord(
                    document.id(), document.sourceUri(), hash, chunks.size(), now));
        }

        log.debug("Ingested {} chunks for {} ({})", chunks.size(), document.id(),
                existing.isPresent() ? "updated" : "new");
        return new IngestResult(document.id(), chunks.size(), false);
    }

    /**
     * Ingests every supported file under a directory.
     *
     * @param root the corpus directory
     * @return per-run counts, including the ids of documents that failed
     */
    public DirectoryIngestResult ingestDirectory(Path root) {
        List<Document> documents = documentLoader.loadDirectory(root);
        int ingested = 0;
        int skipped = 0;
        int chunksStored = 0;
        List<String> failed = new ArrayList<>();

        for (Document document : documents) {
            try {
                IngestResult result = ingest(document);
                if (result.skipped()) {
                    skipped++;
                } else {
                    ingested++;
                    chunksStored += result.chunksStored();
                }
            } catch (ConfigurationException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Failed to ingest {}: {}", document.id(), e.getMessage());
                failed.add(document.id());
            }
        }

        log.info("Ingestion of {} complete: {} ingested, {} unchanged, {} failed, {} chunks stored",
                root, ingested, skipped, failed.size(), chunksStored);
        return new DirectoryIngestResult(ingested, skipped, chunksStored, failed);
    }

    /**
     * Removes a document and all of its chunks.
     *
     * @param documentId the document to remove
     */
    public void removeDocument(String documentId) {
        vectorIndex.removeDocument(documentId);
        documentRecordRepository.deleteById(documentId);
    }

    private List<Chunk> embed(Document document, List<String> texts) {
        List<Chunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i += EMBED_BATCH_SIZE) {
            List<TextSegment> batch = texts.subList(i, Math.min(i + EMBED_BATCH_SIZE, texts.size()))
                    .stream()
                    .map(TextSegment::from)
                    .toList();
            List<Embedding> embeddings = embeddingModel.embedAll(batch).content();
            for (int j = 0; j < batch.size(); j++) {
                float[] vector = embeddings.get(j).vector();
                if (vector.length != embeddingDimension) {
                    throw new ConfigurationException(
                            "Embedding dimension mismatch for %s: expected %d, got %d"
                                    .formatted(document.id(), embeddingDimension, vector.length));
                }
                int position = i + j;
                chunks.add(new Chunk(
                        Chunk.idFor(document.id(), position),
                        document.id(),
                        batch.get(j).text(),
                        position,
                        vector,
                        document.metadata()));
            }
        }
        return chunks;
    }

    /**
     * Result of ingesting one document.
     *
     * @param documentId   the ingested document
     * @param chunksStored number of chunks stored (0 if skipped)
     * @param skipped      true if the content hash was unchanged
     */
    public record IngestResult(String documentId, int chunksStored, boolean skipped) {}

    /**
     * Result of ingesting a directory.
     *
     * @param documentsIngested documents that were new or changed
     * @param documentsSkipped  documents whose content was unchanged
     * @param chunksStored      total chunks written
     * @param failedDocuments   ids of documents that could not be ingested
     */
    public record DirectoryIngestResult(
            int documentsIngested,
            int documentsSkipped,
            int chunksStored,
            List<String> failedDocuments) {

        public DirectoryIngestResult {
            failedDocuments = List.copyOf(failedDocuments);
        }
    }
}
