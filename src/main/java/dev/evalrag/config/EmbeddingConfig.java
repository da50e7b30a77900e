package dev.evalrag.config;

import dev.evalrag.error.ConfigurationException;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import java.time.Duration;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model and vector store beans.
 *
 * <p>The {@code LOCAL} provider runs the ONNX bge-small-en-v1.5 quantized model (384 dimensions)
 * in-process; {@code OPENAI} calls the OpenAI embeddings API with the configured dimension. The
 * {@link PgVectorEmbeddingStore} shares the application's HikariCP {@link DataSource}.
 *
 * @see dev.evalrag.retrieval.Retriever
 */
@Configuration
public class EmbeddingConfig {

    /**
     * Provides the embedding model selected by {@code evalrag.embedding.provider}.
     *
     * @param properties embedding settings
     * @param apiKey     OpenAI API key, only required for the {@code OPENAI} provider
     * @return the active embedding model
     */
    @Bean
    public EmbeddingModel embeddingModel(
            EmbeddingProperties properties,
            @Value("${evalrag.llm.api-key:}") String apiKey) {
        return switch (properties.getProvider()) {
            case LOCAL -> new BgeSmallEnV15QuantizedEmbeddingModel();
            case OPENAI -> {
                if (apiKey == null || apiKey.isBlank()) {
                    throw new ConfigurationException(
                            "OpenAI API key is required for the OPENAI embedding provider. "
                                    + "Set OPENAI_API_KEY environment variable.");
                }
                yield OpenAiEmbeddingModel.builder()
                        .apiKey(apiKey)
                        .modelName(properties.getOpenaiModel())
                        .dimensions(properties.getDimension())
                        .timeout(Duration.ofSeconds(30))
                        .build();
            }
        };
    }

    /**
     * Configures the pgvector embedding store.
     *
     * <p>Schema and index are managed by Flyway; {@code createTable} and {@code useIndex} are
     * disabled to avoid conflicts.
     *
     * @param dataSource the shared HikariCP data source (no duplicate pool)
     * @param properties embedding settings providing the vector dimension
     * @return an embedding store backed by pgvector
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(
            DataSource dataSource, EmbeddingProperties properties) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table("document_chunks")
                .dimension(properties.getDimension())
                .createTable(false)  // Schema managed by Flyway migrations
                .useIndex(false)    // HNSW index managed by Flyway V1
                .build();
    }
}
