package dev.evalrag.config;

import dev.evalrag.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised embedding configuration bound from {@code evalrag.embedding.*}.
 *
 * <ul>
 *   <li>{@code provider} - {@code LOCAL} (in-process ONNX bge-small-en-v1.5) or {@code OPENAI}
 *   <li>{@code dimension} - vector length of every stored chunk; must match the pgvector column
 *   <li>{@code openai-model} - OpenAI embedding model name when the provider is {@code OPENAI}
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "evalrag.embedding")
public class EmbeddingProperties {

  /** Embedding backends. */
  public enum Provider {
    LOCAL,
    OPENAI
  }

  static final int LOCAL_DIMENSION = 384;

  private Provider provider = Provider.LOCAL;
  private int dimension = LOCAL_DIMENSION;
  private String openaiModel = "text-embedding-3-small";

  /** Validates configuration at startup. Throws if the dimension cannot match the provider. */
  @PostConstruct
  void validate() {
    if (dimension < 1) {
      throw new ConfigurationException(
          "evalrag.embedding.dimension must be positive, got: " + dimension);
    }
    if (provider == Provider.LOCAL && dimension != LOCAL_DIMENSION) {
      throw new ConfigurationException(
          "evalrag.embedding.dimension must be %d for the LOCAL provider, got: %d"
              .formatted(LOCAL_DIMENSION, dimension));
    }
  }

  public Provider getProvider() {
    return provider;
  }

  public void setProvider(Provider provider) {
    this.provider = provider;
  }

  public int getDimension() {
    return dimension;
  }

  public void setDimension(int dimension) {
    this.dimension = dimension;
  }

  public String getOpenaiModel() {
    return openaiModel;
  }

  public void setOpenaiModel(String openaiModel) {
    this.openaiModel = openaiModel;
  }
}
