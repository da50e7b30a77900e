package dev.evalrag.retrieval;

import dev.evalrag.error.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised retrieval configuration bound from {@code evalrag.retrieval.*}.
 *
 * <ul>
 *   <li>{@code default-k} - retrieval depth when the caller gives none (default 5)
 *   <li>{@code metric} - {@code COSINE} (default) or {@code DOT_PRODUCT}
 *   <li>{@code candidate-multiplier} - how many more candidates than {@code k} to fetch from the
 *       index before rescoring with {@code metric} (default 2, bounded [1, 10])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "evalrag.retrieval")
public class RetrievalProperties {

  private int defaultK = 5;
  private SimilarityMetric metric = SimilarityMetric.COSINE;
  private int candidateMultiplier = 2;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (defaultK < 1) {
      throw new ConfigurationException(
          "evalrag.retrieval.default-k must be at least 1, got: " + defaultK);
    }
    if (candidateMultiplier < 1 || candidateMultiplier > 10) {
      throw new ConfigurationException(
          "evalrag.retrieval.candidate-multiplier must be in [1, 10], got: "
              + candidateMultiplier);
    }
  }

  public int getDefaultK() {
    return defaultK;
  }

  public void setDefaultK(int defaultK) {
    this.defaultK = defaultK;
  }

  public SimilarityMetric getMetric() {
    return metric;
  }

  public void setMetric(SimilarityMetric metric) {
    this.metric = metric;
  }

  public int getCandidateMultiplier() {
    return candidateMultiplier;
  }

  public void setCandidateMultiplier(int candidateMultiplier) {
    this.candidateMultiplier = candidateMultiplier;
  }
}
