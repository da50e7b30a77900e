package dev.evalrag.retrieval;

/** Similarity used to rank retrieved chunks. Higher is more similar for both metrics. */
public enum SimilarityMetric {
  COSINE {
    @Override
    public double score(float[] query, float[] candidate) {
      double dot = 0.0;
      double queryNorm = 0.0;
      double candidateNorm = 0.0;
      for (int i = 0; i < query.length; i++) {
        dot += (double) query[i] * candidate[i];
        queryNorm += (double) query[i] * query[i];
        candidateNorm += (double) candidate[i] * candidate[i];
      }
      if (queryNorm == 0.0 || candidateNorm == 0.0) {
        return 0.0;
      }
      return dot / (Math.sqrt(queryNorm) * Math.sqrt(candidateNorm));
    }
  },
  DOT_PRODUCT {
    @Override
    public double score(float[] query, float[] candidate) {
      double dot = 0.0;
      for (int i = 0; i < query.length; i++) {
        dot += (double) query[i] * candidate[i];
      }
      return dot;
    }
  };

  /**
   * Scores a candidate vector against the query vector.
   *
   * @param query the query embedding
   * @param candidate a chunk embedding of the same length
   * @return the similarity, higher meaning more relevant
   */
  public abstract double score(float[] query, float[] candidate);
}
