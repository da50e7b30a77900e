package dev.evalrag.judge;

import java.util.Objects;

/**
 * Scores assigned by the judge to one answer.
 *
 * <p>A valid verdict has three scores in {@code [0, 1]}. An invalid verdict has every score set to
 * {@link #UNSCORED} so it cannot be mistaken for, or averaged as, a real score.
 *
 * @param correctnessScore agreement of the answer with the expected answer
 * @param faithfulnessScore share of the answer's claims supported by the contexts
 * @param contextRelevanceScore whether the contexts hold what the question needs
 * @param rationale the judge's justification, or the reason the verdict is invalid
 * @param valid false if the judge output could not be turned into scores
 */
public record JudgeVerdict(
    double correctnessScore,
    double faithfulnessScore,
    double contextRelevanceScore,
    String rationale,
    boolean valid) {

  /** Sentinel held by every score of an invalid verdict. */
  public static final double UNSCORED = Double.NaN;

  public JudgeVerdict {
    Objects.requireNonNull(rationale, "rationale");
    if (valid) {
      requireScore("correctness", correctnessScore);
      requireScore("faithfulness", faithfulnessScore);
      requireScore("context_relevance", contextRelevanceScore);
    } else if (!Double.isNaN(correctnessScore)
        || !Double.isNaN(faithfulnessScore)
        || !Double.isNaN(contextRelevanceScore)) {
      throw new IllegalArgumentException("An invalid verdict must not carry scores");
    }
  }

  public static JudgeVerdict scored(
      double correctness, double faithfulness, double contextRelevance, String rationale) {
    return new JudgeVerdict(correctness, faithfulness, contextRelevance, rationale, true);
  }

  public static JudgeVerdict unscored(String reason) {
    return new JudgeVerdict(UNSCORED, UNSCORED, UNSCORED, reason, false);
  }

  private static void requireScore(String axis, double score) {
    if (!(score >= 0.0 && score <= 1.0)) {
      throw new IllegalArgumentException(axis + " score must be in [0, 1], got: " + score);
    }
  }
}
