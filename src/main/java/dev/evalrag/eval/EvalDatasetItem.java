package dev.evalrag.eval;

import java.util.List;
import java.util.Objects;

/**
 * One question of an evaluation dataset with its ground truth.
 *
 * @param id unique within the dataset
 * @param question the question sent through the pipeline
 * @param expectedAnswer the reference answer the judge compares against
 * @param expectedContexts passages a perfect retriever would return, possibly empty
 */
public record EvalDatasetItem(
    String id, String question, String expectedAnswer, List<String> expectedContexts) {

  public EvalDatasetItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(question, "question");
    Objects.requireNonNull(expectedAnswer, "expectedAnswer");
    expectedContexts = expectedContexts == null ? List.of() : List.copyOf(expectedContexts);
  }
}
