package dev.evalrag.rag;

import dev.evalrag.generation.TokenUsage;
import dev.evalrag.retrieval.RetrievedContext;
import java.util.List;

/**
 * The outcome of one {@link RagPipeline#ask} call.
 *
 * @param query the question as asked
 * @param answerText the generated answer
 * @param contexts contexts the answer was generated from, best first
 * @param generationLatencyMs wall time of the generation step including retries
 * @param tokenUsage provider-reported token counts
 * @param model the generation model
 */
public record AnswerResult(
    String query,
    String answerText,
    List<RetrievedContext> contexts,
    long generationLatencyMs,
    TokenUsage tokenUsage,
    String model) {

  public AnswerResult {
    contexts = List.copyOf(contexts);
  }
}
