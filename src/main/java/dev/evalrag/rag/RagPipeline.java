package dev.evalrag.rag;

import dev.evalrag.generation.GenerationResult;
import dev.evalrag.generation.Generator;
import dev.evalrag.generation.ModelSettings;
import dev.evalrag.generation.PromptBuilder;
import dev.evalrag.generation.PromptProperties;
import dev.evalrag.generation.PromptTemplate;
import dev.evalrag.retrieval.RetrievedContext;
import dev.evalrag.retrieval.Retriever;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;

/**
 * Retrieval-augmented answering: retrieve, build the prompt, generate.
 *
 * <p>{@link #ask(String, int)} is the serving entry point. The evaluation runner drives the same
 * two halves, {@link #retrieve} then {@link #answer}, so evaluated answers are produced exactly as
 * live ones.
 */
@Service
public class RagPipeline {

  private final Retriever retriever;
  private final PromptBuilder promptBuilder;
  private final Generator generator;
  private final PromptTemplate template;

  public RagPipeline(
      Retriever retriever,
      PromptBuilder promptBuilder,
      Generator generator,
      PromptProperties promptProperties) {
    this.retriever = retriever;
    this.promptBuilder = promptBuilder;
    this.generator = generator;
    this.template = promptProperties.toTemplate();
  }

  /**
   * Answers a question with the default generation settings.
   *
   * @param query the question
   * @param k retrieval depth
   * @return the answer with its contexts and usage metadata
   */
  public AnswerResult ask(String query, int k) {
    return ask(query, k, null);
  }

  /**
   * Answers a question from one document, or the whole index, with the default generation
   * settings.
   */
  public AnswerResult ask(String query, int k, @Nullable String documentId) {
    return ask(query, k, documentId, generator.defaultSettings());
  }

  /**
   * Answers a question.
   *
   * @param query the question
   * @param k retrieval depth
   * @param documentId restrict retrieval to one document, or {@code null}
   * @param settings generation model and failure policy
   * @return the answer with its contexts and usage metadata
   */
  public AnswerResult ask(
      String query, int k, @Nullable String documentId, ModelSettings settings) {
    return answer(query, retrieve(query, k, documentId), settings);
  }

  /** Retrieval half of {@link #ask}. */
  public List<RetrievedContext> retrieve(String query, int k, @Nullable String documentId) {
    return retriever.retrieve(query, k, documentId);
  }

  /** Generation half of {@link #ask}. */
  public AnswerResult answer(String query, List<RetrievedContext> contexts, ModelSettings settings) {
    String prompt = promptBuilder.build(query, contexts, template);
    GenerationResult generation = generator.generate(prompt, settings);
    return new AnswerResult(
        query,
        generation.text(),
        contexts,
        generation.latencyMs(),
        generation.tokenUsage(),
        generation.model());
  }
}
