package dev.evalrag.judge;

import dev.evalrag.error.ConfigurationException;
import dev.evalrag.error.JudgeException;
import dev.evalrag.generation.Completion;
import dev.evalrag.generation.CompletionBackend;
import dev.evalrag.generation.CompletionRequest;
import dev.evalrag.generation.GenerationProperties;
import dev.evalrag.generation.ModelSettings;
import dev.evalrag.generation.ResilientCaller;
import dev.evalrag.retrieval.RetrievedContext;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * LLM-as-judge: scores an answer for correctness, faithfulness and context relevance.
 *
 * <p>The judge model is asked for a JSON verdict, which {@link JudgeResponseParser} checks
 * strictly. Calls use the generation retry and timeout policy with the judge's own rate limiter.
 */
@Service
public class Judge {

  private static final Logger log = LoggerFactory.getLogger(Judge.class);

  private final CompletionBackend backend;
  private final ResilientCaller caller;
  private final JudgePromptBuilder promptBuilder;
  private final JudgeResponseParser parser;
  private final RateLimiter rateLimiter;
  private final ModelSettings defaultSettings;

  public Judge(
      CompletionBackend backend,
      ResilientCaller caller,
      JudgePromptBuilder promptBuilder,
      JudgeResponseParser parser,
      JudgeProperties properties,
      GenerationProperties generationProperties) {
    this.backend = backend;
    this.caller = caller;
    this.promptBuilder = promptBuilder;
    this.parser = parser;
    this.rateLimiter = properties.getRateLimit().toRateLimiter("judge");
    this.defaultSettings = generationProperties.toModelSettings().withModel(properties.getModel());
  }

  /** Judge model from {@code evalrag.judge.model} with the generation retry and timeout. */
  public ModelSettings defaultSettings() {
    return defaultSettings;
  }

  /**
   * Scores an answer.
   *
   * @param question the question that was asked
   * @param answer the generated answer
   * @param contexts the contexts the answer was generated from
   * @param expectedAnswer the ground truth
   * @param settings judge model and failure policy
   * @return a valid verdict
   * @throws JudgeException if the judge output fails the schema check or every call attempt failed
   */
  public JudgeVerdict judge(
      String question,
      String answer,
      List<RetrievedContext> contexts,
      String expectedAnswer,
      ModelSettings settings) {
    String prompt = promptBuilder.build(question, answer, contexts, expectedAnswer);

    Completion completion;
    try {
      completion =
          caller.call(
              "judge",
              rateLimiter,
              settings,
              () -> backend.complete(new CompletionRequest(settings.model(), prompt, true)));
    } catch (ConfigurationException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new JudgeException("Judge call interrupted", e);
    } catch (Exception e) {
      throw new JudgeException(
          "Judge call with %s failed after %d attempt(s): %s"
              .formatted(settings.model(), settings.maxRetries() + 1, e),
          e);
    }

    JudgeVerdict verdict = parser.parse(completion.text());
    if (!verdict.valid()) {
      log.warn("Invalid judge output from {}: {}", settings.model(), verdict.rationale());
      throw new JudgeException(verdict.rationale(), completion.text());
    }
    return verdict;
  }
}
