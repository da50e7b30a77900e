package dev.evalrag.judge;

import dev.evalrag.retrieval.RetrievedContext;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/** Renders the rubric prompt sent to the judge model. */
@Component
public class JudgePromptBuilder {

  private static final String RUBRIC =
      """
      You are an impartial evaluator of a question answering system.
      Score the ANSWER on three independent axes, each from 0.0 to 1.0.

      correctness: does the ANSWER agree with the EXPECTED ANSWER?
      - 1.0: same facts as the expected answer
      - 0.5: partially correct or incomplete
      - 0.0: wrong or contradicts the expected answer

      faithfulness: is every claim in the ANSWER supported by the CONTEXTS?
      Each unsupported claim lowers the score. Judge support only, not correctness.
      - 1.0: every claim is supported
      - 0.0: the answer is not supported at all

      context_relevance: do the CONTEXTS contain the information needed to answer the QUESTION?
      Ignore the ANSWER for this axis.
      - 1.0: the contexts contain everything needed
      - 0.0: the contexts are unrelated to the question

      Respond with a single JSON object and nothing else:
      {"correctness": <number>, "faithfulness": <number>, "context_relevance": <number>, \
      "rationale": "<one or two sentences justifying the scores>"}

      QUESTION:
      %s

      EXPECTED ANSWER:
      %s

      ANSWER:
      %s

      CONTEXTS:
      %s
      """;

  public String build(
      String question, String answer, List<RetrievedContext> contexts, String expectedAnswer) {
    return RUBRIC.formatted(question, expectedAnswer, answer, formatContexts(contexts));
  }

  private static String formatContexts(List<RetrievedContext> contexts) {
    if (contexts.isEmpty()) {
      return "(no context retrieved)";
    }
    return IntStream.range(0, contexts.size())
        .mapToObj(i -> "[" + (i + 1) + "] " + contexts.get(i).text().strip())
        .collect(Collectors.joining("\n\n"));
  }
}
